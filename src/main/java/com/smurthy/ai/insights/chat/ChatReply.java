package com.smurthy.ai.insights.chat;

import java.util.ArrayList;
import java.util.List;

/**
 * What a handler sends back: either one message, or several messages to be shown
 * in order (for example a result followed by an action link).
 */
public sealed interface ChatReply permits ChatReply.Text, ChatReply.Messages {

    /**
     * The reply as an ordered list of messages.
     */
    List<String> messages();

    static ChatReply text(String message) {
        return new Text(message);
    }

    static ChatReply messages(String first, String... rest) {
        List<String> all = new ArrayList<>();
        all.add(first);
        all.addAll(List.of(rest));
        return new Messages(List.copyOf(all));
    }

    record Text(String message) implements ChatReply {
        @Override
        public List<String> messages() {
            return List.of(message);
        }
    }

    record Messages(List<String> messages) implements ChatReply {
        public Messages {
            if (messages.isEmpty()) {
                throw new IllegalArgumentException("A multi-message reply needs at least one message");
            }
            messages = List.copyOf(messages);
        }
    }
}
