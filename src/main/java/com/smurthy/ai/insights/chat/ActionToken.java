package com.smurthy.ai.insights.chat;

import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A follow-up command embedded in a reply as a Markdown link, e.g.
 * {@code [Fetch external data](#fetch-external:Smith%20J)}. The chat client renders it as a
 * button and, when clicked, sends {@link #followUpMessage()} back through the dispatcher.
 */
public record ActionToken(Kind kind, String parameter) {

    private static final Pattern TOKEN_PATTERN =
            Pattern.compile("#(lookup-address|fetch-external|update-internal):([^)\\s]+)");

    public enum Kind {
        LOOKUP_ADDRESS("lookup-address", "What is the address of %s?"),
        FETCH_EXTERNAL("fetch-external", "Fetch external data for %s"),
        UPDATE_INTERNAL("update-internal", "Update internal data for %s");

        private final String code;
        private final String followUpTemplate;

        Kind(String code, String followUpTemplate) {
            this.code = code;
            this.followUpTemplate = followUpTemplate;
        }

        public String code() {
            return code;
        }

        static Kind fromCode(String code) {
            return Arrays.stream(values())
                    .filter(kind -> kind.code.equals(code))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown action: " + code));
        }
    }

    public static ActionToken lookupAddress(String organizationName) {
        return new ActionToken(Kind.LOOKUP_ADDRESS, organizationName);
    }

    public static ActionToken fetchExternal(String authorName) {
        return new ActionToken(Kind.FETCH_EXTERNAL, authorName);
    }

    public static ActionToken updateInternal(String authorName) {
        return new ActionToken(Kind.UPDATE_INTERNAL, authorName);
    }

    /**
     * Finds the first action token in the text. A token with invalid percent-encoding is ignored.
     */
    public static Optional<ActionToken> find(String text) {
        Matcher matcher = TOKEN_PATTERN.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            String parameter = UriUtils.decode(matcher.group(2), StandardCharsets.UTF_8);
            return Optional.of(new ActionToken(Kind.fromCode(matcher.group(1)), parameter));
        } catch (IllegalArgumentException e) {
            // malformed percent-encoding, not a token we issued
            return Optional.empty();
        }
    }

    public String href() {
        return "#" + kind.code + ":" + UriUtils.encode(parameter, StandardCharsets.UTF_8);
    }

    /**
     * Renders the token as a Markdown link with the given label.
     */
    public String toMarkdown(String label) {
        return "[" + label + "](" + href() + ")";
    }

    /**
     * The chat message that triggers this action when sent back to the dispatcher.
     */
    public String followUpMessage() {
        return String.format(kind.followUpTemplate, parameter);
    }
}
