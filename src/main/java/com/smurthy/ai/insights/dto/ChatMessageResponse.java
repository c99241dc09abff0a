package com.smurthy.ai.insights.dto;

import java.time.Instant;
import java.util.List;

/**
 * Chat reply. {@code responses} holds every message in display order; {@code response} is
 * the same content joined into one text for clients that show a single bubble.
 */
public record ChatMessageResponse(
        String response,
        List<String> responses,
        String sessionId,
        Instant timestamp
) {

    public static ChatMessageResponse of(List<String> messages, String sessionId, Instant timestamp) {
        return new ChatMessageResponse(String.join("\n\n", messages), messages, sessionId, timestamp);
    }
}
