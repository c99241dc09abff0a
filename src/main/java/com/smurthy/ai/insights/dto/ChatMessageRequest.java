package com.smurthy.ai.insights.dto;

/**
 * Incoming chat message. {@code sessionId} is optional; a new one is issued when absent.
 */
public record ChatMessageRequest(String message, String sessionId) {
}
