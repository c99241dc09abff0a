package com.smurthy.ai.insights.controllers;

import com.smurthy.ai.insights.chat.ChatDispatcher;
import com.smurthy.ai.insights.chat.ChatReply;
import com.smurthy.ai.insights.dto.ChatMessageRequest;
import com.smurthy.ai.insights.dto.ChatMessageResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Chat endpoint in front of the intent dispatcher.
 */
@RestController
@RequestMapping("/api/v1/chat")
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    static final int MAX_MESSAGE_LENGTH = 1000;

    private static final Pattern UUID_PATTERN =
            Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

    private final ChatDispatcher chatDispatcher;
    private final Clock clock;

    public ChatController(ChatDispatcher chatDispatcher, Clock clock) {
        this.chatDispatcher = chatDispatcher;
        this.clock = clock;
    }

    /**
     * Example: POST /api/v1/chat/message {"message": "top 3 HCOs with highest ghost patients"}
     */
    @PostMapping("/message")
    public ChatMessageResponse sendMessage(@RequestBody ChatMessageRequest request) {
        String message = validateMessage(request.message());
        String sessionId = resolveSessionId(request.sessionId());
        log.info("Chat message for session {} ({} chars)", sessionId, message.length());

        ChatReply reply = chatDispatcher.dispatch(message);
        return ChatMessageResponse.of(reply.messages(), sessionId, clock.instant());
    }

    /**
     * Example: GET /api/v1/chat/ask?q=show contract templates
     */
    @GetMapping("/ask")
    public ChatMessageResponse ask(@RequestParam("q") String question) {
        String message = validateMessage(question);
        ChatReply reply = chatDispatcher.dispatch(message);
        return ChatMessageResponse.of(reply.messages(), UUID.randomUUID().toString(), clock.instant());
    }

    private static String validateMessage(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be empty or only whitespace");
        }
        String stripped = message.strip();
        if (stripped.length() > MAX_MESSAGE_LENGTH) {
            throw new IllegalArgumentException("message cannot exceed " + MAX_MESSAGE_LENGTH + " characters");
        }
        return stripped;
    }

    private static String resolveSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return UUID.randomUUID().toString();
        }
        if (!UUID_PATTERN.matcher(sessionId).matches()) {
            throw new IllegalArgumentException("sessionId must be a valid UUID");
        }
        return sessionId;
    }
}
