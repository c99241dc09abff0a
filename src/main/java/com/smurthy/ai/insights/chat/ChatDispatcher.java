package com.smurthy.ai.insights.chat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Routes chat messages to intent handlers.
 *
 * Handlers are evaluated strictly in registration order and the first one whose matcher
 * succeeds handles the message; later handlers are not consulted. Messages nobody matches go
 * to the fallback handler. Exceptions thrown by a handler reach the caller unchanged.
 */
public class ChatDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ChatDispatcher.class);

    private final List<IntentHandler> handlers;
    private final FallbackHandler fallbackHandler;

    public ChatDispatcher(List<IntentHandler> handlers, FallbackHandler fallbackHandler) {
        this.handlers = new CopyOnWriteArrayList<>(handlers);
        this.fallbackHandler = fallbackHandler;
        log.info("ChatDispatcher initialized with {} handlers in order: {}",
                handlers.size(), handlers.stream().map(IntentHandler::getIntentName).toList());
    }

    public ChatReply dispatch(String message) {
        for (IntentHandler handler : handlers) {
            Optional<MatchResult> params = handler.matches(message);
            if (params.isPresent()) {
                log.info("Routing message ({} chars) to {}", message.length(), handler.getIntentName());
                log.debug("Message '{}' matched {} with {}", message, handler.getIntentName(), params.get().asMap());
                return handler.handle(params.get());
            }
        }

        log.debug("No intent matched '{}', using fallback", message);
        return fallbackHandler.handle(message);
    }

    /**
     * Appends a handler at the lowest priority. A handler that is already registered is ignored.
     */
    public synchronized void register(IntentHandler handler) {
        if (handlers.contains(handler)) {
            log.debug("Handler {} already registered", handler.getIntentName());
            return;
        }
        handlers.add(handler);
        log.info("Registered handler {} at position {}", handler.getIntentName(), handlers.size());
    }

    public List<IntentHandler> getHandlers() {
        return List.copyOf(handlers);
    }
}
