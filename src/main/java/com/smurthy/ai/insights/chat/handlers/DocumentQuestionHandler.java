package com.smurthy.ai.insights.chat.handlers;

import com.smurthy.ai.insights.chat.ChatReply;
import com.smurthy.ai.insights.chat.IntentHandler;
import com.smurthy.ai.insights.chat.MatchResult;
import com.smurthy.ai.insights.service.documents.DocumentAnswer;
import com.smurthy.ai.insights.service.documents.DocumentQaService;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Questions about the uploaded documents, answered by the document Q&A service.
 *
 * Examples:
 * - "What do the documents say about CRS management?"
 * - "Summarize the contract PDF"
 */
public class DocumentQuestionHandler implements IntentHandler {

    public static final String QUESTION = "question";

    private static final Pattern PATTERN = Pattern.compile(
            "(?:what|how|which|who|when|why|does|do|summari[sz]e|explain|search|find|according)"
                    + ".*\\b(?:pdfs?|documents?|docs|knowledge\\s+base)\\b"
                    + "|\\b(?:pdfs?|documents?|docs)\\b.*\\b(?:say|says|mention|mentions|describe|about)\\b",
            Pattern.CASE_INSENSITIVE);

    private final DocumentQaService documentQaService;

    public DocumentQuestionHandler(DocumentQaService documentQaService) {
        this.documentQaService = documentQaService;
    }

    @Override
    public String getIntentName() {
        return "DocumentQuestion";
    }

    @Override
    public Optional<MatchResult> matches(String message) {
        if (!PATTERN.matcher(message).find()) {
            return Optional.empty();
        }
        return Optional.of(MatchResult.of(QUESTION, message.strip()));
    }

    @Override
    public ChatReply handle(MatchResult params) {
        DocumentAnswer answer = documentQaService.query(params.getString(QUESTION), List.of());
        if (!answer.success()) {
            return ChatReply.text("I couldn't search the documents right now: " + answer.error());
        }

        StringBuilder text = new StringBuilder(answer.answer());
        if (!answer.sources().isEmpty()) {
            text.append("\n\n**Sources:**");
            answer.sources().forEach(source -> text.append("\n- ").append(source));
        }
        return ChatReply.text(text.toString());
    }
}
