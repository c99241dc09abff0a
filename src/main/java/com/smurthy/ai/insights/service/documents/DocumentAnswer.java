package com.smurthy.ai.insights.service.documents;

import java.util.List;

/**
 * Answer from the document Q&A service.
 *
 * @param sources names of the documents the answer was grounded on
 * @param error   failure description when {@code success} is false
 */
public record DocumentAnswer(
        boolean success,
        String answer,
        List<String> sources,
        String error
) {

    public static DocumentAnswer answered(String answer, List<String> sources) {
        return new DocumentAnswer(true, answer, sources, null);
    }

    public static DocumentAnswer failed(String error) {
        return new DocumentAnswer(false, "", List.of(), error);
    }
}
