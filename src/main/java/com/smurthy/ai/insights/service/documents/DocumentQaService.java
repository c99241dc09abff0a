package com.smurthy.ai.insights.service.documents;

import java.util.List;

/**
 * Answers questions from the uploaded document collection.
 */
public interface DocumentQaService {

    /**
     * @param question    the user's question
     * @param documentIds restricts the search to these documents; empty means all documents
     */
    DocumentAnswer query(String question, List<String> documentIds);
}
