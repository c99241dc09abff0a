package com.smurthy.ai.insights.service.documents;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;
import org.springframework.retry.support.RetryTemplate;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Document Q&A over the pgvector store: retrieve the closest chunks, then ask the chat model
 * to answer from them only.
 */
public class ChatClientDocumentQaService implements DocumentQaService {

    private static final Logger log = LoggerFactory.getLogger(ChatClientDocumentQaService.class);

    static final String FILE_NAME = "file_name";

    private static final String SYSTEM_PROMPT = """
            You answer questions about clinical and contract documents.
            Use ONLY the provided document excerpts. If they do not contain the answer, say so.
            """;

    private final ChatClient chatClient;
    private final VectorStore vectorStore;
    private final RetryTemplate retryTemplate;
    private final int topK;
    private final double similarityThreshold;

    public ChatClientDocumentQaService(ChatClient.Builder chatClientBuilder, VectorStore vectorStore,
                                       RetryTemplate retryTemplate, int topK, double similarityThreshold) {
        this.chatClient = chatClientBuilder.defaultSystem(SYSTEM_PROMPT).build();
        this.vectorStore = vectorStore;
        this.retryTemplate = retryTemplate;
        this.topK = topK;
        this.similarityThreshold = similarityThreshold;
    }

    @Override
    public DocumentAnswer query(String question, List<String> documentIds) {
        try {
            List<Document> documents = vectorStore.similaritySearch(searchRequest(question, documentIds));
            if (documents == null || documents.isEmpty()) {
                return DocumentAnswer.answered("No documents available to query.", List.of());
            }
            log.info("Querying {} document chunk(s) with question: {}", documents.size(), question);

            String context = documents.stream()
                    .map(Document::getText)
                    .collect(Collectors.joining("\n---\n"));

            String answer = retryTemplate.execute(retryContext -> chatClient.prompt()
                    .user(user -> user.text("""
                            Question: {question}

                            Documents:
                            {context}
                            """)
                            .param("question", question)
                            .param("context", context))
                    .call()
                    .content());

            List<String> sources = documents.stream()
                    .map(doc -> doc.getMetadata().get(FILE_NAME))
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .distinct()
                    .toList();
            return DocumentAnswer.answered(answer, sources);

        } catch (Exception e) {
            log.error("Error querying documents: {}", e.getMessage(), e);
            return DocumentAnswer.failed(e.getMessage());
        }
    }

    private SearchRequest searchRequest(String question, List<String> documentIds) {
        SearchRequest.Builder builder = SearchRequest.builder()
                .query(question)
                .topK(topK)
                .similarityThreshold(similarityThreshold);
        if (documentIds != null && !documentIds.isEmpty()) {
            FilterExpressionBuilder filter = new FilterExpressionBuilder();
            builder.filterExpression(filter.in(FILE_NAME, documentIds.toArray()).build());
        }
        return builder.build();
    }
}
