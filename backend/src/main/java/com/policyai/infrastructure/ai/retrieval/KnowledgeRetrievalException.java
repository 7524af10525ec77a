package com.policyai.infrastructure.ai.retrieval;

public class KnowledgeRetrievalException extends RuntimeException {

    public KnowledgeRetrievalException(String message) {
        super(message);
    }

    public KnowledgeRetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
