package com.agenticanalytics.retrieval;

public class EmbeddingException extends RetrievalException {
    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
