package com.agenticanalytics.observability;

public enum OperationType {
    EMBEDDING("embedding"),
    RETRIEVAL("retrieval"),
    RERANKING("reranking"),
    CACHE_LOOKUP("cache_lookup"),
    CACHE_STORE("cache_store"),
    TOTAL_REQUEST("total_request");

    private final String value;

    OperationType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
