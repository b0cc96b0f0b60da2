package com.agenticanalytics.retrieval;

public class DuplicateDocumentIdException extends RetrievalException {
    private final String documentId;

    public DuplicateDocumentIdException(String documentId) {
        super("Document id already indexed: " + documentId);
        this.documentId = documentId;
    }

    public String documentId() {
        return documentId;
    }
}
