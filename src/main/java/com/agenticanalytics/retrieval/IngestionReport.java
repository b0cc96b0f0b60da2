package com.agenticanalytics.retrieval;

import java.util.List;

public record IngestionReport(int documentsIngested, int totalDocuments, long durationMs, List<String> errors) {
    public boolean success() {
        return errors.isEmpty();
    }
}
