package com.agenticanalytics.agent;

import com.fasterxml.jackson.databind.JsonNode;

public record GeneratedAnswer(String generatedQuery, JsonNode resultPayload, String answer, boolean cacheable) {
    public GeneratedAnswer(String generatedQuery, JsonNode resultPayload, String answer) {
        this(generatedQuery, resultPayload, answer, true);
    }
}
