package com.agenticanalytics.retrieval;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChunkType {
    TABLE("table"),
    COLUMN("column"),
    METRIC("metric"),
    RELATIONSHIP("relationship"),
    QUERY("query"),
    OTHER("other");

    private final String value;

    ChunkType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ChunkType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return OTHER;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        // sample queries are labelled "example" by some chunkers
        if ("example".equals(normalized)) {
            return QUERY;
        }
        for (ChunkType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
