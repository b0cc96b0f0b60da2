package com.agenticanalytics.cache;

public enum StoreOutcome {
    STORED,
    STORED_NOT_PERSISTED,
    SKIPPED_DUPLICATE
}
