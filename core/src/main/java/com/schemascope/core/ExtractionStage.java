package com.schemascope.core;

/**
 * Where in a run an extraction failure happened.
 */
public enum ExtractionStage {
    LIST_TABLES("listing tables"),
    LIST_COLUMNS("listing columns"),
    DECODE_COLUMN("decoding column row"),
    LIST_COLLECTIONS("listing collections");

    private final String description;

    ExtractionStage(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
