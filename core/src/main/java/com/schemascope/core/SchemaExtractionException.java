package com.schemascope.core;

/**
 * Fatal failure while reading catalog metadata. No partial snapshot survives one of these.
 */
public class SchemaExtractionException extends Exception {
    private final ExtractionStage stage;

    public SchemaExtractionException(ExtractionStage stage, String target, Throwable cause) {
        super(stage.description() + " for " + target + ": " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public ExtractionStage getStage() {
        return stage;
    }
}
