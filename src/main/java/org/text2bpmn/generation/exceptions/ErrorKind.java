package org.text2bpmn.generation.exceptions;

/**
 * Failure categories reported by the generation pipeline and the CLI.
 */
public enum ErrorKind {
    SCHEMA("Schema error"),
    RENDER("Render error"),
    VALIDATION("Validation error"),
    LAYOUT("Layout error"),
    MERGE("Merge error"),
    SERVICE("Generation service error"),
    DESCRIPTION("Description error"),
    CONFIGURATION("Configuration error");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
