package org.text2bpmn.generation.exceptions;

/**
 * Base class of every failure raised while turning a process description into a diagram.
 * Each subclass maps to exactly one {@link ErrorKind}.
 */
public abstract class BpmnGenerationException extends RuntimeException {
    private final ErrorKind kind;

    protected BpmnGenerationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected BpmnGenerationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
