package org.text2bpmn.generation.exceptions;

/**
 * Raised when the auto-layout step fails. Always fatal for the run.
 */
public class LayoutException extends BpmnGenerationException {

    public enum Reason {
        TOOL_UNAVAILABLE,
        TIMEOUT,
        CORRUPTED_OUTPUT,
        FAILED
    }

    private final Reason reason;

    public LayoutException(Reason reason, String message) {
        super(ErrorKind.LAYOUT, message);
        this.reason = reason;
    }

    public LayoutException(Reason reason, String message, Throwable cause) {
        super(ErrorKind.LAYOUT, message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
