package org.text2bpmn.generation.exceptions;

/**
 * Raised when lane fragments cannot be assembled into one diagram.
 */
public class MergeException extends BpmnGenerationException {
    public MergeException(String message) {
        super(ErrorKind.MERGE, message);
    }

    public MergeException(String message, Throwable cause) {
        super(ErrorKind.MERGE, message, cause);
    }
}
