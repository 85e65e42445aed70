package org.text2bpmn.generation.exceptions;

/**
 * Raised when a fragment or the merged document fails the BPMN sanity checks.
 */
public class ValidationException extends BpmnGenerationException {
    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
