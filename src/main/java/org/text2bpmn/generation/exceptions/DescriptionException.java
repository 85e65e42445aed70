package org.text2bpmn.generation.exceptions;

/**
 * Raised when the process description input is missing or unusable.
 */
public class DescriptionException extends BpmnGenerationException {
    public DescriptionException(String message) {
        super(ErrorKind.DESCRIPTION, message);
    }

    public DescriptionException(String message, Throwable cause) {
        super(ErrorKind.DESCRIPTION, message, cause);
    }
}
