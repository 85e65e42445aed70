package org.text2bpmn.generation.exceptions;

/**
 * Raised when the generative service call itself fails.
 */
public class GenerationServiceException extends BpmnGenerationException {
    public GenerationServiceException(String message) {
        super(ErrorKind.SERVICE, message);
    }

    public GenerationServiceException(String message, Throwable cause) {
        super(ErrorKind.SERVICE, message, cause);
    }
}
