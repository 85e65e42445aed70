package org.text2bpmn.generation.exceptions;

/**
 * Raised when a lane cannot be rendered, e.g. the answer lacks its delimiter tag.
 */
public class RenderException extends BpmnGenerationException {
    public RenderException(String message) {
        super(ErrorKind.RENDER, message);
    }

    public RenderException(String message, Throwable cause) {
        super(ErrorKind.RENDER, message, cause);
    }
}
