package org.text2bpmn.generation.exceptions;

/**
 * Raised when the generated process JSON is malformed or misses a required field.
 */
public class SchemaException extends BpmnGenerationException {
    public SchemaException(String message) {
        super(ErrorKind.SCHEMA, message);
    }

    public SchemaException(String message, Throwable cause) {
        super(ErrorKind.SCHEMA, message, cause);
    }
}
