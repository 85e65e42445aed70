package org.text2bpmn.generation.exceptions;

/**
 * Raised when configuration is invalid or missing.
 */
public class ConfigurationException extends BpmnGenerationException {
    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
