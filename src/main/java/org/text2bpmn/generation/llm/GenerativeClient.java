package org.text2bpmn.generation.llm;

import org.text2bpmn.generation.exceptions.GenerationServiceException;

import java.util.Map;

/**
 * A text generation service driven by named prompt templates.
 */
public interface GenerativeClient {

    /**
     * Renders the prompt registered under {@code promptKey} with the given variables and
     * returns the service's raw answer.
     *
     * @throws GenerationServiceException if the service cannot be reached or returns no text
     */
    String render(String promptKey, Map<String, String> variables);
}
