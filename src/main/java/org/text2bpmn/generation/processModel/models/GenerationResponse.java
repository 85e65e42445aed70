package org.text2bpmn.generation.processModel.models;

/**
 * The full answer of the process generation prompt: the process plus the model's own
 * account of how it checked the required elements.
 */
public record GenerationResponse(
        ProcessModel process,
        String reasoning
) {}
