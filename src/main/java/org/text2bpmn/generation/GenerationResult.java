package org.text2bpmn.generation;

/**
 * @param bpmnXml   the final diagram
 * @param reasoning the generative service's explanation of the process structure
 */
public record GenerationResult(
        String bpmnXml,
        String reasoning
) {
}
