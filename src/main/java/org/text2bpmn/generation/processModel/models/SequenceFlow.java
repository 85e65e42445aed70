package org.text2bpmn.generation.processModel.models;

/**
 * Represents a sequence flow between two elements of the process.
 *
 * @param id                  the unique identifier of the sequence flow
 * @param sourceRef           id of the source element
 * @param targetRef           id of the target element
 * @param name                condition label for gateway branches (nullable)
 * @param conditionExpression condition for exclusive branches (nullable)
 * @param mock                true when synthesized by the lane normalizer
 */
public record SequenceFlow(
        String id,
        String sourceRef,
        String targetRef,
        String name,
        String conditionExpression,
        boolean mock
) {
    // Constructor for plain unconditional flows
    public SequenceFlow(String id, String sourceRef, String targetRef) {
        this(id, sourceRef, targetRef, null, null, false);
    }
}
