package org.text2bpmn.generation.bpmn.models;

/**
 * What the merger does with a lane fragment whose lane or lane bounds cannot be resolved.
 * Applies to every fragment position alike.
 */
public enum LaneFailurePolicy {
    /** Fail the whole run. */
    ABORT,
    /** Leave the lane out of the diagram and log a warning. */
    DROP
}
