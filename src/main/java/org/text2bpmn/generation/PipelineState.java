package org.text2bpmn.generation;

/**
 * Progress of one generation run. {@code FAILED} is reachable from every other state.
 */
public enum PipelineState {
    INIT,
    JSON_GENERATED,
    PARTITIONED,
    LANES_NORMALIZED,
    LANES_RENDERED,
    MERGED,
    FLOWS_ADDED,
    POOL_WRAPPED,
    DONE,
    FAILED
}
