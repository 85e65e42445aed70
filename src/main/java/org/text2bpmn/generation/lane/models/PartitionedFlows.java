package org.text2bpmn.generation.lane.models;

import org.text2bpmn.generation.processModel.models.SequenceFlow;

import java.util.List;
import java.util.Map;

/**
 * Result of splitting the pool's global sequence flows by lane.
 *
 * @param sameLaneFlows  lane id to the flows whose both endpoints live in that lane, in input order
 * @param crossLaneFlows flows between lanes or with an endpoint outside every lane, in input order
 */
public record PartitionedFlows(
        Map<String, List<SequenceFlow>> sameLaneFlows,
        List<SequenceFlow> crossLaneFlows
) {
    public List<SequenceFlow> flowsOf(String laneId) {
        return sameLaneFlows.getOrDefault(laneId, List.of());
    }
}
