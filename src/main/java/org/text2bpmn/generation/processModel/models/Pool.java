package org.text2bpmn.generation.processModel.models;

import java.util.List;

public record Pool(
        String id,
        String name,
        List<Lane> lanes,
        List<SequenceFlow> sequenceFlows // global list, before partitioning
) {
    public Pool {
        lanes = lanes == null ? List.of() : List.copyOf(lanes);
        sequenceFlows = sequenceFlows == null ? List.of() : List.copyOf(sequenceFlows);
    }
}
