package org.text2bpmn.generation.processModel.models;

import java.util.List;

public record Lane(
        String id,
        String name,
        int order,
        List<Element> elements,
        List<SequenceFlow> sequenceFlows // filled by the partitioner/normalizer, empty as generated
) {
    public Lane {
        elements = elements == null ? List.of() : List.copyOf(elements);
        sequenceFlows = sequenceFlows == null ? List.of() : List.copyOf(sequenceFlows);
    }

    public Lane(String id, String name, int order, List<Element> elements) {
        this(id, name, order, elements, List.of());
    }

    public Lane withElementsAndFlows(List<Element> newElements, List<SequenceFlow> flows) {
        return new Lane(id, name, order, newElements, flows);
    }
}
