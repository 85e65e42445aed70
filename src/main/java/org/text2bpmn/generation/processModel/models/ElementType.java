package org.text2bpmn.generation.processModel.models;

/**
 * Flow node kinds supported in a generated process, keyed by their JSON name
 * (which is also the BPMN element local name, except for {@link #INTERMEDIATE_EVENT}).
 */
public enum ElementType {
    START_EVENT("startEvent"),
    END_EVENT("endEvent"),
    INTERMEDIATE_EVENT("intermediateEvent"),
    TASK("task"),
    EXCLUSIVE_GATEWAY("exclusiveGateway"),
    INCLUSIVE_GATEWAY("inclusiveGateway"),
    PARALLEL_GATEWAY("parallelGateway");

    private final String jsonName;

    ElementType(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }

    public boolean isEvent() {
        return this == START_EVENT || this == END_EVENT || this == INTERMEDIATE_EVENT;
    }

    public boolean isGateway() {
        return this == EXCLUSIVE_GATEWAY || this == INCLUSIVE_GATEWAY || this == PARALLEL_GATEWAY;
    }

    public static ElementType fromJsonName(String jsonName) {
        for (ElementType type : values()) {
            if (type.jsonName.equals(jsonName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown element type: " + jsonName);
    }
}
