package org.text2bpmn.generation.processModel.models;

import lombok.Builder;

/**
 * A flow node of the generated process.
 *
 * @param id               unique within the whole process
 * @param type             the node kind
 * @param name             label, may be empty
 * @param eventType        for events: "none", "message", "timer", "error", "conditional" (nullable)
 * @param gatewayDirection for gateways: "diverging" or "converging" (nullable)
 * @param mock             true when inserted by the lane normalizer; such nodes never reach the final diagram
 */
@Builder
public record Element(
        String id,
        ElementType type,
        String name,
        String eventType,
        String gatewayDirection,
        boolean mock
) {
    public Element(String id, ElementType type, String name) {
        this(id, type, name, null, null, false);
    }
}
