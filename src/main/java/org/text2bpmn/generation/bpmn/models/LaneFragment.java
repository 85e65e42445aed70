package org.text2bpmn.generation.bpmn.models;

import org.text2bpmn.generation.processModel.models.Element;
import org.text2bpmn.generation.processModel.models.Lane;
import org.text2bpmn.generation.processModel.models.SequenceFlow;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A laid-out lane document paired with the normalized lane it was rendered from.
 *
 * @param lane the normalized lane, carrying the mock markers
 * @param xml  the lane's BPMN document, with diagram interchange
 */
public record LaneFragment(
        Lane lane,
        String xml
) {
    /**
     * Ids of the elements and flows the normalizer inserted into this lane.
     */
    public Set<String> mockIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Element element : lane.elements()) {
            if (element.mock()) {
                ids.add(element.id());
            }
        }
        for (SequenceFlow flow : lane.sequenceFlows()) {
            if (flow.mock()) {
                ids.add(flow.id());
            }
        }
        return ids;
    }
}
