package org.text2bpmn.generation.lane;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.text2bpmn.generation.processModel.models.Element;
import org.text2bpmn.generation.processModel.models.ElementType;
import org.text2bpmn.generation.processModel.models.Lane;
import org.text2bpmn.generation.processModel.models.SequenceFlow;

import java.util.ArrayList;
import java.util.List;

/**
 * Makes a lane renderable on its own: every lane fragment needs exactly one start and one
 * end event. Missing ones are added as mock elements, which the merger removes again.
 */
public class LaneNormalizer {
    private static final Logger LOG = LoggerFactory.getLogger(LaneNormalizer.class);

    public static final String MOCK_START_EVENT_ID = "mock_start_event";
    public static final String MOCK_END_EVENT_ID = "mock_end_event";
    public static final String MOCK_START_FLOW_ID = "mock_start_event_flow";
    public static final String MOCK_END_FLOW_ID = "mock_end_event_flow";

    /**
     * Attaches the lane's own flows and adds mock start/end events where missing.
     * Only one mock of each kind is ever added, so normalizing twice changes nothing.
     *
     * @param lane          the lane as generated
     * @param sameLaneFlows flows whose endpoints both live in this lane
     * @return the normalized lane
     */
    public static Lane normalize(Lane lane, List<SequenceFlow> sameLaneFlows) {
        List<Element> elements = new ArrayList<>(lane.elements());
        List<SequenceFlow> flows = new ArrayList<>(sameLaneFlows);

        if (!hasElementOfType(elements, ElementType.START_EVENT)) {
            Element mockStart = Element.builder()
                    .id(MOCK_START_EVENT_ID)
                    .type(ElementType.START_EVENT)
                    .name("")
                    .eventType("none")
                    .mock(true)
                    .build();
            if (!elements.isEmpty()) {
                flows.add(0, new SequenceFlow(MOCK_START_FLOW_ID, MOCK_START_EVENT_ID, elements.get(0).id(),
                        null, null, true));
            }
            elements.add(0, mockStart);
            LOG.debug("Lane {} has no start event, added {}", lane.id(), MOCK_START_EVENT_ID);
        }

        if (!hasElementOfType(elements, ElementType.END_EVENT)) {
            Element mockEnd = Element.builder()
                    .id(MOCK_END_EVENT_ID)
                    .type(ElementType.END_EVENT)
                    .name("")
                    .eventType("none")
                    .mock(true)
                    .build();
            Element last = elements.get(elements.size() - 1);
            flows.add(new SequenceFlow(MOCK_END_FLOW_ID, last.id(), MOCK_END_EVENT_ID, null, null, true));
            elements.add(mockEnd);
            LOG.debug("Lane {} has no end event, added {}", lane.id(), MOCK_END_EVENT_ID);
        }

        return lane.withElementsAndFlows(elements, flows);
    }

    private static boolean hasElementOfType(List<Element> elements, ElementType type) {
        return elements.stream().anyMatch(element -> element.type() == type);
    }
}
