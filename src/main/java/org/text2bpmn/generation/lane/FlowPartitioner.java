package org.text2bpmn.generation.lane;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.text2bpmn.generation.lane.models.PartitionedFlows;
import org.text2bpmn.generation.processModel.models.Element;
import org.text2bpmn.generation.processModel.models.Lane;
import org.text2bpmn.generation.processModel.models.ProcessModel;
import org.text2bpmn.generation.processModel.models.SequenceFlow;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class FlowPartitioner {
    private static final Logger LOG = LoggerFactory.getLogger(FlowPartitioner.class);

    /**
     * Splits the pool's sequence flows into flows inside one lane and flows crossing lanes.
     * A flow whose endpoint is not in any lane is treated as crossing; it is resolved (or skipped)
     * only when the merged diagram is reconnected.
     *
     * @param process the generated process
     * @return the flows grouped by lane plus the cross-lane remainder, both order-preserving
     */
    public static PartitionedFlows partition(ProcessModel process) {
        Map<String, String> laneIdByElementId = new HashMap<>();
        Map<String, List<SequenceFlow>> sameLaneFlows = new LinkedHashMap<>();

        for (Lane lane : process.pool().lanes()) {
            sameLaneFlows.put(lane.id(), new ArrayList<>());
            for (Element element : lane.elements()) {
                laneIdByElementId.put(element.id(), lane.id());
            }
        }

        List<SequenceFlow> crossLaneFlows = new ArrayList<>();
        for (SequenceFlow flow : process.pool().sequenceFlows()) {
            String sourceLane = laneIdByElementId.get(flow.sourceRef());
            String targetLane = laneIdByElementId.get(flow.targetRef());

            if (sourceLane != null && sourceLane.equals(targetLane)) {
                sameLaneFlows.get(sourceLane).add(flow);
            } else {
                if (sourceLane == null || targetLane == null) {
                    LOG.debug("Flow {} has an endpoint outside every lane ({} -> {})",
                            flow.id(), flow.sourceRef(), flow.targetRef());
                }
                crossLaneFlows.add(flow);
            }
        }

        LOG.info("Partitioned {} sequence flows: {} cross-lane", process.pool().sequenceFlows().size(),
                crossLaneFlows.size());
        return new PartitionedFlows(sameLaneFlows, crossLaneFlows);
    }
}
