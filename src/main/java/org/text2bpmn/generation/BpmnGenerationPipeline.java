package org.text2bpmn.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.text2bpmn.generation.bpmn.BpmnFragmentValidator;
import org.text2bpmn.generation.bpmn.LaneDiagramMerger;
import org.text2bpmn.generation.bpmn.models.LaneFragment;
import org.text2bpmn.generation.config.models.PipelineConfig;
import org.text2bpmn.generation.exceptions.BpmnGenerationException;
import org.text2bpmn.generation.exceptions.ErrorKind;
import org.text2bpmn.generation.exceptions.GenerationServiceException;
import org.text2bpmn.generation.exceptions.RenderException;
import org.text2bpmn.generation.exceptions.SchemaException;
import org.text2bpmn.generation.lane.FlowPartitioner;
import org.text2bpmn.generation.lane.LaneNormalizer;
import org.text2bpmn.generation.lane.models.PartitionedFlows;
import org.text2bpmn.generation.layout.LayoutEngine;
import org.text2bpmn.generation.layout.LayoutHelper;
import org.text2bpmn.generation.llm.GenerativeClient;
import org.text2bpmn.generation.llm.PromptHelper;
import org.text2bpmn.generation.processModel.ProcessModelHelper;
import org.text2bpmn.generation.processModel.models.GenerationResponse;
import org.text2bpmn.generation.processModel.models.Lane;
import org.text2bpmn.generation.processModel.models.ProcessModel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Turns a process description into a laned BPMN diagram:
 * process JSON, then one rendered and laid-out document per lane, then one merged pool.
 * <p>
 * A pipeline instance runs one generation at a time.
 */
public class BpmnGenerationPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(BpmnGenerationPipeline.class);

    private final GenerativeClient client;
    private final LayoutEngine layoutEngine;
    private final PipelineConfig config;

    private volatile PipelineState state = PipelineState.INIT;
    private volatile ErrorKind failureKind;

    public BpmnGenerationPipeline(GenerativeClient client, LayoutEngine layoutEngine, PipelineConfig config) {
        this.client = client;
        this.layoutEngine = layoutEngine;
        this.config = config;
    }

    public PipelineState getState() {
        return state;
    }

    /**
     * @return the kind of the failure that ended the last run, or {@code null} when the run
     * succeeded or ended with an unexpected error
     */
    public ErrorKind getFailureKind() {
        return failureKind;
    }

    /**
     * Runs the whole pipeline.
     *
     * @param description validated process description
     * @throws BpmnGenerationException of the kind that ended the run
     */
    public synchronized GenerationResult generate(String description) {
        state = PipelineState.INIT;
        failureKind = null;
        try {
            // 1. Process JSON
            GenerationResponse response = generateProcessJson(description);
            ProcessModel process = response.process();
            advance(PipelineState.JSON_GENERATED);

            // 2. Split flows into per-lane and cross-lane
            PartitionedFlows flows = FlowPartitioner.partition(process);
            advance(PipelineState.PARTITIONED);

            // 3. Give every lane a start and an end
            List<Lane> lanes = normalizeLanes(process, flows);
            advance(PipelineState.LANES_NORMALIZED);

            // 4. Render and lay out each lane
            List<LaneFragment> fragments = renderLanes(process, lanes);
            advance(PipelineState.LANES_RENDERED);

            // 5. Stack lanes
            String xml = new LaneDiagramMerger(config.laneFailurePolicy).mergeLanes(fragments);
            advance(PipelineState.MERGED);

            // 6. Connect lanes
            xml = LaneDiagramMerger.addCrossLaneFlows(xml, flows.crossLaneFlows());
            advance(PipelineState.FLOWS_ADDED);

            // 7. Pool
            xml = LaneDiagramMerger.addPool(xml, poolName(process));
            advance(PipelineState.POOL_WRAPPED);

            // 8. Final checks
            BpmnFragmentValidator.validate(xml);
            if (config.strictSchemaValidation) {
                BpmnFragmentValidator.validateSchema(xml);
            }
            advance(PipelineState.DONE);

            return new GenerationResult(xml, response.reasoning());
        } catch (BpmnGenerationException e) {
            LOG.error("Generation failed after state {}: {}", state, e.getMessage());
            failureKind = e.getKind();
            state = PipelineState.FAILED;
            throw e;
        } catch (RuntimeException e) {
            LOG.error("Generation failed after state {}", state, e);
            state = PipelineState.FAILED;
            throw e;
        }
    }

    /**
     * One attempt is a service call plus schema validation. Attempts are independent;
     * only the successful attempt's JSON is used.
     */
    GenerationResponse generateProcessJson(String description) {
        BpmnGenerationException lastFailure = null;
        for (int attempt = 1; attempt <= config.jsonAttempts; attempt++) {
            try {
                String rawJson = client.render(PromptHelper.PROCESS_JSON_PROMPT,
                        Map.of("process_description", description));
                GenerationResponse response = ProcessModelHelper.parseGenerationResponse(rawJson);
                LOG.info("Process JSON generated on attempt {}", attempt);
                return response;
            } catch (SchemaException | GenerationServiceException e) {
                LOG.warn("Process JSON attempt {}/{} failed: {}", attempt, config.jsonAttempts, e.getMessage());
                lastFailure = e;
            }
        }
        throw new SchemaException(String.format("No valid process JSON after %d attempts: %s",
                config.jsonAttempts, lastFailure.getMessage()), lastFailure);
    }

    static List<Lane> normalizeLanes(ProcessModel process, PartitionedFlows flows) {
        List<Lane> lanes = new ArrayList<>(process.pool().lanes());
        // stable, ties keep input order
        lanes.sort(Comparator.comparingInt(Lane::order));

        List<Lane> normalized = new ArrayList<>(lanes.size());
        for (Lane lane : lanes) {
            normalized.add(LaneNormalizer.normalize(lane, flows.flowsOf(lane.id())));
        }
        return normalized;
    }

    private List<LaneFragment> renderLanes(ProcessModel process, List<Lane> lanes) {
        int workers = Math.min(lanes.size(), config.maxWorkers);
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(workers, 1));
        try {
            List<Future<LaneFragment>> futures = new ArrayList<>();
            for (Lane lane : lanes) {
                futures.add(executor.submit(() -> renderLane(process, lane)));
            }

            // lane order is the stacking order
            List<LaneFragment> fragments = new ArrayList<>(futures.size());
            for (Future<LaneFragment> future : futures) {
                fragments.add(future.get());
            }
            return fragments;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new RenderException("Lane rendering failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderException("Interrupted while rendering lanes", e);
        } finally {
            executor.shutdownNow();
        }
    }

    LaneFragment renderLane(ProcessModel process, Lane lane) {
        LOG.info("Rendering lane '{}' ({} elements)", lane.id(), lane.elements().size());
        String response = client.render(PromptHelper.LANE_BPMN_PROMPT, Map.of(
                "process_id", process.id(),
                "process_name", process.name(),
                "lane_id", lane.id(),
                "lane_name", lane.name(),
                "lane_json", ProcessModelHelper.writeLaneJson(lane)));

        String xml = BpmnFragmentValidator.clean(BpmnFragmentValidator.extractFragment(response));
        BpmnFragmentValidator.validate(xml);

        String laidOut = LayoutHelper.applyLayout(layoutEngine, xml);
        String withLaneShape = LaneDiagramMerger.addLaneShape(laidOut);
        LOG.debug("Lane '{}' rendered", lane.id());
        return new LaneFragment(lane, withLaneShape);
    }

    private String poolName(ProcessModel process) {
        if (config.poolName != null && !config.poolName.isBlank()) {
            return config.poolName;
        }
        return process.pool().name();
    }

    private void advance(PipelineState next) {
        LOG.debug("{} -> {}", state, next);
        state = next;
    }
}
