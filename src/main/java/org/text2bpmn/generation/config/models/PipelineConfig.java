package org.text2bpmn.generation.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.text2bpmn.generation.bpmn.models.LaneFailurePolicy;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineConfig {
    /**
     * Total attempts at producing schema-valid process JSON.
     */
    public int jsonAttempts = 3;
    public int maxWorkers = 8;
    public LaneFailurePolicy laneFailurePolicy = LaneFailurePolicy.ABORT;
    public boolean strictSchemaValidation = true;
    /**
     * Replaces the pool name of the generated process when set.
     */
    public String poolName;
}
