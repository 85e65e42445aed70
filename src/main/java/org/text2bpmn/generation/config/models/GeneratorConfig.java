package org.text2bpmn.generation.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class GeneratorConfig {
    public LlmConfig llm = new LlmConfig();
    public LayoutConfig layout = new LayoutConfig();
    public PipelineConfig pipeline = new PipelineConfig();
}
