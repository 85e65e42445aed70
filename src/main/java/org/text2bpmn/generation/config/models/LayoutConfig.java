package org.text2bpmn.generation.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class LayoutConfig {
    public String nodeCommand = "node";
    public String scriptPath = "layout_service/layout.js";
    public int timeoutSeconds = 60;
}
