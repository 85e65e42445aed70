package org.text2bpmn.generation.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Connection settings for the Azure OpenAI deployment.
 * The key and endpoint normally come from the environment, not the file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LlmConfig {
    public String endpoint;
    public String apiKey;
    public String apiVersion = "2025-01-01-preview";
    /**
     * Deployment name, used in the request path.
     */
    public String model = "gpt-4.1";
    public double temperature = 0.7;
    public int maxTokens = 2048;
    public int requestTimeoutSeconds = 120;
}
