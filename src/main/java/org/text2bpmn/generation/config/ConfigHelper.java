package org.text2bpmn.generation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.text2bpmn.generation.config.models.GeneratorConfig;
import org.text2bpmn.generation.exceptions.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads the generator configuration: a JSON file, then environment overrides.
 */
public class ConfigHelper {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigHelper.class);

    public static final String DEFAULT_CONFIG_RESOURCE = "text2bpmn.json";

    public static final String ENV_API_KEY = "OPENAI_API_KEY";
    public static final String ENV_ENDPOINT = "AZURE_ENDPOINT";
    public static final String ENV_API_VERSION = "API_VERSION";
    public static final String ENV_MODEL = "MODEL";

    private static final ObjectMapper mapper = new ObjectMapper();

    /**
     * @param configFile explicit configuration file, or {@code null} for the bundled default
     */
    public static GeneratorConfig load(Path configFile) {
        return load(configFile, System.getenv());
    }

    public static GeneratorConfig load(Path configFile, Map<String, String> environment) {
        GeneratorConfig config = configFile == null ? loadDefault() : loadFile(configFile);
        applyEnvironment(config, environment);
        validate(config);
        return config;
    }

    static GeneratorConfig loadFile(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            throw new ConfigurationException("Configuration file not found: " + configFile);
        }
        try {
            LOG.debug("Reading configuration from {}", configFile);
            return mapper.readValue(configFile.toFile(), GeneratorConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration file: " + configFile, e);
        }
    }

    static GeneratorConfig loadDefault() {
        try (InputStream is = ConfigHelper.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (is == null) {
                LOG.debug("No {} on the classpath, using built-in defaults", DEFAULT_CONFIG_RESOURCE);
                return new GeneratorConfig();
            }
            return mapper.readValue(is, GeneratorConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration resource: " + DEFAULT_CONFIG_RESOURCE, e);
        }
    }

    static void applyEnvironment(GeneratorConfig config, Map<String, String> environment) {
        String apiKey = environment.get(ENV_API_KEY);
        if (apiKey != null && !apiKey.isBlank()) {
            config.llm.apiKey = apiKey;
        }
        String endpoint = environment.get(ENV_ENDPOINT);
        if (endpoint != null && !endpoint.isBlank()) {
            config.llm.endpoint = endpoint;
        }
        String apiVersion = environment.get(ENV_API_VERSION);
        if (apiVersion != null && !apiVersion.isBlank()) {
            config.llm.apiVersion = apiVersion;
        }
        String model = environment.get(ENV_MODEL);
        if (model != null && !model.isBlank()) {
            config.llm.model = model;
        }
    }

    private static void validate(GeneratorConfig config) {
        if (config.llm == null || config.layout == null || config.pipeline == null) {
            throw new ConfigurationException("Configuration sections 'llm', 'layout' and 'pipeline' must not be null");
        }
        if (config.pipeline.jsonAttempts < 1) {
            throw new ConfigurationException("pipeline.jsonAttempts must be at least 1");
        }
        if (config.pipeline.maxWorkers < 1) {
            throw new ConfigurationException("pipeline.maxWorkers must be at least 1");
        }
        if (config.pipeline.laneFailurePolicy == null) {
            throw new ConfigurationException("pipeline.laneFailurePolicy must be ABORT or DROP");
        }
        if (config.layout.timeoutSeconds < 1) {
            throw new ConfigurationException("layout.timeoutSeconds must be at least 1");
        }
    }
}
