package org.text2bpmn.generation.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.text2bpmn.generation.config.models.LlmConfig;
import org.text2bpmn.generation.exceptions.ConfigurationException;
import org.text2bpmn.generation.exceptions.GenerationServiceException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Chat completions against an Azure OpenAI deployment. Each prompt is sent as a single
 * system message.
 */
public class AzureOpenAiClient implements GenerativeClient {
    private static final Logger LOG = LoggerFactory.getLogger(AzureOpenAiClient.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final LlmConfig config;
    private final String completionsUrl;

    /**
     * @throws ConfigurationException if the API key or endpoint is missing
     */
    public AzureOpenAiClient(LlmConfig config) {
        if (config.apiKey == null || config.apiKey.isBlank()) {
            throw new ConfigurationException("No API key configured, set OPENAI_API_KEY");
        }
        if (config.endpoint == null || config.endpoint.isBlank()) {
            throw new ConfigurationException("No endpoint configured, set AZURE_ENDPOINT");
        }
        this.config = config;
        this.completionsUrl = buildCompletionsUrl(config);
    }

    static String buildCompletionsUrl(LlmConfig config) {
        String endpoint = config.endpoint.endsWith("/")
                ? config.endpoint.substring(0, config.endpoint.length() - 1)
                : config.endpoint;
        return endpoint + "/openai/deployments/" + config.model
                + "/chat/completions?api-version=" + URLEncoder.encode(config.apiVersion, StandardCharsets.UTF_8);
    }

    @Override
    public String render(String promptKey, Map<String, String> variables) {
        String prompt = PromptHelper.renderPrompt(promptKey, variables);
        LOG.debug("Sending prompt '{}' ({} characters)", promptKey, prompt.length());

        JsonNode response = post(buildRequestBody(prompt));
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new GenerationServiceException("Generation service returned no content for prompt '" + promptKey + "'");
        }
        return content.asText();
    }

    ObjectNode buildRequestBody(String prompt) {
        ObjectNode body = OBJECT_MAPPER.createObjectNode();
        ObjectNode message = body.putArray("messages").addObject();
        message.put("role", "system");
        message.put("content", prompt);
        body.put("temperature", config.temperature);
        body.put("max_tokens", config.maxTokens);
        return body;
    }

    private JsonNode post(ObjectNode body) {
        HttpURLConnection connection = null;
        try {
            URL url = new URL(completionsUrl);
            connection = (HttpURLConnection) url.openConnection();
            connection.setRequestMethod("POST");
            connection.setDoOutput(true);
            connection.setDoInput(true);
            connection.setConnectTimeout(config.requestTimeoutSeconds * 1000);
            connection.setReadTimeout(config.requestTimeoutSeconds * 1000);
            connection.setRequestProperty("Content-Type", "application/json");
            connection.setRequestProperty("api-key", config.apiKey);

            byte[] bodyBytes = OBJECT_MAPPER.writeValueAsBytes(body);
            connection.setRequestProperty("Content-Length", String.valueOf(bodyBytes.length));
            try (OutputStream os = connection.getOutputStream()) {
                os.write(bodyBytes);
                os.flush();
            }

            int responseCode = connection.getResponseCode();
            if (responseCode < 200 || responseCode >= 300) {
                throw new GenerationServiceException(String.format(
                        "Generation service answered HTTP %d: %s", responseCode, readError(connection)));
            }
            try (InputStream is = connection.getInputStream()) {
                return OBJECT_MAPPER.readTree(is);
            }
        } catch (IOException e) {
            throw new GenerationServiceException("Failed to call generation service: " + e.getMessage(), e);
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private static String readError(HttpURLConnection connection) throws IOException {
        try (InputStream es = connection.getErrorStream()) {
            return es == null ? "" : new String(es.readAllBytes(), StandardCharsets.UTF_8).trim();
        }
    }
}
