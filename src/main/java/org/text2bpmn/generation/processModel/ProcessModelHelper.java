package org.text2bpmn.generation.processModel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.text2bpmn.generation.exceptions.SchemaException;
import org.text2bpmn.generation.processModel.models.Element;
import org.text2bpmn.generation.processModel.models.ElementType;
import org.text2bpmn.generation.processModel.models.GenerationResponse;
import org.text2bpmn.generation.processModel.models.Lane;
import org.text2bpmn.generation.processModel.models.Pool;
import org.text2bpmn.generation.processModel.models.ProcessModel;
import org.text2bpmn.generation.processModel.models.SequenceFlow;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Validates the JSON produced by the process generation prompt and turns it into the
 * process model records.
 */
public class ProcessModelHelper {
    private static final String SCHEMA_RESOURCE_PATH = "schemas/process_model_schema.json";
    private static final Pattern CODE_FENCE_PATTERN = Pattern.compile("^```[a-zA-Z]*\\s*(.*?)\\s*```$", Pattern.DOTALL);

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final JsonSchema schema = loadSchema();

    private static JsonSchema loadSchema() {
        try (InputStream schemaStream = ProcessModelHelper.class.getClassLoader()
                .getResourceAsStream(SCHEMA_RESOURCE_PATH)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE_PATH);
            }
            return factory.getSchema(mapper.readTree(schemaStream));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load schema: " + SCHEMA_RESOURCE_PATH, e);
        }
    }

    /**
     * Parses and validates the raw text returned by the generative service.
     *
     * @param rawText JSON text, optionally wrapped in a markdown code fence
     * @return the validated process together with the model's reasoning
     * @throws SchemaException if the text is not JSON, violates the schema, or repeats an element id
     */
    public static GenerationResponse parseGenerationResponse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new SchemaException("Generated process JSON is empty");
        }

        JsonNode root;
        try {
            root = mapper.readTree(stripCodeFence(rawText));
        } catch (JsonProcessingException e) {
            throw new SchemaException("Generated process is not valid JSON: " + e.getOriginalMessage(), e);
        }

        validate(root);

        ProcessModel process = buildProcess(root.get("bpmn").get("process"));
        checkUniqueElementIds(process);

        return new GenerationResponse(process, root.get("reasoning").asText());
    }

    /**
     * Checks the JSON tree against the process model schema.
     * Every violation names the JSON path of the offending field.
     */
    public static void validate(JsonNode root) {
        Set<ValidationMessage> errors = schema.validate(root);
        if (!errors.isEmpty()) {
            String details = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new SchemaException("Generated process JSON is invalid: " + details);
        }
    }

    /**
     * Serializes a lane, including its attached flows, for the lane rendering prompt.
     * Mock markers are internal and are not written.
     */
    public static String writeLaneJson(Lane lane) {
        ObjectNode laneNode = mapper.createObjectNode();
        laneNode.put("id", lane.id());
        laneNode.put("name", lane.name());
        laneNode.put("order", lane.order());

        ArrayNode elementsNode = laneNode.putArray("elements");
        for (Element element : lane.elements()) {
            ObjectNode elementNode = elementsNode.addObject();
            elementNode.put("id", element.id());
            elementNode.put("type", element.type().jsonName());
            elementNode.put("name", element.name());
            if (element.eventType() != null) {
                elementNode.put("eventType", element.eventType());
            }
            if (element.gatewayDirection() != null) {
                elementNode.put("gatewayDirection", element.gatewayDirection());
            }
        }

        ArrayNode flowsNode = laneNode.putArray("sequenceFlows");
        for (SequenceFlow flow : lane.sequenceFlows()) {
            ObjectNode flowNode = flowsNode.addObject();
            flowNode.put("id", flow.id());
            flowNode.put("sourceRef", flow.sourceRef());
            flowNode.put("targetRef", flow.targetRef());
            if (flow.name() != null) {
                flowNode.put("name", flow.name());
            }
            if (flow.conditionExpression() != null) {
                flowNode.put("conditionExpression", flow.conditionExpression());
            }
        }

        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(laneNode);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize lane " + lane.id(), e);
        }
    }

    static String stripCodeFence(String text) {
        String trimmed = text.trim();
        Matcher matcher = CODE_FENCE_PATTERN.matcher(trimmed);
        return matcher.matches() ? matcher.group(1) : trimmed;
    }

    private static ProcessModel buildProcess(JsonNode processNode) {
        JsonNode poolNode = processNode.get("pool");

        List<Lane> lanes = new ArrayList<>();
        for (JsonNode laneNode : poolNode.get("lanes")) {
            List<Element> elements = new ArrayList<>();
            for (JsonNode elementNode : laneNode.get("elements")) {
                elements.add(Element.builder()
                        .id(elementNode.get("id").asText())
                        .type(ElementType.fromJsonName(elementNode.get("type").asText()))
                        .name(elementNode.get("name").asText())
                        .eventType(optionalText(elementNode, "eventType"))
                        .gatewayDirection(optionalText(elementNode, "gatewayDirection"))
                        .build());
            }
            lanes.add(new Lane(
                    laneNode.get("id").asText(),
                    laneNode.get("name").asText(),
                    laneNode.get("order").asInt(),
                    elements));
        }

        List<SequenceFlow> flows = new ArrayList<>();
        for (JsonNode flowNode : poolNode.get("sequenceFlows")) {
            flows.add(new SequenceFlow(
                    flowNode.get("id").asText(),
                    flowNode.get("sourceRef").asText(),
                    flowNode.get("targetRef").asText(),
                    optionalText(flowNode, "name"),
                    optionalText(flowNode, "conditionExpression"),
                    false));
        }

        Pool pool = new Pool(poolNode.get("id").asText(), poolNode.get("name").asText(), lanes, flows);
        return new ProcessModel(processNode.get("id").asText(), processNode.get("name").asText(), pool);
    }

    private static void checkUniqueElementIds(ProcessModel process) {
        Set<String> seen = new HashSet<>();
        for (Lane lane : process.pool().lanes()) {
            for (Element element : lane.elements()) {
                if (!seen.add(element.id())) {
                    throw new SchemaException(String.format(
                            "Generated process JSON is invalid: element id '%s' is used more than once (lane '%s')",
                            element.id(), lane.id()));
                }
            }
        }
    }

    // empty strings count as absent
    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isEmpty()) {
            return null;
        }
        return value.asText();
    }
}
