package org.text2bpmn.generation;

import org.junit.jupiter.api.Test;
import org.text2bpmn.generation.bpmn.BpmnDocumentHelper;
import org.text2bpmn.generation.config.models.PipelineConfig;
import org.text2bpmn.generation.exceptions.ErrorKind;
import org.text2bpmn.generation.exceptions.LayoutException;
import org.text2bpmn.generation.exceptions.RenderException;
import org.text2bpmn.generation.exceptions.SchemaException;
import org.text2bpmn.generation.layout.LayoutEngine;
import org.text2bpmn.generation.llm.GenerativeClient;
import org.text2bpmn.generation.llm.PromptHelper;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.text2bpmn.generation.bpmn.BpmnNamespaces.BPMNDI_NS;
import static org.text2bpmn.generation.bpmn.BpmnNamespaces.BPMN_NS;
import static org.text2bpmn.generation.bpmn.BpmnNamespaces.DI_NS;

class BpmnGenerationPipelineTest {

    private static final String DESCRIPTION = "The customer places an order and the warehouse ships it.";
    private static final LayoutEngine PASS_THROUGH = xml -> xml;

    private static String laneAnswer(String resource) {
        return "Here is the lane.\n<bpmn_xml>\n```xml\n" + TestResources.read(resource) + "\n```\n</bpmn_xml>";
    }

    private static ScriptedGenerativeClient scriptedLanes() {
        return new ScriptedGenerativeClient()
                .answerLane("Lane_A", laneAnswer("models/bpmn/lane_a.bpmn"))
                .answerLane("Lane_B", laneAnswer("models/bpmn/lane_b.bpmn"));
    }

    @Test
    void shouldGenerateLanedDiagramWhenTwoLanes() {
        ScriptedGenerativeClient client = scriptedLanes()
                .answerProcessJson(TestResources.read("models/json/valid_process.json"));
        BpmnGenerationPipeline pipeline = new BpmnGenerationPipeline(client, PASS_THROUGH, new PipelineConfig());

        GenerationResult result = pipeline.generate(DESCRIPTION);

        assertEquals(PipelineState.DONE, pipeline.getState());
        assertNull(pipeline.getFailureKind());
        assertEquals("The customer places an order and the warehouse ships it.", result.reasoning());
        assertTrue(result.bpmnXml().startsWith("<?xml"));

        Document doc = BpmnDocumentHelper.parse(result.bpmnXml());
        List<Element> lanes = BpmnDocumentHelper.elements(doc, BPMN_NS, "lane");
        assertEquals(2, lanes.size());
        // lanes follow their order field, not their position in the JSON
        assertEquals("Lane_A", lanes.get(0).getAttribute("id"));

        int flowNodes = BpmnDocumentHelper.elements(doc, BPMN_NS, "startEvent").size()
                + BpmnDocumentHelper.elements(doc, BPMN_NS, "task").size()
                + BpmnDocumentHelper.elements(doc, BPMN_NS, "endEvent").size();
        assertEquals(6, flowNodes);

        long crossLane = BpmnDocumentHelper.elements(doc, BPMN_NS, "sequenceFlow").stream()
                .filter(flow -> "Flow_X".equals(flow.getAttribute("id")))
                .count();
        assertEquals(1, crossLane);
        Element edge = BpmnDocumentHelper.elements(doc, BPMNDI_NS, "BPMNEdge").stream()
                .filter(e -> "Flow_X".equals(e.getAttribute("bpmnElement")))
                .findFirst().orElseThrow();
        assertEquals(2, BpmnDocumentHelper.elements(edge, DI_NS, "waypoint").size());

        assertEquals(1, BpmnDocumentHelper.elements(doc, BPMN_NS, "collaboration").size());
        Element participant = BpmnDocumentHelper.firstElement(doc, BPMN_NS, "participant");
        assertEquals("Order Company", participant.getAttribute("name"));
        assertEquals(2, client.laneCalls());
    }

    @Test
    void shouldUseThirdAttemptWhenFirstTwoInvalid() {
        String valid = TestResources.read("models/json/valid_process.json");
        ScriptedGenerativeClient client = scriptedLanes()
                .answerProcessJson("I could not produce JSON this time.")
                .answerProcessJson(valid.replace("\"Order Company\"", "\"Wrong Company\"")
                        .replace("\"reasoning\"", "\"explanation\""))
                .answerProcessJson(valid);
        BpmnGenerationPipeline pipeline = new BpmnGenerationPipeline(client, PASS_THROUGH, new PipelineConfig());

        GenerationResult result = pipeline.generate(DESCRIPTION);

        assertEquals(3, client.processJsonCalls());
        assertTrue(result.bpmnXml().contains("Order Company"));
        assertFalse(result.bpmnXml().contains("Wrong Company"));
    }

    @Test
    void shouldRetryWhenServiceFails() {
        ScriptedGenerativeClient client = scriptedLanes()
                .failProcessJson()
                .answerProcessJson(TestResources.read("models/json/valid_process.json"));
        BpmnGenerationPipeline pipeline = new BpmnGenerationPipeline(client, PASS_THROUGH, new PipelineConfig());

        assertDoesNotThrow(() -> pipeline.generate(DESCRIPTION));
        assertEquals(2, client.processJsonCalls());
    }

    @Test
    void shouldFailWithSchemaErrorWhenAttemptsExhausted() {
        ScriptedGenerativeClient client = scriptedLanes()
                .answerProcessJson("{}")
                .answerProcessJson("{}")
                .answerProcessJson("{}")
                .answerProcessJson(TestResources.read("models/json/valid_process.json"));
        BpmnGenerationPipeline pipeline = new BpmnGenerationPipeline(client, PASS_THROUGH, new PipelineConfig());

        assertThrows(SchemaException.class, () -> pipeline.generate(DESCRIPTION));
        assertEquals(PipelineState.FAILED, pipeline.getState());
        assertEquals(ErrorKind.SCHEMA, pipeline.getFailureKind());
        assertEquals(3, client.processJsonCalls());
        assertEquals(0, client.laneCalls());
    }

    @Test
    void shouldFailWithLayoutErrorWhenLayoutTruncates() {
        ScriptedGenerativeClient client = scriptedLanes()
                .answerProcessJson(TestResources.read("models/json/valid_process.json"));
        LayoutEngine truncating = xml -> xml.substring(0, xml.length() / 2);
        BpmnGenerationPipeline pipeline = new BpmnGenerationPipeline(client, truncating, new PipelineConfig());

        LayoutException e = assertThrows(LayoutException.class, () -> pipeline.generate(DESCRIPTION));
        assertEquals(LayoutException.Reason.CORRUPTED_OUTPUT, e.getReason());
        assertEquals(ErrorKind.LAYOUT, pipeline.getFailureKind());
    }

    @Test
    void shouldFailWithRenderErrorWhenDelimiterMissing() {
        ScriptedGenerativeClient client = scriptedLanes()
                .answerLane("Lane_B", TestResources.read("models/bpmn/lane_b.bpmn"))
                .answerProcessJson(TestResources.read("models/json/valid_process.json"));
        BpmnGenerationPipeline pipeline = new BpmnGenerationPipeline(client, PASS_THROUGH, new PipelineConfig());

        assertThrows(RenderException.class, () -> pipeline.generate(DESCRIPTION));
        assertEquals(ErrorKind.RENDER, pipeline.getFailureKind());
    }

    @Test
    void shouldEndInFailedStateWhenLanePromptCannotBeRendered() {
        String processJson = TestResources.read("models/json/valid_process.json");
        GenerativeClient client = (promptKey, variables) -> {
            if (PromptHelper.PROCESS_JSON_PROMPT.equals(promptKey)) {
                return processJson;
            }
            throw new IllegalArgumentException("Error rendering prompt (possible missing variable): prompts/lane_bpmn.ftl");
        };
        BpmnGenerationPipeline pipeline = new BpmnGenerationPipeline(client, PASS_THROUGH, new PipelineConfig());

        assertThrows(IllegalArgumentException.class, () -> pipeline.generate(DESCRIPTION));
        assertEquals(PipelineState.FAILED, pipeline.getState());
        assertNull(pipeline.getFailureKind());
    }

    @Test
    void shouldUseConfiguredPoolName() {
        ScriptedGenerativeClient client = scriptedLanes()
                .answerProcessJson(TestResources.read("models/json/valid_process.json"));
        PipelineConfig config = new PipelineConfig();
        config.poolName = "Acme Ltd";
        config.maxWorkers = 1;

        GenerationResult result = new BpmnGenerationPipeline(client, PASS_THROUGH, config).generate(DESCRIPTION);

        Document doc = BpmnDocumentHelper.parse(result.bpmnXml());
        assertEquals("Acme Ltd", BpmnDocumentHelper.firstElement(doc, BPMN_NS, "participant").getAttribute("name"));
    }
}
