package org.text2bpmn.generation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.text2bpmn.generation.config.models.GeneratorConfig;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldExitWithErrorWhenNoInput() {
        assertEquals(1, new CommandLine(new Main()).execute());
    }

    @Test
    void shouldExitWithErrorWhenDescriptionTooShort() {
        assertEquals(1, new CommandLine(new Main()).execute("order"));
    }

    @Test
    void shouldWriteDiagramAndReasoning() throws IOException {
        Main main = new Main() {
            @Override
            protected BpmnGenerationPipeline createPipeline(GeneratorConfig config) {
                ScriptedGenerativeClient client = new ScriptedGenerativeClient()
                        .answerProcessJson(TestResources.read("models/json/valid_process.json"))
                        .answerLane("Lane_A", "<bpmn_xml>" + TestResources.read("models/bpmn/lane_a.bpmn") + "</bpmn_xml>")
                        .answerLane("Lane_B", "<bpmn_xml>" + TestResources.read("models/bpmn/lane_b.bpmn") + "</bpmn_xml>");
                return new BpmnGenerationPipeline(client, xml -> xml, config.pipeline);
            }
        };
        Path output = tempDir.resolve("out").resolve("order.bpmn");

        int exitCode = new CommandLine(main).execute(
                "The customer places an order and the warehouse ships it.", "-o", output.toString());

        assertEquals(0, exitCode);
        assertTrue(Files.readString(output).startsWith("<?xml"));
        assertEquals("The customer places an order and the warehouse ships it.",
                Files.readString(tempDir.resolve("out").resolve("order_reasoning.txt")));
    }

    @Test
    void shouldExitWithErrorWhenPipelineFailsUnexpectedly() {
        Main main = new Main() {
            @Override
            protected BpmnGenerationPipeline createPipeline(GeneratorConfig config) {
                return new BpmnGenerationPipeline((promptKey, variables) -> {
                    throw new IllegalStateException("template missing");
                }, xml -> xml, config.pipeline);
            }
        };
        Path output = tempDir.resolve("failed.bpmn");

        int exitCode = new CommandLine(main).execute(
                "The customer places an order and the warehouse ships it.", "-o", output.toString());

        assertEquals(1, exitCode);
        assertFalse(Files.exists(output));
    }

    @Test
    void shouldDeriveReasoningPathFromOutput() {
        assertEquals(Path.of("diagrams", "order_reasoning.txt"), Main.reasoningPath(Path.of("diagrams", "order.bpmn")));
        assertEquals(Path.of("process_reasoning.txt"), Main.reasoningPath(Path.of("process")));
    }
}
