package org.text2bpmn.generation.llm;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PromptHelperTest {

    @Test
    void shouldRenderLanePrompt() {
        String prompt = PromptHelper.renderPrompt(PromptHelper.LANE_BPMN_PROMPT, Map.of(
                "process_id", "Process_Order",
                "process_name", "Order handling",
                "lane_id", "Lane_A",
                "lane_name", "Customer",
                "lane_json", "{\"id\": \"Lane_A\"}"));

        assertTrue(prompt.contains("Lane id: Lane_A"));
        assertTrue(prompt.contains("{\"id\": \"Lane_A\"}"));
        assertTrue(prompt.contains("<bpmn_xml>"));
    }

    @Test
    void shouldRenderProcessPrompt() {
        String prompt = PromptHelper.renderPrompt(PromptHelper.PROCESS_JSON_PROMPT,
                Map.of("process_description", "A customer orders and the warehouse ships."));

        assertTrue(prompt.contains("A customer orders and the warehouse ships."));
        assertTrue(prompt.contains("\"reasoning\""));
    }

    @Test
    void shouldThrowWhenVariableMissing() {
        assertThrows(IllegalArgumentException.class,
                () -> PromptHelper.renderPrompt(PromptHelper.LANE_BPMN_PROMPT, Map.of("lane_id", "Lane_A")));
    }

    @Test
    void shouldThrowWhenTemplateUnknown() {
        assertThrows(IllegalArgumentException.class, () -> PromptHelper.renderPrompt("no_such_prompt", Map.of()));
    }
}
