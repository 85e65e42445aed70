package org.text2bpmn.generation.processModel;

import org.junit.jupiter.api.Test;
import org.text2bpmn.generation.TestResources;
import org.text2bpmn.generation.exceptions.SchemaException;
import org.text2bpmn.generation.lane.LaneNormalizer;
import org.text2bpmn.generation.processModel.models.Element;
import org.text2bpmn.generation.processModel.models.ElementType;
import org.text2bpmn.generation.processModel.models.GenerationResponse;
import org.text2bpmn.generation.processModel.models.Lane;
import org.text2bpmn.generation.processModel.models.SequenceFlow;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessModelHelperTest {

    @Test
    void shouldParseWhenValid() {
        GenerationResponse response = ProcessModelHelper.parseGenerationResponse(
                TestResources.read("models/json/valid_process.json"));

        assertEquals("Process_Order", response.process().id());
        assertEquals("Order Company", response.process().pool().name());
        assertEquals(2, response.process().pool().lanes().size());
        assertEquals(5, response.process().pool().sequenceFlows().size());
        assertEquals("The customer places the order and the warehouse ships it.", response.reasoning());

        Lane customer = response.process().pool().lanes().get(1);
        assertEquals("Lane_A", customer.id());
        assertEquals(1, customer.order());
        assertTrue(customer.sequenceFlows().isEmpty());
        assertEquals(ElementType.START_EVENT, customer.elements().get(0).type());
        assertEquals("none", customer.elements().get(0).eventType());
        // empty strings are read as absent
        assertNull(customer.elements().get(2).eventType());

        SequenceFlow crossLane = response.process().pool().sequenceFlows().get(2);
        assertEquals("order sent", crossLane.name());
        assertNull(crossLane.conditionExpression());
        assertFalse(crossLane.mock());
    }

    @Test
    void shouldParseWhenWrappedInCodeFence() {
        String fenced = "```json\n" + TestResources.read("models/json/valid_process.json") + "\n```";
        assertDoesNotThrow(() -> ProcessModelHelper.parseGenerationResponse(fenced));
    }

    @Test
    void shouldThrowWhenRequiredFieldMissing() {
        SchemaException e = assertThrows(SchemaException.class, () -> ProcessModelHelper.parseGenerationResponse(
                TestResources.read("models/json/missing_lane_id.json")));
        assertTrue(e.getMessage().contains("lanes[0]"), e.getMessage());
    }

    @Test
    void shouldThrowWhenElementIdRepeated() {
        SchemaException e = assertThrows(SchemaException.class, () -> ProcessModelHelper.parseGenerationResponse(
                TestResources.read("models/json/duplicate_element_id.json")));
        assertTrue(e.getMessage().contains("Task_1"), e.getMessage());
    }

    @Test
    void shouldThrowWhenNotJson() {
        assertThrows(SchemaException.class, () -> ProcessModelHelper.parseGenerationResponse("Sure! Here is the process:"));
    }

    @Test
    void shouldThrowWhenEmpty() {
        assertThrows(SchemaException.class, () -> ProcessModelHelper.parseGenerationResponse("  "));
    }

    @Test
    void shouldThrowWhenElementTypeUnknown() {
        String json = TestResources.read("models/json/valid_process.json")
                .replace("\"type\": \"task\", \"name\": \"Ship order\"", "\"type\": \"subProcess\", \"name\": \"Ship order\"");
        assertThrows(SchemaException.class, () -> ProcessModelHelper.parseGenerationResponse(json));
    }

    @Test
    void shouldStripCodeFenceOnlyWhenPresent() {
        assertEquals("{\"a\": 1}", ProcessModelHelper.stripCodeFence("```json\n{\"a\": 1}\n```"));
        assertEquals("{\"a\": 1}", ProcessModelHelper.stripCodeFence("  {\"a\": 1} "));
    }

    @Test
    void shouldWriteLaneJsonWithoutMockMarkers() {
        Lane lane = new Lane("Lane_B", "Warehouse", 2, List.of(
                new Element("Task_B", ElementType.TASK, "Ship order"),
                new Element("EndEvent_B", ElementType.END_EVENT, "Order shipped")));
        Lane normalized = LaneNormalizer.normalize(lane,
                List.of(new SequenceFlow("Flow_B2", "Task_B", "EndEvent_B", null, "shipped == true", false)));

        String json = ProcessModelHelper.writeLaneJson(normalized);

        assertTrue(json.contains("\"mock_start_event\""));
        assertTrue(json.contains("\"conditionExpression\" : \"shipped == true\""), json);
        assertFalse(json.contains("\"mock\""));
        assertFalse(json.contains("gatewayDirection"));
    }
}
