package org.text2bpmn.generation.bpmn;

import org.junit.jupiter.api.Test;
import org.text2bpmn.generation.TestResources;
import org.text2bpmn.generation.exceptions.RenderException;
import org.text2bpmn.generation.exceptions.ValidationException;

import static org.junit.jupiter.api.Assertions.*;

class BpmnFragmentValidatorTest {

    private static final String MINIMAL = "<?xml version=\"1.0\"?>\n"
            + "<definitions><process><startEvent/><endEvent/></process></definitions>";

    @Test
    void shouldExtractFragmentWhenSurroundedByText() {
        String response = "Here is the lane:\n<bpmn_xml>\n" + MINIMAL + "\n</bpmn_xml>\nLet me know.";
        assertEquals("\n" + MINIMAL + "\n", BpmnFragmentValidator.extractFragment(response));
    }

    @Test
    void shouldThrowWhenDelimiterMissing() {
        assertThrows(RenderException.class, () -> BpmnFragmentValidator.extractFragment(MINIMAL));
        assertThrows(RenderException.class, () -> BpmnFragmentValidator.extractFragment("<bpmn_xml>" + MINIMAL));
        assertThrows(RenderException.class, () -> BpmnFragmentValidator.extractFragment("</bpmn_xml>x<bpmn_xml>"));
    }

    @Test
    void shouldCleanCodeFencesAndTags() {
        assertEquals(MINIMAL, BpmnFragmentValidator.clean("```xml\n" + MINIMAL + "\n```"));
        assertEquals(MINIMAL, BpmnFragmentValidator.clean("<bpmn_xml>" + MINIMAL + "</bpmn_xml>"));
        assertEquals("", BpmnFragmentValidator.clean(null));
    }

    @Test
    void shouldValidateWhenValid() {
        assertDoesNotThrow(() -> BpmnFragmentValidator.validate(MINIMAL));
        assertDoesNotThrow(() -> BpmnFragmentValidator.validate(TestResources.read("models/bpmn/lane_a.bpmn").trim()));
    }

    @Test
    void shouldThrowWhenEmpty() {
        ValidationException e = assertThrows(ValidationException.class, () -> BpmnFragmentValidator.validate(""));
        assertEquals("Empty XML content", e.getMessage());
    }

    @Test
    void shouldThrowWhenDeclarationMissing() {
        String xml = MINIMAL.substring(MINIMAL.indexOf('\n') + 1);
        ValidationException e = assertThrows(ValidationException.class, () -> BpmnFragmentValidator.validate(xml));
        assertEquals("Missing XML declaration", e.getMessage());
    }

    @Test
    void shouldThrowWhenEndEventMissing() {
        String xml = MINIMAL.replace("<endEvent/>", "");
        ValidationException e = assertThrows(ValidationException.class, () -> BpmnFragmentValidator.validate(xml));
        assertTrue(e.getMessage().contains("endEvent"));
    }

    @Test
    void shouldThrowWhenTagsUnbalanced() {
        String xml = MINIMAL.substring(0, MINIMAL.length() - 1);
        ValidationException e = assertThrows(ValidationException.class, () -> BpmnFragmentValidator.validate(xml));
        assertTrue(e.getMessage().startsWith("Unbalanced"));
    }

    @Test
    void shouldPassSchemaValidationWhenLaneDocumentValid() {
        assertDoesNotThrow(() -> BpmnFragmentValidator.validateSchema(TestResources.read("models/bpmn/lane_a.bpmn")));
    }

    @Test
    void shouldFailSchemaValidationWhenTargetNamespaceMissing() {
        String xml = TestResources.read("models/bpmn/lane_without_plane.bpmn")
                .replace(" targetNamespace=\"http://bpmn.io/schema/bpmn\"", "");
        assertThrows(ValidationException.class, () -> BpmnFragmentValidator.validateSchema(xml));
    }
}
