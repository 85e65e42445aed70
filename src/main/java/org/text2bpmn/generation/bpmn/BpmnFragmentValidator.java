package org.text2bpmn.generation.bpmn;

import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.xml.ModelException;
import org.text2bpmn.generation.exceptions.RenderException;
import org.text2bpmn.generation.exceptions.ValidationException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks on BPMN text coming back from the lane rendering prompt and on the merged document.
 */
public class BpmnFragmentValidator {
    public static final String FRAGMENT_OPEN_TAG = "<bpmn_xml>";
    public static final String FRAGMENT_CLOSE_TAG = "</bpmn_xml>";

    private static final List<String> REQUIRED_ELEMENTS = List.of("definitions", "process", "startEvent", "endEvent");
    private static final Pattern CODE_FENCE_PATTERN = Pattern.compile("```(xml)?");

    /**
     * Cuts the document out of the delimited region of a rendering response.
     *
     * @throws RenderException if the response has no complete delimited region
     */
    public static String extractFragment(String responseText) {
        if (responseText == null) {
            throw new RenderException("Lane rendering returned no text");
        }
        int start = responseText.indexOf(FRAGMENT_OPEN_TAG);
        int end = responseText.lastIndexOf(FRAGMENT_CLOSE_TAG);
        if (start < 0 || end < start + FRAGMENT_OPEN_TAG.length()) {
            throw new RenderException("Lane rendering response has no " + FRAGMENT_OPEN_TAG + " section");
        }
        return responseText.substring(start + FRAGMENT_OPEN_TAG.length(), end);
    }

    /**
     * Strips code fences, the delimiter tags and surrounding whitespace. Never fails.
     */
    public static String clean(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = text.replace(FRAGMENT_OPEN_TAG, "").replace(FRAGMENT_CLOSE_TAG, "");
        cleaned = CODE_FENCE_PATTERN.matcher(cleaned).replaceAll("");
        return cleaned.trim();
    }

    /**
     * Cheap structural gate run on every fragment before layout.
     *
     * @throws ValidationException naming the first failed check
     */
    public static void validate(String xml) {
        if (xml == null || xml.isEmpty()) {
            throw new ValidationException("Empty XML content");
        }
        if (!xml.startsWith("<?xml")) {
            throw new ValidationException("Missing XML declaration");
        }
        for (String element : REQUIRED_ELEMENTS) {
            if (!xml.contains(element)) {
                throw new ValidationException("Missing required BPMN element: " + element);
            }
        }

        long opening = xml.chars().filter(c -> c == '<').count();
        long closing = xml.chars().filter(c -> c == '>').count();
        if (opening != closing) {
            throw new ValidationException(String.format(
                    "Unbalanced XML tags: %d '<' against %d '>'", opening, closing));
        }
    }

    /**
     * Full BPMN 2.0 schema validation through the Camunda model API.
     *
     * @throws ValidationException if the document cannot be read as a BPMN model
     */
    public static void validateSchema(String xml) {
        try (InputStream is = new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8))) {
            BpmnModelInstance modelInstance = Bpmn.readModelFromStream(is);
            Bpmn.validateModel(modelInstance);  // throws exception if invalid
        } catch (ModelException e) {
            throw new ValidationException("BPMN document does not conform to the BPMN 2.0 schema: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read in-memory BPMN document", e);
        }
    }
}
