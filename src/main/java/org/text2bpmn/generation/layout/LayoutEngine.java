package org.text2bpmn.generation.layout;

import org.text2bpmn.generation.exceptions.LayoutException;

/**
 * Assigns diagram coordinates to a BPMN document. Implementations must be safe to call
 * from several lane workers at once.
 */
public interface LayoutEngine {

    /**
     * @param xml a BPMN document, with or without diagram interchange
     * @return the same process with a complete diagram
     * @throws LayoutException if the layout could not be produced
     */
    String layout(String xml);
}
