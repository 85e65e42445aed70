package org.text2bpmn.generation.layout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.text2bpmn.generation.exceptions.LayoutException;

public class LayoutHelper {
    private static final Logger LOG = LoggerFactory.getLogger(LayoutHelper.class);

    /** Laid-out output shorter than this share of the input is treated as truncated. */
    public static final double MIN_OUTPUT_RATIO = 0.8;

    /**
     * Runs the engine and rejects output that is suspiciously shorter than the input.
     * There is no retry and no fallback to the unlaid-out document.
     */
    public static String applyLayout(LayoutEngine engine, String xml) {
        String laidOut = engine.layout(xml);
        if (laidOut == null || laidOut.length() < xml.length() * MIN_OUTPUT_RATIO) {
            int length = laidOut == null ? 0 : laidOut.length();
            throw new LayoutException(LayoutException.Reason.CORRUPTED_OUTPUT, String.format(
                    "Layout output is %d characters for %d characters of input", length, xml.length()));
        }
        LOG.debug("Layout grew document from {} to {} characters", xml.length(), laidOut.length());
        return laidOut;
    }
}
