package org.text2bpmn.generation.layout;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.text2bpmn.generation.exceptions.LayoutException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs small bash scripts in place of the node layout script.
 */
class NodeLayoutEngineTest {

    @TempDir
    Path tempDir;

    private NodeLayoutEngine engineFor(String scriptBody) throws IOException {
        Path script = tempDir.resolve("layout.sh");
        Files.writeString(script, scriptBody + "\n");
        return new NodeLayoutEngine("bash", script, Duration.ofSeconds(1));
    }

    @Test
    void shouldReturnStdoutWhenScriptSucceeds() throws IOException {
        NodeLayoutEngine engine = engineFor("exec cat");
        String xml = "<definitions>" + "x".repeat(300_000) + "</definitions>";

        assertEquals(xml, engine.layout(xml));
    }

    @Test
    void shouldReportTimeoutWhenScriptHangs() throws IOException {
        NodeLayoutEngine engine = engineFor("exec sleep 5");

        long start = System.nanoTime();
        LayoutException e = assertThrows(LayoutException.class, () -> engine.layout("<definitions/>"));
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertEquals(LayoutException.Reason.TIMEOUT, e.getReason());
        assertTrue(elapsedMillis < 4_000, "timed out after " + elapsedMillis + " ms");
    }

    @Test
    void shouldReportFailureWhenScriptExitsNonZero() throws IOException {
        NodeLayoutEngine engine = engineFor("echo boom >&2\nexit 3");

        LayoutException e = assertThrows(LayoutException.class, () -> engine.layout("<definitions/>"));

        assertEquals(LayoutException.Reason.FAILED, e.getReason());
        assertTrue(e.getMessage().contains("status 3"), e.getMessage());
        assertTrue(e.getMessage().contains("boom"), e.getMessage());
    }

    @Test
    void shouldReportToolUnavailableWhenCommandMissing() throws IOException {
        Path script = tempDir.resolve("layout.sh");
        Files.writeString(script, "exec cat\n");

        LayoutException e = assertThrows(LayoutException.class, () -> new NodeLayoutEngine(
                "no-such-layout-command", script, Duration.ofSeconds(1)));
        assertEquals(LayoutException.Reason.TOOL_UNAVAILABLE, e.getReason());
    }
}
