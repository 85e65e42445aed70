package org.text2bpmn.generation.layout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.text2bpmn.generation.exceptions.LayoutException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Lays out documents with the bpmn-auto-layout wrapper script, one {@code node} process per call.
 * The document goes in on stdin and comes back on stdout.
 */
public class NodeLayoutEngine implements LayoutEngine {
    private static final Logger LOG = LoggerFactory.getLogger(NodeLayoutEngine.class);
    private static final long VERSION_CHECK_SECONDS = 5;

    // pipe reads and writes block
    private static final ExecutorService STREAM_EXECUTOR = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "layout-stream");
        thread.setDaemon(true);
        return thread;
    });

    private final String nodeCommand;
    private final Path scriptPath;
    private final Duration timeout;

    /**
     * @throws LayoutException with reason {@code TOOL_UNAVAILABLE} if node or the script cannot be found
     */
    public NodeLayoutEngine(String nodeCommand, Path scriptPath, Duration timeout) {
        this.nodeCommand = nodeCommand;
        this.scriptPath = scriptPath;
        this.timeout = timeout;

        if (!Files.isRegularFile(scriptPath)) {
            throw new LayoutException(LayoutException.Reason.TOOL_UNAVAILABLE,
                    "Layout script not found: " + scriptPath.toAbsolutePath());
        }
        String version = checkNodeVersion();
        LOG.info("Using {} {} with layout script {}", nodeCommand, version, scriptPath);
    }

    @Override
    public String layout(String xml) {
        Process process;
        try {
            process = new ProcessBuilder(nodeCommand, scriptPath.toString()).start();
        } catch (IOException e) {
            throw new LayoutException(LayoutException.Reason.TOOL_UNAVAILABLE,
                    "Failed to start " + nodeCommand + ": " + e.getMessage(), e);
        }

        // drain both streams while writing stdin, or a large document can block the child
        CompletableFuture<String> stdout = readAsync(process.getInputStream());
        CompletableFuture<String> stderr = readAsync(process.getErrorStream());
        CompletableFuture<Void> stdin = writeAsync(process.getOutputStream(), xml);

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new LayoutException(LayoutException.Reason.TIMEOUT,
                        "Layout did not finish within " + timeout.toSeconds() + " seconds");
            }
            if (process.exitValue() != 0) {
                throw new LayoutException(LayoutException.Reason.FAILED,
                        "Layout exited with status " + process.exitValue() + ": " + stderr.get().trim());
            }
            stdin.get();
            return stdout.get();
        } catch (ExecutionException e) {
            throw new LayoutException(LayoutException.Reason.FAILED, "Failed to talk to layout process", e.getCause());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new LayoutException(LayoutException.Reason.FAILED, "Interrupted while waiting for layout", e);
        }
    }

    private String checkNodeVersion() {
        try {
            Process process = new ProcessBuilder(nodeCommand, "--version").redirectErrorStream(true).start();
            CompletableFuture<String> output = readAsync(process.getInputStream());
            if (!process.waitFor(VERSION_CHECK_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new LayoutException(LayoutException.Reason.TOOL_UNAVAILABLE,
                        nodeCommand + " --version did not answer within " + VERSION_CHECK_SECONDS + " seconds");
            }
            if (process.exitValue() != 0) {
                throw new LayoutException(LayoutException.Reason.TOOL_UNAVAILABLE,
                        nodeCommand + " --version exited with status " + process.exitValue());
            }
            return output.get().trim();
        } catch (IOException | ExecutionException e) {
            throw new LayoutException(LayoutException.Reason.TOOL_UNAVAILABLE,
                    "Node.js is not available as '" + nodeCommand + "'", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LayoutException(LayoutException.Reason.TOOL_UNAVAILABLE, "Interrupted while checking Node.js", e);
        }
    }

    private static CompletableFuture<String> readAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (stream) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, STREAM_EXECUTOR);
    }

    private static CompletableFuture<Void> writeAsync(OutputStream stream, String content) {
        return CompletableFuture.runAsync(() -> {
            try (stream) {
                stream.write(content.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, STREAM_EXECUTOR);
    }
}
