package org.text2bpmn.generation;

import org.text2bpmn.generation.config.ConfigHelper;
import org.text2bpmn.generation.config.models.GeneratorConfig;
import org.text2bpmn.generation.description.ProcessDescriptionHelper;
import org.text2bpmn.generation.exceptions.BpmnGenerationException;
import org.text2bpmn.generation.layout.NodeLayoutEngine;
import org.text2bpmn.generation.llm.AzureOpenAiClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Command line entry point.
 *
 * <pre>
 *   text2bpmn "Customer submits an order, ..."        -- description as text
 *   text2bpmn -f process.md -o out/order.bpmn          -- description from a file
 * </pre>
 */
@Command(
        name = "text2bpmn",
        mixinStandardHelpOptions = true,
        version = "text2bpmn 1.0.0",
        description = "Generate a laned BPMN 2.0 diagram from a natural language process description"
)
public class Main implements Callable<Integer> {

    @Parameters(
            index = "0",
            arity = "0..1",
            paramLabel = "<description>",
            description = "Process description text"
    )
    private String description;

    @Option(names = {"--file", "-f"}, description = "Read the description from a .txt or .md file", paramLabel = "<file>")
    private Path descriptionFile;

    @Option(names = {"--output", "-o"}, description = "Output BPMN file (default: process_diagram.bpmn)",
            paramLabel = "<file>", defaultValue = "process_diagram.bpmn")
    private Path output;

    @Option(names = {"--config", "-c"}, description = "Configuration file (default: bundled text2bpmn.json)",
            paramLabel = "<file>")
    private Path configFile;

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main()).execute(args));
    }

    @Override
    public Integer call() {
        if (description == null && descriptionFile == null) {
            System.err.println("[ERROR] Provide a process description or --file.");
            CommandLine.usage(this, System.err);
            return 1;
        }

        try {
            String processDescription = ProcessDescriptionHelper.resolve(description, descriptionFile);
            GeneratorConfig config = ConfigHelper.load(configFile);

            System.out.println("[INFO]  Generating BPMN diagram...");
            GenerationResult result = createPipeline(config).generate(processDescription);

            Path reasoningFile = reasoningPath(output);
            writeFile(output, result.bpmnXml());
            writeFile(reasoningFile, result.reasoning());

            System.out.println("[OK]    BPMN diagram saved to " + output);
            System.out.println("[OK]    Reasoning saved to " + reasoningFile);
            return 0;
        } catch (BpmnGenerationException e) {
            System.err.println("Error: " + e.getKind().label() + ": " + e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("Error: Failed to write output: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            System.err.println("Error: Unexpected error: " + e.getMessage());
            return 1;
        }
    }

    protected BpmnGenerationPipeline createPipeline(GeneratorConfig config) {
        AzureOpenAiClient client = new AzureOpenAiClient(config.llm);
        NodeLayoutEngine layoutEngine = new NodeLayoutEngine(
                config.layout.nodeCommand,
                Path.of(config.layout.scriptPath),
                Duration.ofSeconds(config.layout.timeoutSeconds));
        return new BpmnGenerationPipeline(client, layoutEngine, config.pipeline);
    }

    /**
     * {@code out/order.bpmn} becomes {@code out/order_reasoning.txt}.
     */
    static Path reasoningPath(Path output) {
        String fileName = output.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return output.resolveSibling(stem + "_reasoning.txt");
    }

    private static void writeFile(Path path, String content) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, content == null ? "" : content, StandardCharsets.UTF_8);
    }
}
