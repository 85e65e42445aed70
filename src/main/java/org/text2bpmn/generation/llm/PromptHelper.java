package org.text2bpmn.generation.llm;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import freemarker.template.Version;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Renders the prompt templates under {@code prompts/} on the classpath.
 */
public class PromptHelper {
    public static final String PROCESS_JSON_PROMPT = "process_json";
    public static final String LANE_BPMN_PROMPT = "lane_bpmn";

    private static final String TEMPLATE_DIRECTORY = "prompts/";
    private static final Configuration FREEMARKER_CONFIG;

    static {
        FREEMARKER_CONFIG = new Configuration(new Version("2.3.32"));
        FREEMARKER_CONFIG.setDefaultEncoding(StandardCharsets.UTF_8.name());
        FREEMARKER_CONFIG.setClassLoaderForTemplateLoading(
                PromptHelper.class.getClassLoader(),
                "/"
        );

        // fail fast when variables are missing
        FREEMARKER_CONFIG.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        FREEMARKER_CONFIG.setLogTemplateExceptions(false);
        FREEMARKER_CONFIG.setFallbackOnNullLoopVariable(false);
    }

    public static String renderPrompt(String promptKey, Map<String, String> variables) {
        String templatePath = TEMPLATE_DIRECTORY + promptKey + ".ftl";
        try {
            Template template = FREEMARKER_CONFIG.getTemplate(templatePath);
            StringWriter writer = new StringWriter();
            template.process(variables, writer);
            return writer.toString();
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load prompt template: " + templatePath, e);
        } catch (TemplateException e) {
            throw new IllegalArgumentException("Error rendering prompt (possible missing variable): " + templatePath, e);
        }
    }
}
