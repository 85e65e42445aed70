package org.text2bpmn.generation.description;

import org.text2bpmn.generation.exceptions.DescriptionException;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Resolves and checks the natural-language process description given on the command line.
 */
public class ProcessDescriptionHelper {
    public static final int MIN_LENGTH = 10;
    public static final int MAX_LENGTH = 10_000;

    private static final List<String> SUPPORTED_EXTENSIONS = List.of(".txt", ".md");

    /**
     * Picks the description from a file when one is given, otherwise from the literal text.
     *
     * @return the trimmed description
     * @throws DescriptionException if neither source yields a usable description
     */
    public static String resolve(String text, Path file) {
        if (file != null) {
            return validate(readFile(file));
        }
        if (text == null) {
            throw new DescriptionException("No process description given");
        }
        return validate(text);
    }

    public static String readFile(Path file) {
        String fileName = file.getFileName() == null ? "" : file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (SUPPORTED_EXTENSIONS.stream().noneMatch(fileName::endsWith)) {
            throw new DescriptionException("Unsupported description file type: " + file + " (expected .txt or .md)");
        }
        if (!Files.isRegularFile(file)) {
            throw new DescriptionException("Description file not found: " + file);
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            throw new DescriptionException("Description file is not valid UTF-8: " + file, e);
        } catch (IOException e) {
            throw new DescriptionException("Failed to read description file: " + file, e);
        }
    }

    public static String validate(String description) {
        String trimmed = description == null ? "" : description.trim();
        if (trimmed.length() < MIN_LENGTH) {
            throw new DescriptionException(String.format(
                    "Process description is too short: %d characters, at least %d required", trimmed.length(), MIN_LENGTH));
        }
        if (trimmed.length() > MAX_LENGTH) {
            throw new DescriptionException(String.format(
                    "Process description is too long: %d characters, at most %d allowed", trimmed.length(), MAX_LENGTH));
        }
        return trimmed;
    }
}
