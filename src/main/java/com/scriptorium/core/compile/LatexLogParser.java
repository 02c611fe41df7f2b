package com.scriptorium.core.compile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Extracts warnings and errors from a TeX {@code .log} file.
 */
final class LatexLogParser {

    private static final Logger logger = LoggerFactory.getLogger(LatexLogParser.class);

    static final int MAX_ENTRIES = 50;

    private static final Pattern WARNING = Pattern.compile(
            "^(LaTeX|LaTeX Font|(Package|Class) \\S+) Warning:.*");

    private LatexLogParser() {}

    static List<String> warnings(Path log) {
        return collect(log, line -> WARNING.matcher(line).matches());
    }

    /** Lines starting with {@code !}, which TeX uses for errors. */
    static List<String> errors(Path log) {
        return collect(log, line -> line.startsWith("!"));
    }

    private static List<String> collect(Path log, Predicate<String> filter) {
        if (log == null || !Files.isRegularFile(log)) {
            return List.of();
        }
        Set<String> found = new LinkedHashSet<>();
        try {
            // TeX logs are not always valid UTF-8
            String text = new String(Files.readAllBytes(log), StandardCharsets.ISO_8859_1);
            for (String line : text.split("\\R")) {
                if (filter.test(line)) {
                    found.add(line.strip());
                    if (found.size() >= MAX_ENTRIES) {
                        break;
                    }
                }
            }
        } catch (IOException e) {
            logger.warn("Cannot read TeX log {}: {}", log, e.getMessage());
            return List.of();
        }
        return new ArrayList<>(found);
    }
}
