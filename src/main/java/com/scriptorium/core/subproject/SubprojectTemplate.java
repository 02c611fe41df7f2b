package com.scriptorium.core.subproject;

import com.scriptorium.core.error.InfrastructureException;
import com.scriptorium.core.error.ValidationException;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Starter documents bundled under {@code templates/<name>/} on the classpath.
 * {@code PROJECT_NAME} in a template file is replaced by the sub-project name.
 */
public enum SubprojectTemplate {

    ARTICLE(List.of("main.tex", "references.bib")),
    REPORT(List.of("main.tex", "references.bib")),
    BOOK(List.of("main.tex", "references.bib")),
    BEAMER(List.of("main.tex"));

    static final String NAME_PLACEHOLDER = "PROJECT_NAME";

    private final List<String> fileNames;

    SubprojectTemplate(List<String> fileNames) {
        this.fileNames = fileNames;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param value template name, case-insensitive; blank selects {@link #ARTICLE}
     */
    public static SubprojectTemplate fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ARTICLE;
        }
        for (SubprojectTemplate template : values()) {
            if (template.value().equalsIgnoreCase(value.strip())) {
                return template;
            }
        }
        throw new ValidationException("Unknown template '" + value + "'; expected article, report, book or beamer");
    }

    public Map<String, String> render(String subprojectName) {
        Map<String, String> files = new LinkedHashMap<>();
        for (String fileName : fileNames) {
            var resource = new ClassPathResource("templates/" + value() + "/" + fileName);
            try (var in = resource.getInputStream()) {
                String text = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
                files.put(fileName, text.replace(NAME_PLACEHOLDER, subprojectName));
            } catch (IOException e) {
                throw new InfrastructureException("Missing template resource " + resource.getPath(), e);
            }
        }
        return files;
    }
}
