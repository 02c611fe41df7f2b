package com.scriptorium.core.compile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.scriptorium.core.error.ValidationException;

import java.util.Locale;

/**
 * Supported TeX engines.
 */
public enum LatexEngine {
    PDFLATEX,
    XELATEX,
    LUALATEX,
    LATEX;

    public static final LatexEngine DEFAULT = PDFLATEX;

    /** Executable name, unless overridden in configuration. */
    @JsonValue
    public String command() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static LatexEngine parse(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        for (LatexEngine engine : values()) {
            if (engine.command().equals(value.strip().toLowerCase(Locale.ROOT))) {
                return engine;
            }
        }
        throw new ValidationException("Unsupported LaTeX engine: " + value
                + " (expected pdflatex, xelatex, lualatex or latex)");
    }
}
