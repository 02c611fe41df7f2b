package com.scriptorium.core.compile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.scriptorium.core.error.ValidationException;

import java.util.Locale;

public enum OutputFormat {
    PDF("application/pdf"),
    DVI("application/x-dvi"),
    PS("application/postscript");

    public static final OutputFormat DEFAULT = PDF;

    private final String contentType;

    OutputFormat(String contentType) {
        this.contentType = contentType;
    }

    @JsonValue
    public String extension() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String contentType() {
        return contentType;
    }

    @JsonCreator
    public static OutputFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        for (OutputFormat format : values()) {
            if (format.extension().equals(value.strip().toLowerCase(Locale.ROOT))) {
                return format;
            }
        }
        throw new ValidationException("Unsupported output format: " + value + " (expected pdf, dvi or ps)");
    }
}
