package com.scriptorium.core.model;

import java.util.Locale;

/**
 * File types tracked in the index, derived from the file extension.
 */
public enum FileType {
    TEX, BIB, STY, CLS, PDF, PNG, JPG, TXT, MD, OTHER;

    public static FileType fromPath(String path) {
        String ext = extension(path);
        if (ext.equals("jpeg")) {
            return JPG;
        }
        for (FileType type : values()) {
            if (type != OTHER && type.name().toLowerCase(Locale.ROOT).equals(ext)) {
                return type;
            }
        }
        return OTHER;
    }

    public static String extension(String path) {
        if (path == null) {
            return "";
        }
        int slash = path.lastIndexOf('/');
        String name = slash >= 0 ? path.substring(slash + 1) : path;
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FileType fromDbValue(String value) {
        if (value == null) {
            return OTHER;
        }
        try {
            return valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
