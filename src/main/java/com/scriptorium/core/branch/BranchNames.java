package com.scriptorium.core.branch;

import com.scriptorium.core.error.ValidationException;

/**
 * Validation of branch names against Git's ref-name rules.
 */
final class BranchNames {

    static final int MAX_LENGTH = 100;

    private static final String FORBIDDEN_CHARACTERS = " ~^:?*[\\";

    private BranchNames() {}

    static void validate(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Branch name is required");
        }
        if (name.length() > MAX_LENGTH) {
            throw new ValidationException("Branch name must be at most " + MAX_LENGTH + " characters");
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c < 0x20 || c == 0x7f || FORBIDDEN_CHARACTERS.indexOf(c) >= 0) {
                throw invalid(name, "contains '" + printable(c) + "'");
            }
        }
        if (name.startsWith("-")) {
            throw invalid(name, "starts with '-'");
        }
        if (name.contains("..") || name.contains("@{") || name.contains("//")) {
            throw invalid(name, "contains an illegal sequence");
        }
        if (name.equals("@")) {
            throw invalid(name, "is '@'");
        }
        if (name.startsWith("/") || name.endsWith("/") || name.endsWith(".") || name.endsWith(".lock")) {
            throw invalid(name, "has an illegal start or end");
        }
        for (String component : name.split("/")) {
            if (component.startsWith(".") || component.endsWith(".lock")) {
                throw invalid(name, "has an illegal path component '" + component + "'");
            }
        }
    }

    private static String printable(char c) {
        return c < 0x20 || c == 0x7f ? String.format("\\u%04x", (int) c) : String.valueOf(c);
    }

    private static ValidationException invalid(String name, String reason) {
        return new ValidationException("Invalid branch name '" + name + "': " + reason);
    }
}
