package com.scriptorium.core.subproject;

import com.scriptorium.core.error.ValidationException;
import com.scriptorium.core.repository.RepositoryLayout;

/**
 * A sub-project is named by its top-level directory: one path segment that is
 * not reserved by the repository layout.
 */
public final class SubprojectNames {

    private SubprojectNames() {
    }

    public static void validate(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Sub-project id is required");
        }
        if (name.contains("/") || name.contains("\\") || name.indexOf('\0') >= 0
                || name.equals(".") || name.equals("..") || !name.equals(name.strip())
                || name.equals(".git") || name.equals(RepositoryLayout.COMPILATIONS_DIR)) {
            throw new ValidationException("Invalid sub-project id: " + name);
        }
    }
}
