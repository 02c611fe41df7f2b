package com.scriptorium.core.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of the caller, resolved upstream by the authentication layer.
 * Used for commit attribution and branch permission checks.
 *
 * @param id    user id
 * @param name  display name written as the Git author name
 * @param email email written as the Git author email
 */
public record Actor(UUID id, String name, String email) {

    public static final String DEFAULT_NAME = "Scriptorium User";
    public static final String DEFAULT_EMAIL = "user@scriptorium.local";

    public Actor {
        Objects.requireNonNull(id, "actor id must not be null");
    }

    public String authorName() {
        return name == null || name.isBlank() ? DEFAULT_NAME : name;
    }

    public String authorEmail() {
        return email == null || email.isBlank() ? DEFAULT_EMAIL : email;
    }
}
