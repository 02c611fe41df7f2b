package com.scriptorium.core.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RepositoryLayoutTest {

    @Test
    @DisplayName("sanitize lower-cases and replaces unsafe characters")
    void sanitize() {
        assertEquals("my_thesis_2024", RepositoryLayout.sanitize("My Thesis 2024"));
        assertEquals("a-b_c___", RepositoryLayout.sanitize("a-b_c/.."));
    }

    @Test
    @DisplayName("directoryFor appends the first eight characters of the project id")
    void directoryFor() {
        UUID id = UUID.fromString("12345678-aaaa-bbbb-cccc-1234567890ab");
        assertEquals(Path.of("/data/thesis_12345678"),
                RepositoryLayout.directoryFor(Path.of("/data"), id, "Thesis"));
    }
}
