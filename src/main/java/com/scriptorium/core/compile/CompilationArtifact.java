package com.scriptorium.core.compile;

import java.nio.file.Path;

/**
 * A downloadable compilation output.
 *
 * @param file     location on disk
 * @param filename suggested download name, {@code <subproject>_<jobId8>.<ext>}
 */
public record CompilationArtifact(String jobId, Path file, String filename, long size, OutputFormat format) {

    public String contentType() {
        return format.contentType();
    }
}
