package com.scriptorium.core.git;

/**
 * Exit code and captured output of a single git invocation.
 */
public record GitResult(int exitCode, String stdout, String stderr) {

    public boolean success() {
        return exitCode == 0;
    }

    /** Best available diagnostic text: stderr, else stdout. */
    public String diagnostic() {
        if (stderr != null && !stderr.isBlank()) {
            return stderr.strip();
        }
        return stdout == null ? "" : stdout.strip();
    }
}
