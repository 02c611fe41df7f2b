package com.scriptorium.core.compile;

/**
 * A file produced by a compilation.
 *
 * @param path relative to the job directory, e.g. {@code output/main.pdf}
 */
public record OutputFile(String name, long size, String path) {}
