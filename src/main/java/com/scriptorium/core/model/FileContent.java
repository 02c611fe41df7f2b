package com.scriptorium.core.model;

import java.time.Instant;

public record FileContent(String path, String content, long size, Instant lastModified) {}
