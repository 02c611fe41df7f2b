package com.scriptorium.dispatch.api;

import com.scriptorium.core.config.ScriptoriumProperties;
import com.scriptorium.core.engine.VersionControlEngine;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Marks compilations submitted over HTTP as timed out once the configured
 * deadline passes. Jobs that already finished are left untouched.
 */
@Component
public class CompilationWatchdog {

    private static final Logger log = LoggerFactory.getLogger(CompilationWatchdog.class);

    private final VersionControlEngine engine;
    private final long timeoutSeconds;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "compilation-watchdog");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public CompilationWatchdog(VersionControlEngine engine, ScriptoriumProperties properties) {
        this(engine, properties.getCompilationTimeoutSeconds());
    }

    CompilationWatchdog(VersionControlEngine engine, long timeoutSeconds) {
        this.engine = engine;
        this.timeoutSeconds = timeoutSeconds;
    }

    public void watch(String jobId) {
        scheduler.schedule(() -> expire(jobId), timeoutSeconds, TimeUnit.SECONDS);
        log.debug("Watching compilation {} (timeout={}s)", jobId, timeoutSeconds);
    }

    void expire(String jobId) {
        var result = engine.markCompilationTimeout(jobId);
        if (!result.isSuccess()) {
            log.warn("Could not expire compilation {}: {}", jobId, result.message());
        }
    }

    @PreDestroy
    void shutdown() {
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Compilation watchdog stopped");
    }
}
