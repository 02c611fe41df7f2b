package com.scriptorium.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for repository, file and compilation operations.
 */
@Service
public class ScriptoriumMetrics {

    private final MeterRegistry registry;

    public ScriptoriumMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param operation "init", "write", "delete" or "branch"
     */
    public void recordCommit(String operation) {
        Counter.builder("scriptorium.git.commits")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordStagingAttempts(int attempts) {
        DistributionSummary.builder("scriptorium.staging.attempts")
                .description("Staging attempts needed before the path appeared in the index")
                .register(registry)
                .record(attempts);
    }

    public void recordStagingExhausted() {
        Counter.builder("scriptorium.staging.exhausted")
                .register(registry)
                .increment();
    }

    public void recordSelfHeal() {
        Counter.builder("scriptorium.repository.self_heal")
                .description("Repositories rebuilt because the index row outlived the directory")
                .register(registry)
                .increment();
    }

    public void recordIndexLag(String operation) {
        Counter.builder("scriptorium.index.lag")
                .description("Index updates that failed after the Git commit succeeded")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordCompilationResult(String status) {
        Counter.builder("scriptorium.compilations.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordCompilationDuration(String engine, long ms) {
        Timer.builder("scriptorium.compilation.duration")
                .tag("engine", engine)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
