package com.scriptorium.core.files;

import com.scriptorium.core.config.ScriptoriumProperties;
import com.scriptorium.core.error.ConflictException;
import com.scriptorium.core.error.ExternalToolException;
import com.scriptorium.core.git.GitCommandRunner;
import com.scriptorium.core.git.GitResult;
import com.scriptorium.core.metrics.ScriptoriumMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * Stages one path, escalating through {@link StagingStrategy} until
 * {@code git diff --cached} reports it or the attempt budget runs out.
 */
@Component
public class StagingProtocol {

    private static final Logger log = LoggerFactory.getLogger(StagingProtocol.class);

    private final GitCommandRunner git;
    private final ScriptoriumMetrics metrics;
    private final int maxAttempts;
    private final long retryDelayMillis;

    public StagingProtocol(GitCommandRunner git, ScriptoriumMetrics metrics, ScriptoriumProperties properties) {
        this(git, metrics, properties.getStagingMaxAttempts(), properties.getStagingRetryDelayMillis());
    }

    StagingProtocol(GitCommandRunner git, ScriptoriumMetrics metrics, int maxAttempts, long retryDelayMillis) {
        this.git = git;
        this.metrics = metrics;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryDelayMillis = Math.max(0, retryDelayMillis);
    }

    /**
     * @return the number of attempts used
     * @throws ConflictException with reason STAGING_EXHAUSTED when the path never shows up as staged
     */
    public int stage(Path repoPath, String relative) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            StagingStrategy strategy = StagingStrategy.forAttempt(attempt);
            GitResult added = git.exec(repoPath, strategy.addArguments(repoPath, relative).toArray(String[]::new));
            if (!added.success()) {
                log.debug("Staging attempt {} ({}) for {} exited {}: {}",
                        attempt, strategy, relative, added.exitCode(), added.diagnostic());
            }

            if (isStaged(repoPath, relative)) {
                if (attempt > 1) {
                    log.info("File {} staged on attempt {} ({})", relative, attempt, strategy);
                }
                metrics.recordStagingAttempts(attempt);
                return attempt;
            }

            log.warn("File {} not staged after attempt {} ({})", relative, attempt, strategy);
            if (attempt < maxAttempts) {
                pause();
            }
        }
        metrics.recordStagingExhausted();
        throw new ConflictException(ConflictException.Reason.STAGING_EXHAUSTED,
                "Failed to stage file " + relative + " after " + maxAttempts + " attempts");
    }

    boolean isStaged(Path repoPath, String relative) {
        // -z keeps names with quotes, tabs or backslashes unescaped
        GitResult staged = git.exec(repoPath, "diff", "--cached", "--name-only", "-z", "--", relative);
        if (!staged.success()) {
            log.debug("Could not list staged files: {}", staged.diagnostic());
            return false;
        }
        return Arrays.stream(staged.stdout().split("\0"))
                .anyMatch(relative::equals);
    }

    /**
     * Drops a path from the index so a failed write does not leak into the
     * next commit made from this working tree.
     */
    public void unstage(Path repoPath, String relative) {
        GitResult reset = git.exec(repoPath, "reset", "-q", "--", relative);
        if (!reset.success()) {
            log.warn("Could not unstage {}: {}", relative, reset.diagnostic());
        }
    }

    private void pause() {
        if (retryDelayMillis == 0) {
            return;
        }
        try {
            Thread.sleep(retryDelayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalToolException("Interrupted while staging", e);
        }
    }
}
