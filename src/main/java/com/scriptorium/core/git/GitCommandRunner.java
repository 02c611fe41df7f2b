package com.scriptorium.core.git;

import com.scriptorium.core.config.ScriptoriumProperties;
import com.scriptorium.core.error.ExternalToolException;
import com.scriptorium.core.error.InfrastructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs the {@code git} CLI via {@link ProcessBuilder} rather than depending on JGit.
 *
 * <p>Every call blocks until the process exits. Identity for commits is passed
 * with {@code -c user.name=... -c user.email=...} so nothing is persisted in
 * the repository configuration.
 */
@Component
public class GitCommandRunner {

    private static final Logger log = LoggerFactory.getLogger(GitCommandRunner.class);

    private final String executable;

    public GitCommandRunner(ScriptoriumProperties properties) {
        this(properties.getGitExecutable());
    }

    public GitCommandRunner(String executable) {
        this.executable = executable;
    }

    /**
     * Runs a git command and throws {@link ExternalToolException} on a non-zero exit.
     *
     * @return trimmed stdout
     */
    public String run(Path workDir, String... args) {
        GitResult result = exec(workDir, List.of(), args);
        if (!result.success()) {
            throw failure(workDir, result, args);
        }
        return result.stdout().strip();
    }

    /**
     * Runs a git command with a per-invocation author identity.
     */
    public String runAs(Path workDir, String name, String email, String... args) {
        var config = List.of("user.name=" + name, "user.email=" + email);
        GitResult result = exec(workDir, config, args);
        if (!result.success()) {
            throw failure(workDir, result, args);
        }
        return result.stdout().strip();
    }

    /**
     * Runs a git command and returns the raw result regardless of exit code.
     */
    public GitResult exec(Path workDir, String... args) {
        return exec(workDir, List.of(), args);
    }

    /**
     * Runs a git command with extra {@code -c key=value} settings.
     *
     * @param workDir working directory for the git command
     * @param config  settings applied to this invocation only
     * @param args    git arguments (e.g. "checkout", "-b", "branch-name")
     */
    protected GitResult exec(Path workDir, List<String> config, String... args) {
        var command = buildCommand(config, args);
        log.debug("Running: {} (in {})", command, workDir);

        Process process;
        try {
            var builder = new ProcessBuilder(command)
                    .directory(workDir.toFile());
            builder.environment().put("GIT_TERMINAL_PROMPT", "0");
            builder.environment().put("LC_ALL", "C");
            process = builder.start();
        } catch (IOException e) {
            throw new InfrastructureException("Cannot start git executable '" + executable + "'", e);
        }

        try {
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));
            String stdout = readAll(process.getInputStream());
            int exitCode = process.waitFor();
            var result = new GitResult(exitCode, stdout, stderr.get());
            if (!result.success()) {
                log.debug("git exited with {}: {}", exitCode, result.diagnostic());
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ExternalToolException("Interrupted while running git " + String.join(" ", args), e);
        } catch (ExecutionException | UncheckedIOException e) {
            process.destroyForcibly();
            throw new ExternalToolException("Failed to read git output for " + String.join(" ", args), e);
        }
    }

    /**
     * Resolves a revision to its full commit hash.
     */
    public String revParse(Path workDir, String revision) {
        return run(workDir, "rev-parse", revision);
    }

    /**
     * Head of a local branch, or empty when the ref does not exist.
     */
    public Optional<String> branchHead(Path workDir, String branchName) {
        GitResult result = exec(workDir, "rev-parse", "--verify", "--quiet", "refs/heads/" + branchName);
        if (!result.success() || result.stdout().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(result.stdout().strip());
    }

    public void checkout(Path workDir, String branchName) {
        run(workDir, "checkout", branchName);
    }

    /**
     * Commits the staged changes as the given author and returns the new HEAD hash.
     */
    public String commitAs(Path workDir, String name, String email, String message) {
        runAs(workDir, name, email, "commit", "-m", message, "--author", name + " <" + email + ">");
        return revParse(workDir, "HEAD");
    }

    /**
     * Returns the git version string, or empty when the binary cannot be run.
     */
    public Optional<String> version() {
        try {
            GitResult result = exec(Path.of(".").toAbsolutePath(), List.of(), "--version");
            return result.success() ? Optional.of(result.stdout().strip()) : Optional.empty();
        } catch (InfrastructureException | ExternalToolException e) {
            return Optional.empty();
        }
    }

    List<String> buildCommand(List<String> config, String... args) {
        var command = new ArrayList<String>();
        command.add(executable);
        command.add("-c");
        command.add("core.quotepath=false");
        command.add("-c");
        command.add("commit.gpgsign=false");
        for (String setting : config) {
            command.add("-c");
            command.add(setting);
        }
        command.addAll(Arrays.asList(args));
        return command;
    }

    private ExternalToolException failure(Path workDir, GitResult result, String... args) {
        String commandLine = "git " + String.join(" ", args);
        String diagnostic = result.diagnostic();
        String lower = diagnostic.toLowerCase(Locale.ROOT);

        String reason;
        if (lower.contains("not a git repository")) {
            reason = "Not a Git repository: " + workDir;
        } else if (lower.contains("author identity unknown")) {
            reason = "Git user configuration missing";
        } else if (lower.contains("permission denied")) {
            reason = "Permission denied in Git repository: " + workDir;
        } else if (!diagnostic.isEmpty()) {
            reason = diagnostic;
        } else {
            reason = "Unknown Git error (exit code: " + result.exitCode() + ")";
        }

        log.error("Git command failed: {} in {} (exit {}): {}", commandLine, workDir, result.exitCode(), diagnostic);
        return new ExternalToolException("Git command failed: " + commandLine + " - " + reason, result.exitCode());
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
