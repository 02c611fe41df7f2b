package com.scriptorium.core.compile;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.scriptorium.core.config.ScriptoriumProperties;
import com.scriptorium.core.error.ExternalToolException;
import com.scriptorium.core.error.NotFoundException;
import com.scriptorium.core.error.ValidationException;
import com.scriptorium.core.repository.RepositoryLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Reads and writes {@code metadata.json} status documents.
 *
 * <p>Transitions are compare-and-set per job: a document in a terminal state
 * is never rewritten, and a transition the state machine forbids is skipped.
 */
@Component
public class CompilationStatusStore {

    private static final Logger log = LoggerFactory.getLogger(CompilationStatusStore.class);

    static final String METADATA_FILE = "metadata.json";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path storageRoot;
    private final Map<String, Path> jobDirectories = new ConcurrentHashMap<>();
    private final Map<String, Object> jobLocks = new ConcurrentHashMap<>();

    public CompilationStatusStore(ScriptoriumProperties properties) {
        this(properties.getStorageRoot());
    }

    CompilationStatusStore(Path storageRoot) {
        this.storageRoot = storageRoot;
    }

    /**
     * Writes the initial document and remembers where the job lives.
     */
    public void create(Path jobDirectory, CompilationJob job) {
        write(jobDirectory, job);
        jobDirectories.put(job.jobId(), jobDirectory);
    }

    public CompilationJob read(String jobId) {
        return read(locate(jobId));
    }

    /**
     * Applies {@code change} if the job may move to {@code next}.
     *
     * @return the new document, or empty when the job was already terminal or the
     *         transition is not allowed from its current state
     */
    public Optional<CompilationJob> transition(String jobId, CompilationStatus next, UnaryOperator<CompilationJob> change) {
        Path jobDirectory = locate(jobId);
        synchronized (jobLocks.computeIfAbsent(jobId, id -> new Object())) {
            CompilationJob current = read(jobDirectory);
            if (!current.status().canTransitionTo(next)) {
                log.debug("Job {} is {}; ignoring transition to {}", jobId, current.status().value(), next.value());
                return Optional.empty();
            }
            CompilationJob updated = change.apply(current);
            write(jobDirectory, updated);
            if (updated.status().isTerminal()) {
                jobLocks.remove(jobId);
                jobDirectories.remove(jobId);
            } else {
                jobDirectories.put(jobId, jobDirectory);
            }
            return Optional.of(updated);
        }
    }

    /**
     * Directory of a job: remembered while the job is live, otherwise found by scanning
     * the {@code compilations/} directory of every repository under the storage root.
     */
    public Path locate(String jobId) {
        validateJobId(jobId);
        Path known = jobDirectories.get(jobId);
        if (known != null && Files.isRegularFile(known.resolve(METADATA_FILE))) {
            return known;
        }
        if (Files.isDirectory(storageRoot)) {
            try (DirectoryStream<Path> repositories = Files.newDirectoryStream(storageRoot, Files::isDirectory)) {
                for (Path repository : repositories) {
                    Path candidate = repository.resolve(RepositoryLayout.COMPILATIONS_DIR).resolve(jobId);
                    if (Files.isRegularFile(candidate.resolve(METADATA_FILE))) {
                        return candidate;
                    }
                }
            } catch (IOException e) {
                log.warn("Could not scan {} for job {}: {}", storageRoot, jobId, e.getMessage());
            }
        }
        throw new NotFoundException("Compilation not found: " + jobId);
    }

    boolean isCached(String jobId) {
        return jobDirectories.containsKey(jobId);
    }

    private CompilationJob read(Path jobDirectory) {
        Path file = jobDirectory.resolve(METADATA_FILE);
        try {
            return objectMapper.readValue(file.toFile(), CompilationJob.class);
        } catch (IOException e) {
            throw new ExternalToolException("Cannot read compilation status " + file, e);
        }
    }

    private void write(Path jobDirectory, CompilationJob job) {
        Path target = jobDirectory.resolve(METADATA_FILE);
        Path temp = jobDirectory.resolve(METADATA_FILE + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), job);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ExternalToolException("Cannot write compilation status " + target, e);
        }
    }

    private static void validateJobId(String jobId) {
        try {
            UUID.fromString(jobId);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ValidationException("Invalid compilation id: " + jobId);
        }
    }
}
