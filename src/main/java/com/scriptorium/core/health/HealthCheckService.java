package com.scriptorium.core.health;

import com.scriptorium.core.config.ScriptoriumProperties;
import com.scriptorium.core.git.GitCommandRunner;
import com.scriptorium.core.persistence.IndexStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final GitCommandRunner git;
    private final IndexStore indexStore;
    private final DataSource dataSource;
    private final ScriptoriumProperties properties;

    public HealthCheckService(
            GitCommandRunner git,
            IndexStore indexStore,
            @Autowired(required = false) DataSource dataSource,
            ScriptoriumProperties properties) {
        this.git = git;
        this.indexStore = indexStore;
        this.dataSource = dataSource;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGit());
        results.add(checkDatabase());
        results.add(checkStorage());
        return results;
    }

    private HealthStatus checkGit() {
        return git.version()
                .map(version -> HealthStatus.up("git", version,
                        Map.of("executable", properties.getGitExecutable())))
                .orElseGet(() -> HealthStatus.down("git",
                        "Git executable '" + properties.getGitExecutable() + "' not available", Map.of()));
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null || !indexStore.isDurable()) {
            return HealthStatus.degraded("database", "No DataSource configured; index is in memory");
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return HealthStatus.up("database",
                        "Database connection valid", Map.of());
            }
            return HealthStatus.down("database",
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return HealthStatus.down("database",
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkStorage() {
        Path root = properties.getStorageRoot();
        Map<String, String> metadata = Map.of("root", root.toString());
        if (!Files.exists(root)) {
            Path parent = root.getParent();
            if (parent != null && Files.isWritable(parent)) {
                return HealthStatus.up("storage",
                        "Storage root will be created on first use", metadata);
            }
            return HealthStatus.down("storage",
                    "Storage root does not exist and cannot be created", metadata);
        }
        if (!Files.isDirectory(root) || !Files.isWritable(root)) {
            return HealthStatus.down("storage",
                    "Storage root is not a writable directory", metadata);
        }
        return HealthStatus.up("storage", "Storage root writable", metadata);
    }
}
