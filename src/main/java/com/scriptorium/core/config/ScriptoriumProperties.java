package com.scriptorium.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "scriptorium")
public class ScriptoriumProperties {

    private Storage storage = new Storage();
    private Git git = new Git();
    private Staging staging = new Staging();
    private Compilation compilation = new Compilation();
    private Locking locking = new Locking();

    // -- Flattened accessors --
    public Path getStorageRoot() { return Path.of(storage.root).toAbsolutePath().normalize(); }
    public String getGitExecutable() { return git.executable; }
    public String getSystemName() { return git.systemName; }
    public String getSystemEmail() { return git.systemEmail; }
    public int getStagingMaxAttempts() { return staging.maxAttempts; }
    public long getStagingRetryDelayMillis() { return staging.retryDelayMillis; }
    public int getCompilationPoolSize() { return compilation.poolSize; }
    public int getCompilationTimeoutSeconds() { return compilation.timeoutSeconds; }
    public String getLockingStrategy() { return locking.strategy; }

    /**
     * Returns the executable for a LaTeX engine, honouring configured overrides.
     */
    public String engineCommand(String engine) {
        String override = compilation.engineCommands.get(engine);
        return override != null && !override.isBlank() ? override : engine;
    }

    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public Staging getStaging() { return staging; }
    public void setStaging(Staging staging) { this.staging = staging; }
    public Compilation getCompilation() { return compilation; }
    public void setCompilation(Compilation compilation) { this.compilation = compilation; }
    public Locking getLocking() { return locking; }
    public void setLocking(Locking locking) { this.locking = locking; }

    public static class Storage {
        private String root = "./repositories";

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
    }

    public static class Git {
        private String executable = "git";
        private String systemName = "Scriptorium System";
        private String systemEmail = "system@scriptorium.local";

        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }
        public String getSystemName() { return systemName; }
        public void setSystemName(String systemName) { this.systemName = systemName; }
        public String getSystemEmail() { return systemEmail; }
        public void setSystemEmail(String systemEmail) { this.systemEmail = systemEmail; }
    }

    public static class Staging {
        private int maxAttempts = 3;
        private long retryDelayMillis = 100;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getRetryDelayMillis() { return retryDelayMillis; }
        public void setRetryDelayMillis(long retryDelayMillis) { this.retryDelayMillis = retryDelayMillis; }
    }

    public static class Compilation {
        private int poolSize = 2;
        private int timeoutSeconds = 300;
        private Map<String, String> engineCommands = new HashMap<>();

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public Map<String, String> getEngineCommands() { return engineCommands; }
        public void setEngineCommands(Map<String, String> engineCommands) { this.engineCommands = engineCommands; }
    }

    public static class Locking {
        private String strategy = "none";

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
    }
}
