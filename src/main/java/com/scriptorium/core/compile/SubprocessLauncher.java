package com.scriptorium.core.compile;

import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Plain subprocess invocation with stdin closed and output captured to a file.
 */
@Component
public class SubprocessLauncher implements ProcessLauncher {

    private static final File NULL_FILE = new File(
            System.getProperty("os.name").startsWith("Windows") ? "NUL" : "/dev/null");

    @Override
    public Process launch(List<String> command, Path workDir, Path transcript) throws IOException {
        return new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(transcript.toFile())
                .redirectInput(NULL_FILE)
                .start();
    }
}
