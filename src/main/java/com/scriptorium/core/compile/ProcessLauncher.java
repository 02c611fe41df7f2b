package com.scriptorium.core.compile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts compiler processes.
 */
public interface ProcessLauncher {

    /**
     * @param command    executable and arguments
     * @param workDir    working directory
     * @param transcript file receiving the combined stdout and stderr
     */
    Process launch(List<String> command, Path workDir, Path transcript) throws IOException;
}
