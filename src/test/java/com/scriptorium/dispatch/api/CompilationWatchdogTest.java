package com.scriptorium.dispatch.api;

import com.scriptorium.core.engine.OperationResult;
import com.scriptorium.core.engine.VersionControlEngine;
import com.scriptorium.core.error.ErrorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CompilationWatchdogTest {

    private final VersionControlEngine engine = mock(VersionControlEngine.class);
    private final CompilationWatchdog watchdog = new CompilationWatchdog(engine, 0);

    @AfterEach
    void tearDown() {
        watchdog.shutdown();
    }

    @Test
    @DisplayName("watched jobs are marked timed out once the deadline passes")
    void expiresWatchedJob() {
        when(engine.markCompilationTimeout("job-1")).thenReturn(OperationResult.failure(ErrorKind.NOT_FOUND, "gone"));

        watchdog.watch("job-1");

        verify(engine, timeout(2000)).markCompilationTimeout("job-1");
    }
}
