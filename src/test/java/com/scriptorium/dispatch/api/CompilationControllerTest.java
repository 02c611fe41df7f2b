package com.scriptorium.dispatch.api;

import com.scriptorium.core.compile.CompilationArtifact;
import com.scriptorium.core.compile.CompilationJob;
import com.scriptorium.core.compile.CompilationStatus;
import com.scriptorium.core.compile.LatexEngine;
import com.scriptorium.core.compile.OutputFormat;
import com.scriptorium.core.engine.OperationResult;
import com.scriptorium.core.engine.VersionControlEngine;
import com.scriptorium.core.error.ErrorKind;
import com.scriptorium.core.model.Actor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CompilationController.class)
class CompilationControllerTest {

    private static final UUID BRANCH = UUID.randomUUID();
    private static final UUID ACTOR = UUID.randomUUID();
    private static final String JOB = "0f8fad5b-d9cb-469f-a165-70867728950e";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private VersionControlEngine engine;

    @MockitoBean
    private CompilationWatchdog watchdog;

    @TempDir
    Path tempDir;

    private static CompilationJob started() {
        return CompilationJob.started(JOB, UUID.randomUUID(), BRANCH, "paper", "main.tex", OutputFormat.PDF,
                LatexEngine.PDFLATEX, ACTOR, Instant.parse("2026-01-05T10:00:00Z"));
    }

    @Test
    @DisplayName("POST /compilations returns 202 with the job and starts the watchdog")
    void submit() throws Exception {
        when(engine.submitCompilation(eq(BRANCH), eq("paper"), isNull(), eq("pdflatex"), isNull(), any(Actor.class)))
                .thenReturn(OperationResult.ok(started()));

        mockMvc.perform(post("/api/v1/branches/{branchId}/compilations", BRANCH)
                        .header(ActorHeaders.ID, ACTOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subproject_id\":\"paper\",\"engine\":\"pdflatex\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.job_id").value(JOB))
                .andExpect(jsonPath("$.status").value("started"))
                .andExpect(jsonPath("$.engine").value("pdflatex"))
                .andExpect(jsonPath("$.output_format").value("pdf"));

        verify(watchdog).watch(JOB);
    }

    @Test
    @DisplayName("a missing sub-project is rejected without submitting")
    void missingSubproject() throws Exception {
        mockMvc.perform(post("/api/v1/branches/{branchId}/compilations", BRANCH)
                        .header(ActorHeaders.ID, ACTOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"main_file\":\"main.tex\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        verifyNoInteractions(engine, watchdog);
    }

    @Test
    @DisplayName("a rejected submission is not watched")
    void rejectedSubmission() throws Exception {
        when(engine.submitCompilation(eq(BRANCH), eq("paper"), isNull(), eq("context"), isNull(), any(Actor.class)))
                .thenReturn(OperationResult.failure(ErrorKind.VALIDATION_ERROR, "Unsupported engine: context"));

        mockMvc.perform(post("/api/v1/branches/{branchId}/compilations", BRANCH)
                        .header(ActorHeaders.ID, ACTOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subproject_id\":\"paper\",\"engine\":\"context\"}"))
                .andExpect(status().isBadRequest());

        verify(watchdog, never()).watch(anyString());
    }

    @Test
    @DisplayName("GET /compilations/{jobId} returns the status document")
    void getStatus() throws Exception {
        var done = started().running(Instant.now()).completed(Instant.now(), List.of("LaTeX Warning: x"), List.of());
        when(engine.getCompilationStatus(eq(JOB), any(Actor.class))).thenReturn(OperationResult.ok(done));

        mockMvc.perform(get("/api/v1/compilations/{jobId}", JOB)
                        .header(ActorHeaders.ID, ACTOR))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.warnings[0]").value("LaTeX Warning: x"));
    }

    @Test
    @DisplayName("the artifact is streamed as an attachment")
    void artifact() throws Exception {
        Path pdf = tempDir.resolve("main.pdf");
        Files.write(pdf, new byte[]{'%', 'P', 'D', 'F'});
        when(engine.getCompilationOutput(eq(JOB), isNull(), any(Actor.class)))
                .thenReturn(OperationResult.ok(new CompilationArtifact(JOB, pdf, "paper_0f8fad5b.pdf", 4,
                        OutputFormat.PDF)));

        mockMvc.perform(get("/api/v1/compilations/{jobId}/artifact", JOB)
                        .header(ActorHeaders.ID, ACTOR))
                .andExpect(status().isOk())
                .andExpect(content().contentType("application/pdf"))
                .andExpect(header().string("Content-Disposition", containsString("paper_0f8fad5b.pdf")))
                .andExpect(content().bytes(new byte[]{'%', 'P', 'D', 'F'}));
    }

    @Test
    @DisplayName("the artifact of an unfinished job is 404")
    void artifactNotReady() throws Exception {
        when(engine.getCompilationOutput(eq(JOB), eq("pdf"), any(Actor.class)))
                .thenReturn(OperationResult.failure(ErrorKind.NOT_FOUND, "Compilation has not completed"));

        mockMvc.perform(get("/api/v1/compilations/{jobId}/artifact", JOB)
                        .param("format", "pdf")
                        .header(ActorHeaders.ID, ACTOR))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /timeout marks the job")
    void timeout() throws Exception {
        var timedOut = started().finished(CompilationStatus.TIMEOUT, Instant.now(),
                List.of("Compilation timed out"));
        when(engine.markCompilationTimeout(JOB)).thenReturn(OperationResult.ok(timedOut));

        mockMvc.perform(post("/api/v1/compilations/{jobId}/timeout", JOB))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("timeout"));
    }
}
