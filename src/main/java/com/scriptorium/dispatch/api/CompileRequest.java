package com.scriptorium.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/branches/{branchId}/compilations.
 *
 * @param mainFile     nullable, defaults to main.tex
 * @param engine       pdflatex, xelatex, lualatex or latex; nullable
 * @param outputFormat pdf, dvi or ps; nullable
 */
public record CompileRequest(
    @JsonProperty("subproject_id") String subprojectId,
    @JsonProperty("main_file") String mainFile,
    String engine,
    @JsonProperty("output_format") String outputFormat
) {}
