package com.scriptorium.dispatch.cli;

import com.scriptorium.core.compile.CompilationJob;
import com.scriptorium.core.compile.CompilationStatus;
import com.scriptorium.core.compile.OutputFile;
import com.scriptorium.core.engine.OperationResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Scriptorium CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SCRIPTORIUM v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SCRIPTORIUM]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warning(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void failure(OperationResult<?> result) {
        error(result.errorKind() + ": " + result.message());
    }

    public static void job(CompilationJob job) {
        System.out.println("JOB " + job.jobId());
        System.out.println("Sub-project: " + job.subprojectId() + " (" + job.mainFile() + ")");
        System.out.println("Engine: " + job.engine().command() + " -> " + job.outputFormat().extension());
        String status = "Status: " + job.status().value();
        if (job.status() == CompilationStatus.COMPLETED) {
            success(status);
        } else if (job.status().isTerminal()) {
            error(status);
        } else {
            info(status);
        }
        for (String warning : job.warnings()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(yellow) !|@ " + warning));
        }
        for (String error : job.errors()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(red) -|@ " + error));
        }
        for (OutputFile file : job.outputFiles()) {
            System.out.println("  " + file.path() + " (" + file.size() + " bytes)");
        }
    }
}
