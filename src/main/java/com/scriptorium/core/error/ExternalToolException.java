package com.scriptorium.core.error;

/**
 * A Git or LaTeX subprocess exited non-zero. The operation aborts in place;
 * Git commands that already succeeded are not rolled back.
 */
public class ExternalToolException extends ScriptoriumException {

    private final int exitCode;

    public ExternalToolException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public ExternalToolException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    public int exitCode() {
        return exitCode;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.EXTERNAL_TOOL_FAILURE;
    }
}
