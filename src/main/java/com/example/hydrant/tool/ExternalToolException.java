package com.example.hydrant.tool;

/**
 * An external tool could not be run, timed out, or exited non-zero.
 */
public class ExternalToolException extends RuntimeException {

    private final String tool;

    public ExternalToolException(String tool, String message) {
        super(tool + ": " + message);
        this.tool = tool;
    }

    public ExternalToolException(String tool, String message, Throwable cause) {
        super(tool + ": " + message, cause);
        this.tool = tool;
    }

    public static ExternalToolException nonZeroExit(String tool, CommandResult result) {
        String stderr = result.stderr() == null ? "" : result.stderr().trim();
        return new ExternalToolException(tool, "exited with status " + result.exitCode()
                + (stderr.isEmpty() ? "" : " (" + stderr + ")"));
    }

    public String getTool() {
        return tool;
    }
}
