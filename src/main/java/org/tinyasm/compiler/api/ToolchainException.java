package org.tinyasm.compiler.api;

/**
 * Thrown when the external assembler or linker fails. Failures are assumed to be
 * deterministic for the same listing, so callers do not retry.
 */
public class ToolchainException extends Exception {

    private final int exitCode;
    private final String output;

    /**
     * @param message The detail message.
     * @param exitCode The exit code of the failed command, or -1 if it could not be started.
     * @param output The captured standard output and error of the command.
     * @param cause The cause, may be null.
     */
    public ToolchainException(String message, int exitCode, String output, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
        this.output = output;
    }

    /**
     * @return The exit code of the failed command, or -1 if it could not be started.
     */
    public int exitCode() {
        return exitCode;
    }

    /**
     * @return The captured output of the failed command.
     */
    public String output() {
        return output;
    }
}
