package org.tinyasm.compiler.diagnostics;

/**
 * Represents a single non-fatal diagnostic message raised while lowering.
 *
 * @param type The type of the diagnostic.
 * @param message The diagnostic message.
 * @param path The structural path of the node the message refers to.
 */
public record Diagnostic(Type type, String message, String path) {

    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** Code that compiles but probably does not do what was meant. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", type, path, message);
    }
}
