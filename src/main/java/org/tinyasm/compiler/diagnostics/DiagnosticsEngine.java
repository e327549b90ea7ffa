package org.tinyasm.compiler.diagnostics;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects diagnostic messages raised during lowering.
 * <p>
 * This decouples reporting from the lowering logic. Diagnostics never abort a compilation;
 * hard errors are thrown as {@link org.tinyasm.compiler.api.CompilationException}.
 * Safe for use by concurrent lowering workers.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new CopyOnWriteArrayList<>();

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param path    The structural path of the node.
     */
    public void reportWarning(String message, String path) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, path));
        CompilerLogger.warn(path + ": " + message);
    }

    /**
     * Reports an informational message.
     *
     * @param message The message.
     * @param path    The structural path of the node.
     */
    public void reportInfo(String message, String path) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.INFO, message, path));
        CompilerLogger.debug(path + ": " + message);
    }

    /**
     * @return {@code true} if at least one warning was reported.
     */
    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.WARNING);
    }

    /**
     * @return An unmodifiable snapshot of all collected diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }
}
