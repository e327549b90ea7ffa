package org.tinyasm.compiler.api;

import org.tinyasm.compiler.frontend.ast.FunctionDef;
import org.tinyasm.compiler.frontend.tree.SyntaxTreeReader;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the tinyasm lowering engine.
 */
public interface ICompiler {

    /**
     * Lowers and optimizes the given functions.
     *
     * @param functions The top-level function definitions, in source order.
     * @return The compiled program.
     * @throws CompilationException if a construct cannot be lowered.
     */
    CompiledProgram compile(List<FunctionDef> functions) throws CompilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=errors only ... 4=trace).
     */
    void setVerbosity(int level);

    /**
     * Compiles a syntax-tree document produced by the external parser.
     * @param treeDocument Path to the JSON tree document.
     * @return The compiled program.
     * @throws CompilationException if the document is malformed or a construct cannot be lowered.
     * @throws IOException if the file cannot be read.
     */
    default CompiledProgram compile(Path treeDocument) throws CompilationException, IOException {
        try (Reader reader = Files.newBufferedReader(treeDocument, StandardCharsets.UTF_8)) {
            return compile(new SyntaxTreeReader().read(reader));
        }
    }
}
