package org.tinyasm.compiler;

import org.tinyasm.compiler.api.CompilationException;
import org.tinyasm.compiler.api.CompiledProgram;
import org.tinyasm.compiler.api.CompiledUnit;
import org.tinyasm.compiler.api.ICompiler;
import org.tinyasm.compiler.backend.optimize.OptimizationRegistry;
import org.tinyasm.compiler.diagnostics.CompilerLogger;
import org.tinyasm.compiler.diagnostics.DiagnosticsEngine;
import org.tinyasm.compiler.frontend.ast.FunctionDef;
import org.tinyasm.compiler.frontend.irgen.CompilationContext;
import org.tinyasm.compiler.frontend.irgen.IrGenerator;
import org.tinyasm.compiler.frontend.irgen.LoweredFunction;
import org.tinyasm.compiler.ir.IrItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The main compiler implementation. This class orchestrates the pipeline from the
 * syntax tree to a compiled program. Each call to {@link #compile(List)} uses a fresh
 * {@link CompilationContext}, so label numbers and global storage never leak between
 * programs. It is not thread-safe.
 */
public class Compiler implements ICompiler {

    private final CompilerOptions options;
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private int verbosity = -1;

    public Compiler() {
        this(CompilerOptions.defaults());
    }

    /**
     * @param options The compilation options.
     */
    public Compiler(CompilerOptions options) {
        this.options = options;
    }

    @Override
    public CompiledProgram compile(List<FunctionDef> functions) throws CompilationException {
        if (verbosity >= 0) {
            CompilerLogger.setLevel(verbosity);
        }
        diagnostics = new DiagnosticsEngine();
        CompilationContext context = new CompilationContext(diagnostics);

        // Phase 1: Lowering (scope resolution happens while each function is walked)
        CompilerLogger.debug("Lowering " + functions.size() + " functions");
        List<LoweredFunction> lowered = new IrGenerator(context, options.workers()).generate(functions);

        // Phase 2: Optimization
        OptimizationRegistry passes = OptimizationRegistry.initializeWithDefaults(options.deadStoreElimination(), options.peephole());
        List<CompiledUnit> units = new ArrayList<>(lowered.size());
        for (LoweredFunction fn : lowered) {
            List<IrItem> items = passes.apply(fn.name(), fn.items());
            CompilerLogger.trace(fn.name() + ": " + fn.items().size() + " -> " + items.size() + " items");
            units.add(new CompiledUnit(fn.name(), items, fn.localCount()));
        }

        // Phase 3: Program assembly
        Optional<String> entry = Optional.empty();
        if (!options.entryPoint().isEmpty()) {
            if (units.stream().anyMatch(u -> u.functionName().equals(options.entryPoint()))) {
                entry = Optional.of(options.entryPoint());
            } else {
                diagnostics.reportInfo("No function named '" + options.entryPoint() + "'; the listing has no launcher", "<program>");
            }
        }
        CompilerLogger.info("Compiled " + units.size() + " functions, " + context.globals().snapshot().size() + " globals");
        return new CompiledProgram(units, context.globals().snapshot(), context.strings(), context.storage(), entry);
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    /**
     * @return The diagnostics collected by the most recent compilation.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    /**
     * @return The options this compiler was created with.
     */
    public CompilerOptions options() {
        return options;
    }
}
