package org.tinyasm.compiler.support;

import org.tinyasm.compiler.Compiler;
import org.tinyasm.compiler.CompilerOptions;
import org.tinyasm.compiler.api.CompilationException;
import org.tinyasm.compiler.api.CompiledProgram;
import org.tinyasm.compiler.frontend.ast.FunctionDef;
import org.tinyasm.compiler.ir.IrItem;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Helpers to compile trees and look at instruction streams as text lines.
 */
public final class Listings {

    public static final CompilerOptions UNOPTIMIZED = new CompilerOptions(false, false, 1, "");
    public static final CompilerOptions OPTIMIZED = new CompilerOptions(true, true, 1, "");

    private Listings() {}

    public static CompiledProgram compile(CompilerOptions options, FunctionDef... functions) throws CompilationException {
        return new Compiler(options).compile(List.of(functions));
    }

    public static CompiledProgram compile(FunctionDef... functions) throws CompilationException {
        return compile(UNOPTIMIZED, functions);
    }

    /**
     * @return Each item as it appears in the listing, without indentation.
     */
    public static List<String> lines(List<IrItem> items) {
        return items.stream().map(Object::toString).collect(Collectors.toList());
    }

    public static List<String> lines(CompiledProgram program, String function) {
        return lines(program.unit(function).orElseThrow().items());
    }

    /**
     * @return Label definitions in the stream, without the colon.
     */
    public static List<String> labels(List<String> lines) {
        return lines.stream().filter(l -> l.endsWith(":")).map(l -> l.substring(0, l.length() - 1)).collect(Collectors.toList());
    }
}
