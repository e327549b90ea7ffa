package org.tinyasm.compiler;

import org.tinyasm.compiler.api.CompiledProgram;
import org.tinyasm.compiler.diagnostics.CompilerLogger;
import org.tinyasm.compiler.diagnostics.Diagnostic;
import org.tinyasm.compiler.frontend.ast.BinaryOperator;
import org.tinyasm.compiler.frontend.ast.FunctionDef;
import org.tinyasm.compiler.support.IrInterpreter;
import org.tinyasm.compiler.support.Listings;
import org.tinyasm.compiler.support.Trees;
import org.tinyasm.junit.extensions.logging.ExpectLog;
import org.tinyasm.junit.extensions.logging.LogLevel;
import org.tinyasm.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tinyasm.compiler.support.Trees.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CompilerTest {

    @AfterEach
    void resetLogger() {
        CompilerLogger.setLevel(CompilerLogger.INFO);
    }

    @Test
    void defaultOptionsComeFromTheReferenceConfiguration() {
        assertThat(new Compiler().options()).isEqualTo(new CompilerOptions(true, true, 1, "main"));
    }

    @Test
    void existingEntryPointIsRecorded() throws Exception {
        CompiledProgram program = new Compiler(new CompilerOptions(true, true, 1, "main"))
                .compile(List.of(Trees.factorial(), fn("main", List.of(), ret(call("factorial", num(5))))));

        assertThat(program.entryPoint()).contains("main");
        assertThat(new IrInterpreter(program).call("main")).isEqualTo(120);
    }

    @Test
    void missingEntryPointLeavesTheProgramWithoutLauncher() throws Exception {
        Compiler compiler = new Compiler(new CompilerOptions(true, true, 1, "main"));

        CompiledProgram program = compiler.compile(List.of(Trees.factorial()));

        assertThat(program.entryPoint()).isEmpty();
        assertThat(compiler.getDiagnostics().getDiagnostics())
                .containsExactly(new Diagnostic(Diagnostic.Type.INFO, "No function named 'main'; the listing has no launcher", "<program>"));
        assertThat(compiler.getDiagnostics().hasWarnings()).isFalse();
    }

    @Test
    void blankEntryPointReportsNothing() throws Exception {
        Compiler compiler = new Compiler(Listings.OPTIMIZED);

        CompiledProgram program = compiler.compile(List.of(Trees.counter()));

        assertThat(program.entryPoint()).isEqualTo(Optional.empty());
        assertThat(compiler.getDiagnostics().getDiagnostics()).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*Unresolved name 'limit' promoted to global", occurrences = 2)
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*Unresolved name 'base' promoted to global")
    void everyCompilationStartsFromAFreshState() throws Exception {
        FunctionDef readsGlobals = fn("f", List.of(), ret(bin(BinaryOperator.ADD, name("limit"), name("base"))));
        FunctionDef readsOne = fn("g", List.of(), ret(name("limit")));
        Compiler compiler = new Compiler(Listings.UNOPTIMIZED);

        CompiledProgram first = compiler.compile(List.of(readsGlobals));
        assertThat(first.globals()).containsExactly("base", "limit");
        assertThat(compiler.getDiagnostics().getDiagnostics()).hasSize(2);

        CompiledProgram second = compiler.compile(List.of(readsOne));
        assertThat(second.globals()).containsExactly("limit");
        assertThat(compiler.getDiagnostics().getDiagnostics())
                .extracting(Diagnostic::path).containsExactly("g/body[0]/Return.value");
    }

    @Test
    void labelNumberingRestartsForEachProgram() throws Exception {
        Compiler compiler = new Compiler(Listings.UNOPTIMIZED);

        CompiledProgram first = compiler.compile(List.of(Trees.factorial()));
        CompiledProgram second = compiler.compile(List.of(Trees.factorial()));

        assertThat(second.units()).isEqualTo(first.units());
    }

    @Test
    void parallelWorkersProduceAnEquivalentProgram() throws Exception {
        List<FunctionDef> functions = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            functions.add(fn("scale" + i, List.of("x"),
                    ifElse(name("x"), block(ret(bin(BinaryOperator.MULT, name("x"), num(i)))), block(ret(num(-1))))));
        }

        CompiledProgram sequential = new Compiler(Listings.OPTIMIZED).compile(functions);
        CompiledProgram parallel = new Compiler(Listings.OPTIMIZED.withWorkers(4)).compile(functions);

        assertThat(parallel.units()).extracting(u -> u.functionName())
                .containsExactlyElementsOf(sequential.units().stream().map(u -> u.functionName()).toList());
        IrInterpreter a = new IrInterpreter(sequential);
        IrInterpreter b = new IrInterpreter(parallel);
        for (int i = 0; i < 8; i++) {
            assertThat(b.call("scale" + i, 3)).isEqualTo(a.call("scale" + i, 3)).isEqualTo(3L * i);
            assertThat(b.call("scale" + i, 0)).isEqualTo(-1);
        }
    }

    @Test
    void verbosityIsAppliedWhenCompiling() throws Exception {
        Compiler compiler = new Compiler(Listings.OPTIMIZED);
        compiler.setVerbosity(CompilerLogger.DEBUG);

        compiler.compile(List.of(Trees.counter()));

        assertThat(CompilerLogger.getLevel()).isEqualTo(CompilerLogger.DEBUG);
    }
}
