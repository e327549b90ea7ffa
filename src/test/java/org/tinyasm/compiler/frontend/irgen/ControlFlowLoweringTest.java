package org.tinyasm.compiler.frontend.irgen;

import org.tinyasm.compiler.api.CompilerErrorCode;
import org.tinyasm.compiler.api.UnsupportedConstructException;
import org.tinyasm.compiler.diagnostics.DiagnosticsEngine;
import org.tinyasm.compiler.frontend.ast.Assign;
import org.tinyasm.compiler.frontend.ast.BinaryOperator;
import org.tinyasm.compiler.frontend.ast.CompareOperator;
import org.tinyasm.compiler.frontend.ast.FunctionDef;
import org.tinyasm.compiler.support.IrInterpreter;
import org.tinyasm.compiler.support.Listings;
import org.tinyasm.compiler.support.Trees;
import org.tinyasm.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.tinyasm.compiler.support.Listings.labels;
import static org.tinyasm.compiler.support.Listings.lines;
import static org.tinyasm.compiler.support.Trees.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ControlFlowLoweringTest {

    private DiagnosticsEngine diagnostics;
    private FunctionLowering lowering;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        lowering = new FunctionLowering(new CompilationContext(diagnostics));
    }

    private List<String> lower(FunctionDef def) throws UnsupportedConstructException {
        return lines(lowering.lower(def).items());
    }

    @Test
    void ifBranchesToElseWhenConditionIsZero() throws Exception {
        List<String> out = lower(fn("f", List.of("a"),
                ifElse(name("a"), block(assign("x", num(1))), block(assign("x", num(2)))),
                ret(name("x"))));

        assertThat(out).containsSequence(
                "mov rax, [rbp - 8]",
                "test rax, rax",
                "jz else_1",
                "mov rax, 1",
                "mov [rbp - 16], rax",
                "jmp end_1",
                "else_1:",
                "mov rax, 2",
                "mov [rbp - 16], rax",
                "end_1:",
                "mov rax, [rbp - 16]");
    }

    @Test
    void ifWithoutElseStillDefinesBothLabels() throws Exception {
        List<String> out = lower(fn("f", List.of("a"), ifElse(name("a"), block(ret(num(1))), List.of())));

        assertThat(out).containsSequence("jmp end_1", "else_1:", "end_1:");
    }

    @Test
    void ifTakesTheBranchSelectedAtRunTime() throws Exception {
        var program = Listings.compile(fn("pick", List.of("a"),
                ifElse(cmp(CompareOperator.GT, name("a"), num(5)),
                        block(ret(num(100))),
                        block(ret(num(200))))));
        IrInterpreter vm = new IrInterpreter(program);

        assertThat(vm.call("pick", 9)).isEqualTo(100);
        assertThat(vm.call("pick", 5)).isEqualTo(200);
    }

    @Test
    void twoIfStatementsDoNotShareElseLabels() throws Exception {
        List<String> out = lower(fn("f", List.of("a"),
                ifElse(name("a"), block(assign("x", num(1))), List.of()),
                ifElse(name("a"), block(assign("x", num(2))), List.of())));

        List<String> elseLabels = labels(out).stream().filter(l -> l.startsWith("else_")).toList();
        assertThat(elseLabels).hasSize(2).doesNotHaveDuplicates();
        assertThat(labels(out)).doesNotHaveDuplicates();
    }

    @Test
    void whileLoopsBackAndExitsOnZero() throws Exception {
        List<String> out = lower(Trees.counter());

        assertThat(labels(out).stream().filter(l -> l.startsWith("loop_"))).hasSize(1);
        assertThat(out.stream().filter(l -> l.startsWith("jz end_"))).hasSize(1);
        int loop = out.indexOf("loop_1:");
        assertThat(loop).isPositive();
        assertThat(out).containsSequence("jmp loop_1", "end_1:");
        assertThat(out.subList(loop, out.size())).containsSequence("test rax, rax", "jz end_1");
    }

    @Test
    void whileCounterReturnsTen() throws Exception {
        var program = Listings.compile(Trees.counter());

        assertThat(new IrInterpreter(program).call("count")).isEqualTo(10);
    }

    @Test
    void augmentedAssignmentUpdatesTheTarget() throws Exception {
        var program = Listings.compile(fn("f", List.of("a"),
                augAssign("a", BinaryOperator.MULT, num(3)),
                augAssign("a", BinaryOperator.SUB, num(1)),
                ret(name("a"))));

        assertThat(new IrInterpreter(program).call("f", 4)).isEqualTo(11);
    }

    @Test
    void selfReferentialAssignmentReadsTheLocal() throws Exception {
        List<String> out = lower(fn("f", List.of(), assign("x", bin(BinaryOperator.ADD, name("x"), num(1)))));

        assertThat(out).containsSequence("mov rax, [rbp - 8]", "push rax");
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void statementsKeepSourceOrder() throws Exception {
        List<String> out = lower(fn("f", List.of(),
                expr(call("first")), expr(call("second")), expr(call("third"))));

        assertThat(out).containsSubsequence("call first", "call second", "call third");
    }

    @Test
    void onlyNamesCanBeAssigned() {
        FunctionDef def = fn("f", List.of("d"), new Assign(attr(name("d"), "k"), num(1)));

        assertThatThrownBy(() -> lowering.lower(def))
                .isInstanceOfSatisfying(UnsupportedConstructException.class, e -> {
                    assertThat(e.errorCode()).isEqualTo(CompilerErrorCode.UNSUPPORTED_POSITION);
                    assertThat(e.nodeKind()).isEqualTo("AttributeAccess");
                    assertThat(e.path()).isEqualTo("f/body[0]/Assign.target");
                });
    }

    @Test
    void nestedFunctionIsRejected() {
        FunctionDef def = fn("outer", List.of(),
                ifElse(num(1), block(fn("inner", List.of(), ret(num(1)))), List.of()));

        assertThatThrownBy(() -> lowering.lower(def))
                .isInstanceOfSatisfying(UnsupportedConstructException.class, e -> {
                    assertThat(e.nodeKind()).isEqualTo("FunctionDef");
                    assertThat(e.path()).isEqualTo("outer/body[0]/If.body[0]");
                });
    }

    @Test
    void bareExpressionIsNotAStatement() {
        FunctionDef def = fn("f", List.of(), ret(num(0)), name("x"));

        assertThatThrownBy(() -> lowering.lower(def))
                .isInstanceOfSatisfying(UnsupportedConstructException.class, e -> {
                    assertThat(e.nodeKind()).isEqualTo("NameRef");
                    assertThat(e.path()).isEqualTo("f/body[1]");
                });
    }
}
