package org.tinyasm.compiler.frontend.irgen;

import org.tinyasm.compiler.api.CompilerErrorCode;
import org.tinyasm.compiler.api.UnsupportedConstructException;
import org.tinyasm.compiler.frontend.ast.SyntaxNode;
import org.tinyasm.compiler.frontend.semantics.Scope;
import org.tinyasm.compiler.frontend.semantics.SymbolKind;
import org.tinyasm.compiler.ir.IrImm;
import org.tinyasm.compiler.ir.IrInstruction;
import org.tinyasm.compiler.ir.IrItem;
import org.tinyasm.compiler.ir.IrLabelDef;
import org.tinyasm.compiler.ir.IrLabelRef;
import org.tinyasm.compiler.ir.IrMem;
import org.tinyasm.compiler.ir.IrOperand;
import org.tinyasm.compiler.ir.IrReg;
import org.tinyasm.compiler.ir.Mnemonic;
import org.tinyasm.compiler.ir.Register;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Mutable context for lowering one function. Owns the function's {@link Scope}, the
 * instruction buffer, the number of values spilled to the machine stack and the
 * structural path of the node currently being lowered. Never shared between threads.
 */
public final class FunctionContext {

    /** Size of one frame slot or data word in bytes. */
    public static final int WORD = 8;
    /** Prefix of global variable storage labels. */
    public static final String GLOBAL_PREFIX = "g_";

    private final CompilationContext compilation;
    private final Scope scope;
    private final List<IrItem> out = new ArrayList<>();
    private final Deque<String> path = new ArrayDeque<>();
    private int spilled;

    /**
     * @param compilation The compilation-wide context.
     * @param functionName The function being lowered.
     */
    public FunctionContext(CompilationContext compilation, String functionName) {
        this.compilation = compilation;
        this.scope = new Scope(functionName);
        this.path.addLast(functionName);
    }

    public CompilationContext compilation() {
        return compilation;
    }

    public Scope scope() {
        return scope;
    }

    /**
     * Emits an instruction.
     * @param mnemonic The mnemonic.
     * @param operands The operands, destination first.
     */
    public void emit(Mnemonic mnemonic, IrOperand... operands) {
        out.add(IrInstruction.of(mnemonic, operands));
    }

    /**
     * Emits a label definition.
     * @param label The label.
     */
    public void define(Label label) {
        out.add(new IrLabelDef(label.name()));
    }

    /**
     * @return The instructions emitted so far, in order.
     */
    public List<IrItem> items() {
        return List.copyOf(out);
    }

    /**
     * Pushes a register onto the machine stack and counts it as a pending spill.
     * @param register The register to save.
     */
    public void spill(IrReg register) {
        emit(Mnemonic.PUSH, register);
        spilled++;
    }

    /**
     * Pops the most recent spill into a register.
     * @param register The register to load.
     */
    public void restore(IrReg register) {
        if (spilled == 0) {
            throw new IllegalStateException("No spilled value to restore in " + path());
        }
        emit(Mnemonic.POP, register);
        spilled--;
    }

    /**
     * Emits a call. The frame keeps {@code rsp} 16-byte aligned, so an odd number of
     * pending spills is padded with one extra word around the call.
     * @param target The called label.
     */
    public void call(String target) {
        boolean pad = spilled % 2 != 0;
        IrReg rsp = new IrReg(Register.RSP);
        if (pad) {
            emit(Mnemonic.SUB, rsp, new IrImm(WORD));
        }
        emit(Mnemonic.CALL, new IrLabelRef(target));
        if (pad) {
            emit(Mnemonic.ADD, rsp, new IrImm(WORD));
        }
    }

    /**
     * The memory operand holding a variable.
     * @param name The identifier.
     * @param kind Its classification, {@link SymbolKind#LOCAL} or {@link SymbolKind#GLOBAL}.
     * @return The operand.
     */
    public IrMem storageOf(String name, SymbolKind kind) {
        return switch (kind) {
            case LOCAL -> IrMem.frame(slotOffset(scope.slotOf(name).orElseThrow()));
            case GLOBAL -> IrMem.data(GLOBAL_PREFIX + name, 0);
            case BUILTIN_CONSTANT -> throw new IllegalArgumentException("Built-in constant " + name + " has no storage");
        };
    }

    /**
     * @param slot A frame slot index.
     * @return The byte offset of the slot from {@code rbp}.
     */
    public static long slotOffset(int slot) {
        return -(long) WORD * (slot + 1);
    }

    /**
     * Pushes a path segment for the node about to be lowered.
     * @param segment E.g. {@code body[0]} or {@code If.test}.
     */
    public void enter(String segment) {
        path.addLast(segment);
    }

    /**
     * Pops the innermost path segment.
     */
    public void leave() {
        path.removeLast();
    }

    /**
     * @return The structural path of the current node, e.g. {@code f/body[0]/If.test}.
     */
    public String path() {
        return String.join("/", path);
    }

    /**
     * Builds the exception for a node without a lowering rule at the current position.
     * @param code The error code.
     * @param node The node.
     * @param detail Additional explanation, may be null.
     * @return The exception to throw.
     */
    public RuntimeException unsupported(CompilerErrorCode code, SyntaxNode node, String detail) {
        return new LoweringException(new UnsupportedConstructException(code, node.kind(), path(), detail));
    }
}
