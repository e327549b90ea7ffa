package org.tinyasm.compiler.frontend.irgen;

import org.tinyasm.compiler.api.CompilerErrorCode;
import org.tinyasm.compiler.api.UnsupportedConstructException;
import org.tinyasm.compiler.diagnostics.CompilerLogger;
import org.tinyasm.compiler.frontend.ast.FunctionDef;
import org.tinyasm.compiler.ir.IrImm;
import org.tinyasm.compiler.ir.IrInstruction;
import org.tinyasm.compiler.ir.IrItem;
import org.tinyasm.compiler.ir.IrLabelDef;
import org.tinyasm.compiler.ir.IrMem;
import org.tinyasm.compiler.ir.IrReg;
import org.tinyasm.compiler.ir.Mnemonic;
import org.tinyasm.compiler.ir.Register;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers one function definition: entry label, prologue, parameter spills, body and
 * the fallthrough exit.
 * <p>
 * Each function starts with a fresh {@link org.tinyasm.compiler.frontend.semantics.Scope}
 * holding its parameters. The frame size is only known once the body has declared all of
 * its locals, so the body is lowered first and the prologue is put in front afterwards.
 * A fallthrough exit returning 0 is always appended, even when the body ends in a return.
 */
public final class FunctionLowering {

    private static final IrReg RBP = new IrReg(Register.RBP);
    private static final IrReg RSP = new IrReg(Register.RSP);

    private final CompilationContext compilation;

    /**
     * @param compilation The compilation-wide context.
     */
    public FunctionLowering(CompilationContext compilation) {
        this.compilation = compilation;
    }

    /**
     * Lowers a function.
     *
     * @param def The function definition.
     * @return The unoptimized instruction stream.
     * @throws UnsupportedConstructException if the body contains a construct without a lowering rule.
     */
    public LoweredFunction lower(FunctionDef def) throws UnsupportedConstructException {
        FunctionContext ctx = new FunctionContext(compilation, def.name());
        if (def.params().size() > Register.ARGUMENTS.size()) {
            throw new UnsupportedConstructException(CompilerErrorCode.TOO_MANY_ARGUMENTS, def.kind(), ctx.path(),
                    def.params().size() + " parameters, at most " + Register.ARGUMENTS.size() + " are supported");
        }
        def.params().forEach(ctx.scope()::declare);

        ExpressionLowering expressions = new ExpressionLowering(ctx);
        try {
            new ControlFlowLowering(ctx, expressions).lowerBlock(def.body(), "body");
        } catch (LoweringException e) {
            throw e.getCause();
        }
        ctx.emit(Mnemonic.MOV, ExpressionLowering.ACC, new IrImm(0));
        emitEpilogue(ctx);

        int localCount = ctx.scope().size();
        List<IrItem> items = new ArrayList<>();
        items.add(new IrLabelDef(def.name()));
        items.add(IrInstruction.of(Mnemonic.PUSH, RBP));
        items.add(IrInstruction.of(Mnemonic.MOV, RBP, RSP));
        long frameBytes = frameSize(localCount);
        if (frameBytes > 0) {
            items.add(IrInstruction.of(Mnemonic.SUB, RSP, new IrImm(frameBytes)));
        }
        for (int i = 0; i < def.params().size(); i++) {
            int slot = ctx.scope().slotOf(def.params().get(i)).orElseThrow();
            items.add(IrInstruction.of(Mnemonic.MOV, IrMem.frame(FunctionContext.slotOffset(slot)), new IrReg(Register.ARGUMENTS.get(i))));
        }
        items.addAll(ctx.items());

        CompilerLogger.debug("Lowered " + def.name() + ": " + items.size() + " items, " + localCount + " locals");
        return new LoweredFunction(def.name(), items, localCount);
    }

    /**
     * Emits the frame teardown and return.
     * @param ctx The function context.
     */
    static void emitEpilogue(FunctionContext ctx) {
        ctx.emit(Mnemonic.MOV, RSP, RBP);
        ctx.emit(Mnemonic.POP, RBP);
        ctx.emit(Mnemonic.RET);
    }

    /**
     * @param localCount The number of frame slots.
     * @return The frame size in bytes, rounded up to a multiple of 16.
     */
    static long frameSize(int localCount) {
        long bytes = (long) localCount * FunctionContext.WORD;
        return (bytes + 15) / 16 * 16;
    }
}
