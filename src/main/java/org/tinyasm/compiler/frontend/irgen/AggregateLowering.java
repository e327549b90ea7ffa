package org.tinyasm.compiler.frontend.irgen;

import org.tinyasm.compiler.api.CompilerErrorCode;
import org.tinyasm.compiler.frontend.ast.AttributeAccess;
import org.tinyasm.compiler.frontend.ast.DictLiteral;
import org.tinyasm.compiler.frontend.ast.ListLiteral;
import org.tinyasm.compiler.frontend.ast.SyntaxNode;
import org.tinyasm.compiler.ir.IrImm;
import org.tinyasm.compiler.ir.IrLabelRef;
import org.tinyasm.compiler.ir.IrMem;
import org.tinyasm.compiler.ir.IrReg;
import org.tinyasm.compiler.ir.Mnemonic;
import org.tinyasm.compiler.ir.Register;

import java.util.List;

import static org.tinyasm.compiler.frontend.irgen.ExpressionLowering.ACC;
import static org.tinyasm.compiler.frontend.irgen.ExpressionLowering.SCRATCH;
import static org.tinyasm.compiler.frontend.irgen.FunctionContext.WORD;

/**
 * Lowers list and dict literals into regions allocated from the heap arena and attribute
 * reads into a scan over such a region.
 * <p>
 * Region layout: slot 0 holds the element count (lists) or pair count (dicts), followed
 * by the elements, or by key/value slot pairs in source order. Duplicate dict keys are
 * kept as separate pairs. The literal's value is the address of its region.
 * <p>
 * Every evaluation of a literal allocates a new region, so a returned aggregate is never
 * overwritten by a later evaluation of the same literal. The elements are evaluated first
 * and spilled, then the region is carved off the arena by bumping {@code heap_used} and
 * filled from the spills.
 */
final class AggregateLowering {

    private final FunctionContext ctx;
    private final ExpressionLowering expressions;

    AggregateLowering(FunctionContext ctx, ExpressionLowering expressions) {
        this.ctx = ctx;
        this.expressions = expressions;
    }

    void lowerList(ListLiteral node) {
        List<SyntaxNode> elements = node.elements();
        for (int i = 0; i < elements.size(); i++) {
            expressions.lower(elements.get(i), "ListLiteral.elements[" + i + "]");
            ctx.spill(ACC);
        }
        allocate(elements.size() + 1);
        for (int i = elements.size() - 1; i >= 0; i--) {
            ctx.restore(SCRATCH);
            ctx.emit(Mnemonic.MOV, IrMem.at(Register.RAX, (long) WORD * (i + 1)), SCRATCH);
        }
        storeCount(elements.size());
    }

    void lowerDict(DictLiteral node) {
        int pairs = node.keys().size();
        for (int i = 0; i < pairs; i++) {
            if (node.keys().get(i) == null) {
                ctx.enter("DictLiteral.keys[" + i + "]");
                try {
                    throw ctx.unsupported(CompilerErrorCode.DICT_UNPACKING, node, "dict unpacking is not supported");
                } finally {
                    ctx.leave();
                }
            }
        }
        for (int i = 0; i < pairs; i++) {
            expressions.lower(node.keys().get(i), "DictLiteral.keys[" + i + "]");
            ctx.spill(ACC);
            expressions.lower(node.values().get(i), "DictLiteral.values[" + i + "]");
            ctx.spill(ACC);
        }
        allocate(2 * pairs + 1);
        for (int slot = 2 * pairs; slot >= 1; slot--) {
            ctx.restore(SCRATCH);
            ctx.emit(Mnemonic.MOV, IrMem.at(Register.RAX, (long) WORD * slot), SCRATCH);
        }
        storeCount(pairs);
    }

    /**
     * Scans the pair region addressed by the value for a key equal to the interned attribute
     * name and loads the first matching value, or 0 when no key matches.
     */
    void lowerAttribute(AttributeAccess node) {
        expressions.lower(node.value(), "AttributeAccess.value");
        String key = ctx.compilation().internString(node.attribute());
        int id = ctx.compilation().labels().nextId();
        Label loop = new Label("attr", id);
        Label found = new Label("found", id);
        Label miss = new Label("miss", id);
        Label end = new Label("end", id);

        IrReg count = new IrReg(Register.RCX);
        IrReg cursor = new IrReg(Register.RDX);
        IrReg wanted = new IrReg(Register.RSI);

        ctx.emit(Mnemonic.LEA, wanted, IrMem.data(key, 0));
        ctx.emit(Mnemonic.MOV, count, IrMem.at(Register.RAX, 0));
        ctx.emit(Mnemonic.LEA, cursor, IrMem.at(Register.RAX, WORD));
        ctx.define(loop);
        ctx.emit(Mnemonic.TEST, count, count);
        ctx.emit(Mnemonic.JZ, new IrLabelRef(miss.name()));
        ctx.emit(Mnemonic.CMP, IrMem.at(Register.RDX, 0), wanted);
        ctx.emit(Mnemonic.JE, new IrLabelRef(found.name()));
        ctx.emit(Mnemonic.ADD, cursor, new IrImm(2L * WORD));
        ctx.emit(Mnemonic.SUB, count, new IrImm(1));
        ctx.emit(Mnemonic.JMP, new IrLabelRef(loop.name()));
        ctx.define(found);
        ctx.emit(Mnemonic.MOV, ACC, IrMem.at(Register.RDX, WORD));
        ctx.emit(Mnemonic.JMP, new IrLabelRef(end.name()));
        ctx.define(miss);
        ctx.emit(Mnemonic.MOV, ACC, new IrImm(0));
        ctx.define(end);
    }

    /**
     * Leaves the address of {@code qwords} fresh arena words in the accumulator.
     * Clobbers the scratch register.
     */
    private void allocate(int qwords) {
        String arena = ctx.compilation().heapArena();
        IrMem used = IrMem.data(CompilationContext.HEAP_USED, 0);
        ctx.emit(Mnemonic.MOV, ACC, used);
        ctx.emit(Mnemonic.LEA, SCRATCH, IrMem.at(Register.RAX, (long) WORD * qwords));
        ctx.emit(Mnemonic.MOV, used, SCRATCH);
        ctx.emit(Mnemonic.LEA, SCRATCH, IrMem.data(arena, 0));
        ctx.emit(Mnemonic.ADD, ACC, SCRATCH);
    }

    private void storeCount(int count) {
        ctx.emit(Mnemonic.MOV, SCRATCH, new IrImm(count));
        ctx.emit(Mnemonic.MOV, IrMem.at(Register.RAX, 0), SCRATCH);
    }
}
