package org.tinyasm.compiler.backend.optimize;

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

import java.util.ArrayList;
import java.util.List;

/**
 * Local rewrites over short instruction windows, repeated until none applies:
 * <ul>
 *   <li>code after {@code jmp} or {@code ret} up to the next label is dropped;</li>
 *   <li>a {@code jmp} to a label that directly follows it is dropped;</li>
 *   <li>{@code jX a; jmp b; a:} becomes {@code jnX b; a:};</li>
 *   <li>{@code mov r, r} is dropped;</li>
 *   <li>a reload of a value that was just stored is dropped;</li>
 *   <li>a right operand that is a constant or a plain memory read is loaded straight
 *       into the scratch register instead of through the accumulator and the stack.</li>
 * </ul>
 */
public final class PeepholeOptimizer implements IOptimizationPass {

    private static final IrReg RAX = new IrReg(Register.RAX);
    private static final IrReg RCX = new IrReg(Register.RCX);

    @Override
    public String name() {
        return "peephole";
    }

    @Override
    public List<IrItem> apply(List<IrItem> items) {
        List<IrItem> current = new ArrayList<>(items);
        boolean changed = true;
        while (changed) {
            changed = removeUnreachable(current);
            changed |= rewriteWindows(current);
        }
        return current;
    }

    private static boolean removeUnreachable(List<IrItem> items) {
        boolean changed = false;
        boolean dead = false;
        for (int i = 0; i < items.size(); i++) {
            IrItem item = items.get(i);
            if (item instanceof IrLabelDef) {
                dead = false;
            } else if (dead) {
                items.remove(i--);
                changed = true;
            } else if (((IrInstruction) item).mnemonic().endsBlock()) {
                dead = true;
            }
        }
        return changed;
    }

    private static boolean rewriteWindows(List<IrItem> items) {
        boolean changed = false;
        int i = 0;
        while (i < items.size()) {
            if (!(items.get(i) instanceof IrInstruction ins)) {
                i++;
                continue;
            }
            if (isSelfMove(ins) || jumpsToFollowingLabel(items, i) || reloadsStoredValue(items, i)) {
                items.remove(i);
                changed = true;
                i = Math.max(0, i - 1);
            } else if (invertBranchOverJump(items, i) || foldRightOperand(items, i)) {
                changed = true;
            } else {
                i++;
            }
        }
        return changed;
    }

    private static boolean isSelfMove(IrInstruction ins) {
        return ins.mnemonic() == Mnemonic.MOV && ins.operand(0) instanceof IrReg && ins.operand(0).equals(ins.operand(1));
    }

    /** {@code jmp L} followed only by labels, one of which is {@code L}. */
    private static boolean jumpsToFollowingLabel(List<IrItem> items, int i) {
        IrInstruction jmp = (IrInstruction) items.get(i);
        if (jmp.mnemonic() != Mnemonic.JMP) {
            return false;
        }
        for (int k = i + 1; k < items.size() && items.get(k) instanceof IrLabelDef def; k++) {
            if (def.name().equals(jmp.targetLabel())) {
                return true;
            }
        }
        return false;
    }

    /** Second half of {@code mov M, R; mov R, M}. */
    private static boolean reloadsStoredValue(List<IrItem> items, int i) {
        if (i == 0 || !(items.get(i - 1) instanceof IrInstruction store)) {
            return false;
        }
        IrInstruction load = (IrInstruction) items.get(i);
        return store.mnemonic() == Mnemonic.MOV && load.mnemonic() == Mnemonic.MOV
                && store.operand(0) instanceof IrMem && store.operand(1) instanceof IrReg
                && store.operand(0).equals(load.operand(1)) && store.operand(1).equals(load.operand(0));
    }

    private static boolean invertBranchOverJump(List<IrItem> items, int i) {
        if (i + 2 >= items.size()) {
            return false;
        }
        IrInstruction branch = (IrInstruction) items.get(i);
        if (!branch.mnemonic().isConditionalJump()
                || !(items.get(i + 1) instanceof IrInstruction jmp) || jmp.mnemonic() != Mnemonic.JMP
                || !(items.get(i + 2) instanceof IrLabelDef next) || !next.name().equals(branch.targetLabel())) {
            return false;
        }
        items.set(i, IrInstruction.of(branch.mnemonic().inverse(), new IrLabelRef(jmp.targetLabel())));
        items.remove(i + 1);
        return true;
    }

    /** {@code push rax; mov|lea rax, X; mov rcx, rax; pop rax} becomes {@code mov|lea rcx, X}. */
    private static boolean foldRightOperand(List<IrItem> items, int i) {
        if (i + 3 >= items.size()
                || !(items.get(i) instanceof IrInstruction push)
                || !(items.get(i + 1) instanceof IrInstruction load)
                || !(items.get(i + 2) instanceof IrInstruction transfer)
                || !(items.get(i + 3) instanceof IrInstruction pop)) {
            return false;
        }
        boolean matches = push.mnemonic() == Mnemonic.PUSH && push.operand(0).equals(RAX)
                && (load.mnemonic() == Mnemonic.MOV || load.mnemonic() == Mnemonic.LEA) && load.operand(0).equals(RAX)
                && isIndependentSource(load.operand(1))
                && transfer.mnemonic() == Mnemonic.MOV && transfer.operand(0).equals(RCX) && transfer.operand(1).equals(RAX)
                && pop.mnemonic() == Mnemonic.POP && pop.operand(0).equals(RAX);
        if (!matches) {
            return false;
        }
        items.set(i, IrInstruction.of(load.mnemonic(), RCX, load.operand(1)));
        items.subList(i + 1, i + 4).clear();
        return true;
    }

    private static boolean isIndependentSource(IrOperand source) {
        if (source instanceof IrImm) {
            return true;
        }
        if (source instanceof IrMem mem) {
            Register base = mem.base();
            return base != Register.RAX && base != Register.RCX && base != Register.RSP;
        }
        return false;
    }
}
