package org.tinyasm.compiler.backend.optimize;

import org.tinyasm.compiler.ir.IrInstruction;
import org.tinyasm.compiler.ir.IrItem;
import org.tinyasm.compiler.ir.IrLabelDef;
import org.tinyasm.compiler.ir.IrMem;
import org.tinyasm.compiler.ir.IrOperand;
import org.tinyasm.compiler.ir.Mnemonic;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Removes stores to frame slots whose value is never read afterwards.
 * <p>
 * Liveness is computed backwards over the control-flow graph of the instruction stream:
 * fall-through edges, jump edges to labels of the same function, and no successor after
 * {@code ret}, where all frame slots die. A store is a {@code mov} whose destination is a
 * frame slot; it is dead when its slot is not live on any path leaving it.
 * Global and static storage is never touched, and a call does not read the caller's frame.
 */
public final class DeadStoreElimination implements IOptimizationPass {

    @Override
    public String name() {
        return "dead-store-elimination";
    }

    @Override
    public List<IrItem> apply(List<IrItem> items) {
        if (takesFrameAddress(items)) {
            return items;
        }
        int n = items.size();
        Map<String, Integer> labels = new HashMap<>();
        for (int i = 0; i < n; i++) {
            if (items.get(i) instanceof IrLabelDef def) {
                labels.put(def.name(), i);
            }
        }

        List<Set<Long>> liveOut = new ArrayList<>(n);
        List<Set<Long>> liveIn = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            liveOut.add(new HashSet<>());
            liveIn.add(new HashSet<>());
        }
        Set<Long> everySlot = allSlots(items);

        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = n - 1; i >= 0; i--) {
                Set<Long> out = new HashSet<>();
                for (int succ : successors(items, i, labels)) {
                    if (succ < 0) {
                        out.addAll(everySlot);
                    } else if (succ < n) {
                        out.addAll(liveIn.get(succ));
                    }
                }
                Set<Long> in = new HashSet<>(out);
                IrItem item = items.get(i);
                if (item instanceof IrInstruction ins) {
                    Long def = storedSlot(ins);
                    if (def != null) {
                        in.remove(def);
                    }
                    in.addAll(readSlots(ins));
                }
                if (!out.equals(liveOut.get(i)) || !in.equals(liveIn.get(i))) {
                    liveOut.set(i, out);
                    liveIn.set(i, in);
                    changed = true;
                }
            }
        }

        List<IrItem> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            IrItem item = items.get(i);
            if (item instanceof IrInstruction ins) {
                Long def = storedSlot(ins);
                if (def != null && !liveOut.get(i).contains(def)) {
                    continue;
                }
            }
            result.add(item);
        }
        return result;
    }

    /**
     * Successor indices of item {@code i}. Index {@code -1} stands for a jump to a label
     * outside this stream, after which every slot is treated as live.
     */
    private static List<Integer> successors(List<IrItem> items, int i, Map<String, Integer> labels) {
        IrItem item = items.get(i);
        List<Integer> succ = new ArrayList<>(2);
        if (!(item instanceof IrInstruction ins)) {
            succ.add(i + 1);
            return succ;
        }
        Mnemonic m = ins.mnemonic();
        if (m == Mnemonic.RET) {
            return succ;
        }
        if (m.isJump()) {
            succ.add(labels.getOrDefault(ins.targetLabel(), -1));
        }
        if (m != Mnemonic.JMP) {
            succ.add(i + 1);
        }
        return succ;
    }

    private static Long storedSlot(IrInstruction ins) {
        if (ins.mnemonic() == Mnemonic.MOV && ins.operand(0) instanceof IrMem mem && mem.isFrameSlot()) {
            return mem.displacement();
        }
        return null;
    }

    private static Set<Long> readSlots(IrInstruction ins) {
        Set<Long> reads = new HashSet<>();
        List<IrOperand> ops = ins.operands();
        int first = storedSlot(ins) != null ? 1 : 0;
        for (int k = first; k < ops.size(); k++) {
            if (ops.get(k) instanceof IrMem mem && mem.isFrameSlot()) {
                reads.add(mem.displacement());
            }
        }
        return reads;
    }

    private static Set<Long> allSlots(List<IrItem> items) {
        Set<Long> slots = new HashSet<>();
        for (IrItem item : items) {
            if (item instanceof IrInstruction ins) {
                for (IrOperand op : ins.operands()) {
                    if (op instanceof IrMem mem && mem.isFrameSlot()) {
                        slots.add(mem.displacement());
                    }
                }
            }
        }
        return slots;
    }

    private static boolean takesFrameAddress(List<IrItem> items) {
        for (IrItem item : items) {
            if (item instanceof IrInstruction ins && ins.mnemonic() == Mnemonic.LEA
                    && ins.operand(1) instanceof IrMem mem && mem.isFrameSlot()) {
                return true;
            }
        }
        return false;
    }
}
