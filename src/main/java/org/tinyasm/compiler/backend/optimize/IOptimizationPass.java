package org.tinyasm.compiler.backend.optimize;

import org.tinyasm.compiler.ir.IrItem;

import java.util.List;

/**
 * Rewriting pass over the instruction stream of one function. A pass must not change
 * the observable result of the function: its return value, the global and static
 * storage it writes, and the calls it makes in order.
 */
public interface IOptimizationPass {

    /**
     * @return The pass name used in log output.
     */
    String name();

    /**
     * Applies this pass to the given IR item stream.
     *
     * @param items The instruction stream of one function. It is not modified.
     * @return The rewritten stream.
     */
    List<IrItem> apply(List<IrItem> items);
}
