package org.tinyasm.compiler.backend.optimize;

import org.tinyasm.compiler.ir.IrItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry for optimization passes applied in order.
 */
public final class OptimizationRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(OptimizationRegistry.class);

    private final List<IOptimizationPass> passes = new ArrayList<>();

    /**
     * Registers a new pass.
     * @param pass The pass to register.
     */
    public void register(IOptimizationPass pass) { passes.add(pass); }

    /**
     * @return The list of registered passes.
     */
    public List<IOptimizationPass> passes() { return passes; }

    /**
     * Runs all registered passes over one function.
     * @param functionName The function, for log output.
     * @param items The instruction stream.
     * @return The optimized stream.
     */
    public List<IrItem> apply(String functionName, List<IrItem> items) {
        List<IrItem> current = items;
        for (IOptimizationPass pass : passes) {
            int before = current.size();
            current = pass.apply(current);
            LOG.debug("{}: {} removed {} items", functionName, pass.name(), before - current.size());
        }
        return current;
    }

    /**
     * Initializes a new registry with the default passes.
     * @param deadStoreElimination Whether dead frame stores are removed.
     * @param peephole Whether the peephole rewrites run.
     * @return A new registry.
     */
    public static OptimizationRegistry initializeWithDefaults(boolean deadStoreElimination, boolean peephole) {
        OptimizationRegistry reg = new OptimizationRegistry();
        if (deadStoreElimination) {
            reg.register(new DeadStoreElimination());
        }
        if (peephole) {
            reg.register(new PeepholeOptimizer());
        }
        return reg;
    }
}
