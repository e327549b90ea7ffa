package org.tinyasm.compiler.backend.optimize;

import org.tinyasm.compiler.ir.IrInstruction;
import org.tinyasm.compiler.ir.IrItem;
import org.tinyasm.compiler.ir.IrLabelDef;
import org.tinyasm.compiler.ir.Mnemonic;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class OptimizationRegistryTest {

    @Test
    void deadStoreEliminationRunsBeforePeephole() {
        assertThat(OptimizationRegistry.initializeWithDefaults(true, true).passes())
                .extracting(IOptimizationPass::name)
                .containsExactly("dead-store-elimination", "peephole");
    }

    @Test
    void disabledPassesAreNotRegistered() {
        assertThat(OptimizationRegistry.initializeWithDefaults(false, true).passes())
                .extracting(IOptimizationPass::name).containsExactly("peephole");
        assertThat(OptimizationRegistry.initializeWithDefaults(false, false).passes()).isEmpty();
    }

    @Test
    void passesSeeThePreviousPassOutput() {
        List<String> seen = new ArrayList<>();
        OptimizationRegistry registry = new OptimizationRegistry();
        registry.register(new Recording("first", seen));
        registry.register(new Recording("second", seen));
        List<IrItem> items = List.of(new IrLabelDef("f"), IrInstruction.of(Mnemonic.RET));

        List<IrItem> result = registry.apply("f", items);

        assertThat(seen).containsExactly("first:2", "second:1");
        assertThat(result).containsExactly(new IrLabelDef("f"));
    }

    private record Recording(String name, List<String> seen) implements IOptimizationPass {
        @Override
        public List<IrItem> apply(List<IrItem> items) {
            seen.add(name + ":" + items.size());
            return items.subList(0, items.size() - 1);
        }
    }
}
