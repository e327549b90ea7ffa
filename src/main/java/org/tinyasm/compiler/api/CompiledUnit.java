package org.tinyasm.compiler.api;

import org.tinyasm.compiler.ir.IrItem;

import java.util.List;

/**
 * The finished, optimized instruction sequence of one function.
 *
 * @param functionName The function name, which is also its entry label.
 * @param items The instruction stream, immutable.
 * @param localCount The number of frame slots (parameters and locals).
 */
public record CompiledUnit(String functionName, List<IrItem> items, int localCount) {

    public CompiledUnit {
        items = List.copyOf(items);
    }
}
