package org.tinyasm.compiler.frontend.irgen;

import org.tinyasm.compiler.ir.IrItem;

import java.util.List;

/**
 * The unoptimized instruction stream of one function.
 *
 * @param name The function name.
 * @param items The instruction stream, starting with the function label.
 * @param localCount The number of frame slots.
 */
public record LoweredFunction(String name, List<IrItem> items, int localCount) {

    public LoweredFunction {
        items = List.copyOf(items);
    }
}
