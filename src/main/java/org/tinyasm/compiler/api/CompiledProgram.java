package org.tinyasm.compiler.api;

import org.tinyasm.compiler.ir.IrReservation;
import org.tinyasm.compiler.ir.IrStringConstant;

import java.util.List;
import java.util.Optional;

/**
 * Represents the complete output of one compilation: the units in input order plus
 * the program-wide storage collected while lowering them.
 *
 * @param units The compiled functions, in the order they were given.
 * @param globals Names promoted to global storage, sorted.
 * @param strings Interned string constants, sorted by label.
 * @param storage Other {@code .bss} storage of the program, such as the heap arena.
 * @param entryPoint The function called by the program launcher, if one was configured and exists.
 */
public record CompiledProgram(List<CompiledUnit> units, List<String> globals, List<IrStringConstant> strings,
                              List<IrReservation> storage, Optional<String> entryPoint) {

    public CompiledProgram {
        units = List.copyOf(units);
        globals = List.copyOf(globals);
        strings = List.copyOf(strings);
        storage = List.copyOf(storage);
    }

    /**
     * @param functionName The function to look up.
     * @return The unit for that function, if present.
     */
    public Optional<CompiledUnit> unit(String functionName) {
        return units.stream().filter(u -> u.functionName().equals(functionName)).findFirst();
    }
}
