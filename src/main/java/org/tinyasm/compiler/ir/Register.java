package org.tinyasm.compiler.ir;

import java.util.List;

/**
 * The x86-64 general purpose registers used by the lowering engine.
 */
public enum Register {
    RAX, RBX, RCX, RDX, RSI, RDI, RBP, RSP, R8, R9;

    /** Holds the value of the most recently lowered expression. */
    public static final Register ACCUMULATOR = RAX;
    /** Receives the right operand of a binary operation. */
    public static final Register SCRATCH = RCX;
    /** Receives the remainder of a signed division. */
    public static final Register REMAINDER = RDX;
    /** Integer argument registers of the System V calling convention, in order. */
    public static final List<Register> ARGUMENTS = List.of(RDI, RSI, RDX, RCX, R8, R9);

    /**
     * @return The register name as written in a NASM listing.
     */
    public String asmName() {
        return name().toLowerCase();
    }
}
