package org.tinyasm.compiler.ir;

/**
 * Memory operand of the form {@code [base + symbol + displacement]}.
 * Either {@code base} or {@code symbol} may be null, but not both.
 *
 * @param base         The base register, or null for a symbol-relative address.
 * @param symbol       A data label, or null for a register-relative address.
 * @param displacement Byte offset added to the address.
 */
public record IrMem(Register base, String symbol, long displacement) implements IrOperand {

    public IrMem {
        if (base == null && symbol == null) {
            throw new IllegalArgumentException("Memory operand needs a base register or a symbol");
        }
    }

    /**
     * Creates a frame slot operand relative to the frame pointer.
     * @param displacement The (usually negative) byte offset from {@code rbp}.
     * @return The operand.
     */
    public static IrMem frame(long displacement) {
        return new IrMem(Register.RBP, null, displacement);
    }

    /**
     * Creates an operand addressing a data label.
     * @param symbol The data label.
     * @param displacement Byte offset from the label.
     * @return The operand.
     */
    public static IrMem data(String symbol, long displacement) {
        return new IrMem(null, symbol, displacement);
    }

    /**
     * Creates an operand addressing memory through a register.
     * @param base The base register.
     * @param displacement Byte offset from the register value.
     * @return The operand.
     */
    public static IrMem at(Register base, long displacement) {
        return new IrMem(base, null, displacement);
    }

    /**
     * @return {@code true} if this operand is a slot in the current stack frame.
     */
    public boolean isFrameSlot() {
        return base == Register.RBP && symbol == null;
    }

    @Override
    public String render() {
        StringBuilder sb = new StringBuilder("[");
        if (base != null) {
            sb.append(base.asmName());
        }
        if (symbol != null) {
            if (base != null) sb.append(" + ");
            sb.append(symbol);
        }
        if (displacement > 0) {
            sb.append(" + ").append(displacement);
        } else if (displacement < 0) {
            sb.append(" - ").append(-displacement);
        }
        return sb.append(']').toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
