package org.tinyasm.compiler.ir;

/**
 * Immediate integer operand.
 */
public record IrImm(long value) implements IrOperand {

    @Override
    public String render() {
        return Long.toString(value);
    }

    @Override
    public String toString() {
        return render();
    }
}
