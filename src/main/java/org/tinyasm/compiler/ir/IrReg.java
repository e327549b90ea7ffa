package org.tinyasm.compiler.ir;

/**
 * Register operand.
 */
public record IrReg(Register register) implements IrOperand {

    @Override
    public String render() {
        return register.asmName();
    }

    @Override
    public String toString() {
        return render();
    }
}
