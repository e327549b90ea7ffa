package org.tinyasm.compiler.ir;

/**
 * Reference to a code label, used as the target of jumps and calls.
 */
public record IrLabelRef(String labelName) implements IrOperand {

    @Override
    public String render() {
        return labelName;
    }

    @Override
    public String toString() {
        return render();
    }
}
