package org.tinyasm.compiler.ir;

/**
 * Base type for instruction operands in the IR.
 */
public sealed interface IrOperand permits IrReg, IrImm, IrMem, IrLabelRef {

    /**
     * @return The operand as it appears in a NASM listing.
     */
    String render();
}
