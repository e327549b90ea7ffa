package org.tinyasm.compiler.ir;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Represents an instruction in the intermediate representation.
 *
 * @param mnemonic The instruction mnemonic.
 * @param operands The operands in NASM order (destination first).
 */
public record IrInstruction(Mnemonic mnemonic, List<IrOperand> operands) implements IrItem {

    public IrInstruction {
        operands = List.copyOf(operands);
    }

    /**
     * Convenience factory.
     * @param mnemonic The mnemonic.
     * @param operands The operands.
     * @return The instruction.
     */
    public static IrInstruction of(Mnemonic mnemonic, IrOperand... operands) {
        return new IrInstruction(mnemonic, List.of(operands));
    }

    /**
     * @param index Operand position.
     * @return The operand at {@code index}.
     */
    public IrOperand operand(int index) {
        return operands.get(index);
    }

    /**
     * @return The jump or call target, if the first operand is a label reference.
     */
    public String targetLabel() {
        return !operands.isEmpty() && operands.get(0) instanceof IrLabelRef ref ? ref.labelName() : null;
    }

    @Override
    public String toString() {
        if (operands.isEmpty()) {
            return mnemonic.asmName();
        }
        return mnemonic.asmName() + " " + operands.stream().map(IrOperand::render).collect(Collectors.joining(", "));
    }
}
