package org.tinyasm.compiler.ir;

/**
 * Instruction mnemonics emitted by the lowering engine.
 */
public enum Mnemonic {
    MOV, LEA, PUSH, POP,
    ADD, SUB, IMUL, CQO, IDIV,
    CMP, TEST,
    JMP, JZ, JE, JNE, JG, JL, JGE, JLE,
    CALL, RET, SYSCALL;

    /**
     * @return {@code true} for conditional branches.
     */
    public boolean isConditionalJump() {
        return switch (this) {
            case JZ, JE, JNE, JG, JL, JGE, JLE -> true;
            default -> false;
        };
    }

    /**
     * @return {@code true} if control never falls through to the next item.
     */
    public boolean endsBlock() {
        return this == JMP || this == RET;
    }

    /**
     * @return {@code true} for any jump whose operand is a label in the same function.
     */
    public boolean isJump() {
        return this == JMP || isConditionalJump();
    }

    /**
     * @return The conditional branch taken exactly when this one is not taken.
     * @throws IllegalStateException if this is not a conditional branch.
     */
    public Mnemonic inverse() {
        return switch (this) {
            case JZ, JE -> JNE;
            case JNE -> JE;
            case JG -> JLE;
            case JLE -> JG;
            case JL -> JGE;
            case JGE -> JL;
            default -> throw new IllegalStateException(this + " is not a conditional branch");
        };
    }

    /**
     * @return The mnemonic as written in a NASM listing.
     */
    public String asmName() {
        return name().toLowerCase();
    }
}
