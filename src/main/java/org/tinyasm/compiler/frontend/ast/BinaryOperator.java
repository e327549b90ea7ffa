package org.tinyasm.compiler.frontend.ast;

/**
 * Arithmetic operators of {@link BinaryOp} and {@link AugAssign}.
 */
public enum BinaryOperator {
    ADD, SUB, MULT, DIV, MOD
}
