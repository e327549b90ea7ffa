package org.tinyasm.compiler.frontend.ast;

/**
 * Comparison operators of {@link Compare}.
 */
public enum CompareOperator {
    GT, LT, EQ, NOT_EQ, GT_E, LT_E
}
