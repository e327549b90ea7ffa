package org.tinyasm.compiler.frontend.ast;

/**
 * Arithmetic on two subexpressions.
 */
public record BinaryOp(BinaryOperator op, SyntaxNode left, SyntaxNode right) implements SyntaxNode {

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }
}
