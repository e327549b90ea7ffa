package org.tinyasm.compiler.frontend.ast;

/**
 * Comparison producing 1 or 0.
 */
public record Compare(CompareOperator op, SyntaxNode left, SyntaxNode right) implements SyntaxNode {

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitCompare(this);
    }
}
