package org.tinyasm.compiler.frontend.ast;

/**
 * Augmented assignment such as {@code count += 1}.
 */
public record AugAssign(SyntaxNode target, BinaryOperator op, SyntaxNode value) implements SyntaxNode {

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitAugAssign(this);
    }
}
