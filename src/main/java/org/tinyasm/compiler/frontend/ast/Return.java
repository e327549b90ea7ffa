package org.tinyasm.compiler.frontend.ast;

/**
 * Return statement; {@code value} is null for a bare {@code return}.
 */
public record Return(SyntaxNode value) implements SyntaxNode {

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }
}
