package org.tinyasm.compiler.frontend.ast;

/**
 * An expression evaluated for its effect.
 */
public record ExprStatement(SyntaxNode expression) implements SyntaxNode {

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitExprStatement(this);
    }
}
