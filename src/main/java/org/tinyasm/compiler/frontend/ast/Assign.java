package org.tinyasm.compiler.frontend.ast;

/**
 * Assignment of {@code value} to {@code target}. Only a {@link NameRef} target can be lowered.
 */
public record Assign(SyntaxNode target, SyntaxNode value) implements SyntaxNode {

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }
}
