package org.tinyasm.compiler.frontend.ast;

/**
 * Attribute read {@code value.attribute}.
 */
public record AttributeAccess(SyntaxNode value, String attribute) implements SyntaxNode {

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitAttributeAccess(this);
    }
}
