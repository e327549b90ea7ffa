package org.tinyasm.compiler.frontend.ast;

/**
 * Reference to a variable or built-in constant by name.
 */
public record NameRef(String id) implements SyntaxNode {

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitNameRef(this);
    }
}
