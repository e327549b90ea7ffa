package org.tinyasm.compiler.frontend.ast;

/**
 * A literal value: a {@link Long}, a {@link Boolean}, a {@link String}, or null for {@code None}.
 */
public record Constant(Object value) implements SyntaxNode {

    public Constant {
        if (value instanceof Integer i) {
            value = i.longValue();
        }
        if (value != null && !(value instanceof Long) && !(value instanceof Boolean) && !(value instanceof String)) {
            throw new IllegalArgumentException("Unsupported constant type: " + value.getClass().getSimpleName());
        }
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }
}
