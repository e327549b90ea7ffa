package org.tinyasm.compiler.frontend.ast;

import java.util.List;

/**
 * List display such as {@code [1, 2, 3]}.
 */
public record ListLiteral(List<SyntaxNode> elements) implements SyntaxNode {

    public ListLiteral {
        elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitListLiteral(this);
    }
}
