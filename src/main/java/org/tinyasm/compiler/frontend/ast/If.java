package org.tinyasm.compiler.frontend.ast;

import java.util.List;

/**
 * Conditional statement. {@code orElse} is empty when there is no else branch.
 */
public record If(SyntaxNode test, List<SyntaxNode> body, List<SyntaxNode> orElse) implements SyntaxNode {

    public If {
        body = List.copyOf(body);
        orElse = orElse == null ? List.of() : List.copyOf(orElse);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
