package org.tinyasm.compiler.frontend.ast;

import java.util.List;

/**
 * Pre-tested loop.
 */
public record While(SyntaxNode test, List<SyntaxNode> body) implements SyntaxNode {

    public While {
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }
}
