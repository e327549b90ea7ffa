package org.tinyasm.compiler.frontend.ast;

import java.util.List;

/**
 * Direct call of a named function.
 */
public record Call(String function, List<SyntaxNode> args) implements SyntaxNode {

    public Call {
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
