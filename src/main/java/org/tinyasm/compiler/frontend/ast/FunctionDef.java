package org.tinyasm.compiler.frontend.ast;

import java.util.List;

/**
 * A top-level function definition.
 */
public record FunctionDef(String name, List<String> params, List<SyntaxNode> body) implements SyntaxNode {

    public FunctionDef {
        params = List.copyOf(params);
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitFunctionDef(this);
    }
}
