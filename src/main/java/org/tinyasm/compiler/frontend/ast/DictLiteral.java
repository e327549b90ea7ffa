package org.tinyasm.compiler.frontend.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Dict display such as {@code {'a': 1}}. A null key stands for {@code **mapping} unpacking.
 */
public record DictLiteral(List<SyntaxNode> keys, List<SyntaxNode> values) implements SyntaxNode {

    public DictLiteral {
        if (keys.size() != values.size()) {
            throw new IllegalArgumentException("Dict literal has " + keys.size() + " keys but " + values.size() + " values");
        }
        keys = Collections.unmodifiableList(new ArrayList<>(keys));
        values = List.copyOf(values);
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitDictLiteral(this);
    }
}
