package org.tinyasm.compiler.frontend.ast;

/**
 * Base interface of the syntax tree handed over by the external parser.
 * <p>
 * The hierarchy is closed: every node kind is listed in {@code permits} and has a
 * matching method in {@link SyntaxVisitor}, so adding a kind without a lowering rule
 * does not compile. Nodes are immutable and the lowering engine only reads them.
 */
public sealed interface SyntaxNode
        permits FunctionDef, Assign, AugAssign, Return, ExprStatement, If, While,
                BinaryOp, Compare, Call, ListLiteral, DictLiteral, AttributeAccess, NameRef, Constant {

    /**
     * Accepts a visitor.
     * @param visitor The visitor.
     * @param <R> The visitor's result type.
     * @return The result of the visit.
     */
    <R> R accept(SyntaxVisitor<R> visitor);

    /**
     * @return The node kind as used in diagnostics and in the tree document.
     */
    default String kind() {
        return getClass().getSimpleName();
    }
}
