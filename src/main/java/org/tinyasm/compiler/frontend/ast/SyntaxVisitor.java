package org.tinyasm.compiler.frontend.ast;

/**
 * A visitor over the closed {@link SyntaxNode} hierarchy.
 *
 * @param <R> The return type of the visit methods.
 */
public interface SyntaxVisitor<R> {
    R visitFunctionDef(FunctionDef node);
    R visitAssign(Assign node);
    R visitAugAssign(AugAssign node);
    R visitReturn(Return node);
    R visitExprStatement(ExprStatement node);
    R visitIf(If node);
    R visitWhile(While node);
    R visitBinaryOp(BinaryOp node);
    R visitCompare(Compare node);
    R visitCall(Call node);
    R visitListLiteral(ListLiteral node);
    R visitDictLiteral(DictLiteral node);
    R visitAttributeAccess(AttributeAccess node);
    R visitNameRef(NameRef node);
    R visitConstant(Constant node);
}
