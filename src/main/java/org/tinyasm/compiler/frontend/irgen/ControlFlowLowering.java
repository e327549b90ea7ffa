package org.tinyasm.compiler.frontend.irgen;

import org.tinyasm.compiler.api.CompilerErrorCode;
import org.tinyasm.compiler.frontend.ast.Assign;
import org.tinyasm.compiler.frontend.ast.AttributeAccess;
import org.tinyasm.compiler.frontend.ast.AugAssign;
import org.tinyasm.compiler.frontend.ast.BinaryOp;
import org.tinyasm.compiler.frontend.ast.Call;
import org.tinyasm.compiler.frontend.ast.Compare;
import org.tinyasm.compiler.frontend.ast.Constant;
import org.tinyasm.compiler.frontend.ast.DictLiteral;
import org.tinyasm.compiler.frontend.ast.ExprStatement;
import org.tinyasm.compiler.frontend.ast.FunctionDef;
import org.tinyasm.compiler.frontend.ast.If;
import org.tinyasm.compiler.frontend.ast.ListLiteral;
import org.tinyasm.compiler.frontend.ast.NameRef;
import org.tinyasm.compiler.frontend.ast.Return;
import org.tinyasm.compiler.frontend.ast.SyntaxNode;
import org.tinyasm.compiler.frontend.ast.SyntaxVisitor;
import org.tinyasm.compiler.frontend.ast.While;
import org.tinyasm.compiler.frontend.semantics.SymbolKind;
import org.tinyasm.compiler.ir.IrImm;
import org.tinyasm.compiler.ir.IrLabelRef;
import org.tinyasm.compiler.ir.Mnemonic;

import java.util.List;

import static org.tinyasm.compiler.frontend.irgen.ExpressionLowering.ACC;

/**
 * Lowers statements. Conditionals and loops become labeled branch sequences; every
 * construct draws one number from the compilation-wide counter, so no two constructs
 * share a label. Statements are emitted in source order.
 */
public final class ControlFlowLowering implements SyntaxVisitor<Void> {

    private final FunctionContext ctx;
    private final ExpressionLowering expressions;

    /**
     * @param ctx The context of the function being lowered.
     * @param expressions The expression lowering of the same function.
     */
    public ControlFlowLowering(FunctionContext ctx, ExpressionLowering expressions) {
        this.ctx = ctx;
        this.expressions = expressions;
    }

    /**
     * Lowers a statement sequence.
     * @param statements The statements, in source order.
     * @param segment The path segment of the sequence, e.g. {@code body} or {@code If.orElse}.
     */
    public void lowerBlock(List<SyntaxNode> statements, String segment) {
        for (int i = 0; i < statements.size(); i++) {
            ctx.enter(segment + "[" + i + "]");
            try {
                statements.get(i).accept(this);
            } finally {
                ctx.leave();
            }
        }
    }

    @Override
    public Void visitAssign(Assign node) {
        String target = targetName(node.target(), "Assign.target");
        ctx.compilation().resolver().declareTarget(target, ctx.scope());
        expressions.lower(node.value(), "Assign.value");
        ctx.emit(Mnemonic.MOV, ctx.storageOf(target, SymbolKind.LOCAL), ACC);
        return null;
    }

    @Override
    public Void visitAugAssign(AugAssign node) {
        String target = targetName(node.target(), "AugAssign.target");
        ctx.compilation().resolver().declareTarget(target, ctx.scope());
        expressions.lower(new BinaryOp(node.op(), new NameRef(target), node.value()), "AugAssign.value");
        ctx.emit(Mnemonic.MOV, ctx.storageOf(target, SymbolKind.LOCAL), ACC);
        return null;
    }

    @Override
    public Void visitReturn(Return node) {
        if (node.value() == null) {
            ctx.emit(Mnemonic.MOV, ACC, new IrImm(0));
        } else {
            expressions.lower(node.value(), "Return.value");
        }
        FunctionLowering.emitEpilogue(ctx);
        return null;
    }

    @Override
    public Void visitExprStatement(ExprStatement node) {
        expressions.lower(node.expression(), "ExprStatement.expression");
        return null;
    }

    @Override
    public Void visitIf(If node) {
        int id = ctx.compilation().labels().nextId();
        Label elseLabel = new Label("else", id);
        Label end = new Label("end", id);

        expressions.lower(node.test(), "If.test");
        ctx.emit(Mnemonic.TEST, ACC, ACC);
        ctx.emit(Mnemonic.JZ, new IrLabelRef(elseLabel.name()));
        lowerBlock(node.body(), "If.body");
        ctx.emit(Mnemonic.JMP, new IrLabelRef(end.name()));
        ctx.define(elseLabel);
        lowerBlock(node.orElse(), "If.orElse");
        ctx.define(end);
        return null;
    }

    @Override
    public Void visitWhile(While node) {
        int id = ctx.compilation().labels().nextId();
        Label loop = new Label("loop", id);
        Label end = new Label("end", id);

        ctx.define(loop);
        expressions.lower(node.test(), "While.test");
        ctx.emit(Mnemonic.TEST, ACC, ACC);
        ctx.emit(Mnemonic.JZ, new IrLabelRef(end.name()));
        lowerBlock(node.body(), "While.body");
        ctx.emit(Mnemonic.JMP, new IrLabelRef(loop.name()));
        ctx.define(end);
        return null;
    }

    @Override
    public Void visitFunctionDef(FunctionDef node) {
        throw ctx.unsupported(CompilerErrorCode.UNSUPPORTED_POSITION, node, "nested functions are not supported");
    }

    // --- bare expressions must be wrapped in ExprStatement ---

    @Override
    public Void visitBinaryOp(BinaryOp node) {
        throw notAStatement(node);
    }

    @Override
    public Void visitCompare(Compare node) {
        throw notAStatement(node);
    }

    @Override
    public Void visitCall(Call node) {
        throw notAStatement(node);
    }

    @Override
    public Void visitListLiteral(ListLiteral node) {
        throw notAStatement(node);
    }

    @Override
    public Void visitDictLiteral(DictLiteral node) {
        throw notAStatement(node);
    }

    @Override
    public Void visitAttributeAccess(AttributeAccess node) {
        throw notAStatement(node);
    }

    @Override
    public Void visitNameRef(NameRef node) {
        throw notAStatement(node);
    }

    @Override
    public Void visitConstant(Constant node) {
        throw notAStatement(node);
    }

    private RuntimeException notAStatement(SyntaxNode node) {
        return ctx.unsupported(CompilerErrorCode.UNSUPPORTED_POSITION, node, "an expression cannot be used as a statement");
    }

    private String targetName(SyntaxNode target, String segment) {
        if (target instanceof NameRef ref) {
            return ref.id();
        }
        ctx.enter(segment);
        try {
            throw ctx.unsupported(CompilerErrorCode.UNSUPPORTED_POSITION, target, "only plain names can be assigned");
        } finally {
            ctx.leave();
        }
    }
}
