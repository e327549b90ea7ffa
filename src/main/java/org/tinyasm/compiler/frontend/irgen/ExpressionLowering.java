package org.tinyasm.compiler.frontend.irgen;

import org.tinyasm.compiler.api.CompilerErrorCode;
import org.tinyasm.compiler.frontend.ast.Assign;
import org.tinyasm.compiler.frontend.ast.AttributeAccess;
import org.tinyasm.compiler.frontend.ast.AugAssign;
import org.tinyasm.compiler.frontend.ast.BinaryOp;
import org.tinyasm.compiler.frontend.ast.BinaryOperator;
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
import org.tinyasm.compiler.frontend.semantics.BuiltinConstants;
import org.tinyasm.compiler.frontend.semantics.SymbolKind;
import org.tinyasm.compiler.ir.IrImm;
import org.tinyasm.compiler.ir.IrLabelRef;
import org.tinyasm.compiler.ir.IrMem;
import org.tinyasm.compiler.ir.IrReg;
import org.tinyasm.compiler.ir.Mnemonic;
import org.tinyasm.compiler.ir.Register;

import java.util.List;

/**
 * Lowers expressions so that their value ends up in the accumulator register.
 * <p>
 * Binary operations evaluate the left operand first, spill it to the machine stack,
 * evaluate the right operand, move it to the scratch register and restore the left
 * operand into the accumulator before combining. The spill keeps nested operands
 * and calls from clobbering a pending left value. Calls made while an odd number of
 * values is spilled are padded so that {@code rsp} stays 16-byte aligned at the call.
 */
public final class ExpressionLowering implements SyntaxVisitor<Void> {

    static final IrReg ACC = new IrReg(Register.ACCUMULATOR);
    static final IrReg SCRATCH = new IrReg(Register.SCRATCH);

    private final FunctionContext ctx;
    private final AggregateLowering aggregates;

    /**
     * @param ctx The context of the function being lowered.
     */
    public ExpressionLowering(FunctionContext ctx) {
        this.ctx = ctx;
        this.aggregates = new AggregateLowering(ctx, this);
    }

    /**
     * Lowers a child expression under the given path segment.
     * @param node The expression.
     * @param segment The path segment naming the child, e.g. {@code BinaryOp.left}.
     */
    public void lower(SyntaxNode node, String segment) {
        ctx.enter(segment);
        try {
            node.accept(this);
        } finally {
            ctx.leave();
        }
    }

    @Override
    public Void visitConstant(Constant node) {
        Object value = node.value();
        if (value instanceof String s) {
            ctx.emit(Mnemonic.LEA, ACC, IrMem.data(ctx.compilation().internString(s), 0));
        } else if (value instanceof Boolean b) {
            ctx.emit(Mnemonic.MOV, ACC, new IrImm(b ? 1 : 0));
        } else if (value instanceof Long l) {
            ctx.emit(Mnemonic.MOV, ACC, new IrImm(l));
        } else {
            ctx.emit(Mnemonic.MOV, ACC, new IrImm(0));
        }
        return null;
    }

    @Override
    public Void visitNameRef(NameRef node) {
        SymbolKind kind = ctx.compilation().resolver().resolve(node.id(), ctx.scope(), ctx.path());
        if (kind == SymbolKind.BUILTIN_CONSTANT) {
            ctx.emit(Mnemonic.MOV, ACC, new IrImm(BuiltinConstants.valueOf(node.id()).orElseThrow()));
        } else {
            ctx.emit(Mnemonic.MOV, ACC, ctx.storageOf(node.id(), kind));
        }
        return null;
    }

    @Override
    public Void visitBinaryOp(BinaryOp node) {
        lowerOperands(node.left(), node.right(), "BinaryOp");
        switch (node.op()) {
            case ADD -> ctx.emit(Mnemonic.ADD, ACC, SCRATCH);
            case SUB -> ctx.emit(Mnemonic.SUB, ACC, SCRATCH);
            case MULT -> ctx.emit(Mnemonic.IMUL, ACC, SCRATCH);
            case DIV, MOD -> {
                if (node.right() instanceof Constant c && Long.valueOf(0L).equals(c.value())) {
                    ctx.compilation().diagnostics().reportWarning("Division by constant zero faults at run time", ctx.path());
                }
                ctx.emit(Mnemonic.CQO);
                ctx.emit(Mnemonic.IDIV, SCRATCH);
                if (node.op() == BinaryOperator.MOD) {
                    ctx.emit(Mnemonic.MOV, ACC, new IrReg(Register.REMAINDER));
                }
            }
        }
        return null;
    }

    @Override
    public Void visitCompare(Compare node) {
        lowerOperands(node.left(), node.right(), "Compare");
        int id = ctx.compilation().labels().nextId();
        Label isTrue = new Label("true", id);
        Label isFalse = new Label("false", id);
        Label end = new Label("end", id);

        ctx.emit(Mnemonic.CMP, ACC, SCRATCH);
        Mnemonic branch = switch (node.op()) {
            case GT -> Mnemonic.JG;
            case LT -> Mnemonic.JL;
            case EQ -> Mnemonic.JE;
            case NOT_EQ -> Mnemonic.JNE;
            case GT_E -> Mnemonic.JGE;
            case LT_E -> Mnemonic.JLE;
        };
        ctx.emit(branch, new IrLabelRef(isTrue.name()));
        ctx.emit(Mnemonic.JMP, new IrLabelRef(isFalse.name()));
        ctx.define(isTrue);
        ctx.emit(Mnemonic.MOV, ACC, new IrImm(1));
        ctx.emit(Mnemonic.JMP, new IrLabelRef(end.name()));
        ctx.define(isFalse);
        ctx.emit(Mnemonic.MOV, ACC, new IrImm(0));
        ctx.define(end);
        return null;
    }

    @Override
    public Void visitCall(Call node) {
        List<SyntaxNode> args = node.args();
        if (args.size() > Register.ARGUMENTS.size()) {
            throw ctx.unsupported(CompilerErrorCode.TOO_MANY_ARGUMENTS, node,
                    node.function() + " is called with " + args.size() + " arguments, at most " + Register.ARGUMENTS.size() + " are supported");
        }
        if (ReservedNames.isReserved(node.function())) {
            throw ctx.unsupported(CompilerErrorCode.RESERVED_NAME, node,
                    node.function() + " is the name of a generated label and cannot be called");
        }
        for (int i = 0; i < args.size(); i++) {
            lower(args.get(i), "Call.args[" + i + "]");
            ctx.spill(ACC);
        }
        for (int i = args.size() - 1; i >= 0; i--) {
            ctx.restore(new IrReg(Register.ARGUMENTS.get(i)));
        }
        ctx.call(node.function());
        return null;
    }

    @Override
    public Void visitListLiteral(ListLiteral node) {
        aggregates.lowerList(node);
        return null;
    }

    @Override
    public Void visitDictLiteral(DictLiteral node) {
        aggregates.lowerDict(node);
        return null;
    }

    @Override
    public Void visitAttributeAccess(AttributeAccess node) {
        aggregates.lowerAttribute(node);
        return null;
    }

    // --- statements have no value ---

    @Override
    public Void visitFunctionDef(FunctionDef node) {
        throw notAnExpression(node);
    }

    @Override
    public Void visitAssign(Assign node) {
        throw notAnExpression(node);
    }

    @Override
    public Void visitAugAssign(AugAssign node) {
        throw notAnExpression(node);
    }

    @Override
    public Void visitReturn(Return node) {
        throw notAnExpression(node);
    }

    @Override
    public Void visitExprStatement(ExprStatement node) {
        throw notAnExpression(node);
    }

    @Override
    public Void visitIf(If node) {
        throw notAnExpression(node);
    }

    @Override
    public Void visitWhile(While node) {
        throw notAnExpression(node);
    }

    private RuntimeException notAnExpression(SyntaxNode node) {
        return ctx.unsupported(CompilerErrorCode.UNSUPPORTED_POSITION, node, "a statement cannot be used as an expression");
    }

    /**
     * Leaves the left operand in the accumulator and the right operand in the scratch register.
     */
    private void lowerOperands(SyntaxNode left, SyntaxNode right, String kind) {
        lower(left, kind + ".left");
        ctx.spill(ACC);
        lower(right, kind + ".right");
        ctx.emit(Mnemonic.MOV, SCRATCH, ACC);
        ctx.restore(ACC);
    }
}
