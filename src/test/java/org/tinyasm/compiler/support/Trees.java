package org.tinyasm.compiler.support;

import org.tinyasm.compiler.frontend.ast.Assign;
import org.tinyasm.compiler.frontend.ast.AttributeAccess;
import org.tinyasm.compiler.frontend.ast.AugAssign;
import org.tinyasm.compiler.frontend.ast.BinaryOp;
import org.tinyasm.compiler.frontend.ast.BinaryOperator;
import org.tinyasm.compiler.frontend.ast.Call;
import org.tinyasm.compiler.frontend.ast.Compare;
import org.tinyasm.compiler.frontend.ast.CompareOperator;
import org.tinyasm.compiler.frontend.ast.Constant;
import org.tinyasm.compiler.frontend.ast.DictLiteral;
import org.tinyasm.compiler.frontend.ast.ExprStatement;
import org.tinyasm.compiler.frontend.ast.FunctionDef;
import org.tinyasm.compiler.frontend.ast.If;
import org.tinyasm.compiler.frontend.ast.ListLiteral;
import org.tinyasm.compiler.frontend.ast.NameRef;
import org.tinyasm.compiler.frontend.ast.Return;
import org.tinyasm.compiler.frontend.ast.SyntaxNode;
import org.tinyasm.compiler.frontend.ast.While;

import java.util.List;

/**
 * Short factories for building syntax trees in tests.
 */
public final class Trees {

    private Trees() {}

    public static FunctionDef fn(String name, List<String> params, SyntaxNode... body) {
        return new FunctionDef(name, params, List.of(body));
    }

    public static List<SyntaxNode> block(SyntaxNode... statements) {
        return List.of(statements);
    }

    public static Assign assign(String target, SyntaxNode value) {
        return new Assign(name(target), value);
    }

    public static AugAssign augAssign(String target, BinaryOperator op, SyntaxNode value) {
        return new AugAssign(name(target), op, value);
    }

    public static Return ret(SyntaxNode value) {
        return new Return(value);
    }

    public static ExprStatement expr(SyntaxNode expression) {
        return new ExprStatement(expression);
    }

    public static If ifElse(SyntaxNode test, List<SyntaxNode> body, List<SyntaxNode> orElse) {
        return new If(test, body, orElse);
    }

    public static While loop(SyntaxNode test, SyntaxNode... body) {
        return new While(test, List.of(body));
    }

    public static BinaryOp bin(BinaryOperator op, SyntaxNode left, SyntaxNode right) {
        return new BinaryOp(op, left, right);
    }

    public static Compare cmp(CompareOperator op, SyntaxNode left, SyntaxNode right) {
        return new Compare(op, left, right);
    }

    public static Call call(String function, SyntaxNode... args) {
        return new Call(function, List.of(args));
    }

    public static ListLiteral list(SyntaxNode... elements) {
        return new ListLiteral(List.of(elements));
    }

    public static DictLiteral dict(List<SyntaxNode> keys, List<SyntaxNode> values) {
        return new DictLiteral(keys, values);
    }

    public static AttributeAccess attr(SyntaxNode value, String attribute) {
        return new AttributeAccess(value, attribute);
    }

    public static NameRef name(String id) {
        return new NameRef(id);
    }

    public static Constant num(long value) {
        return new Constant(value);
    }

    public static Constant str(String value) {
        return new Constant(value);
    }

    public static Constant none() {
        return new Constant(null);
    }

    /** {@code def factorial(n): if n == 0: return 1 else: return n * factorial(n - 1)} */
    public static FunctionDef factorial() {
        return fn("factorial", List.of("n"),
                ifElse(cmp(CompareOperator.EQ, name("n"), num(0)),
                        block(ret(num(1))),
                        block(ret(bin(BinaryOperator.MULT, name("n"),
                                call("factorial", bin(BinaryOperator.SUB, name("n"), num(1))))))));
    }

    /** {@code def count(): i = 0; while i < 10: i += 1; return i} */
    public static FunctionDef counter() {
        return fn("count", List.of(),
                assign("i", num(0)),
                loop(cmp(CompareOperator.LT, name("i"), num(10)),
                        augAssign("i", BinaryOperator.ADD, num(1))),
                ret(name("i")));
    }
}
