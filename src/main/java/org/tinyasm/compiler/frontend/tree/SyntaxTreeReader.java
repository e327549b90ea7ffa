package org.tinyasm.compiler.frontend.tree;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.tinyasm.compiler.api.CompilationException;
import org.tinyasm.compiler.api.CompilerErrorCode;
import org.tinyasm.compiler.api.UnsupportedConstructException;
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

import java.io.Reader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Decodes the JSON tree document handed over by the external parser.
 * <p>
 * The document is an array of {@code FunctionDef} objects. Every node is an object whose
 * {@code "kind"} member names its {@link SyntaxNode} type; the other members are named like
 * the record components, for example
 * <pre>{"kind": "BinaryOp", "op": "ADD", "left": {...}, "right": {...}}</pre>
 * Operator tags are accepted either as enum constants ({@code NOT_EQ}) or in the parser's
 * camel case ({@code NotEq}). A reader instance is not thread-safe.
 */
public final class SyntaxTreeReader {

    private final Deque<String> path = new ArrayDeque<>();

    /**
     * Reads a whole tree document.
     *
     * @param reader The document source. It is not closed.
     * @return The top-level functions in document order.
     * @throws CompilationException if the document is not valid JSON, misses a required member,
     *                              or names an unknown node kind.
     */
    public List<FunctionDef> read(Reader reader) throws CompilationException {
        path.clear();
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new CompilationException(CompilerErrorCode.MALFORMED_TREE, "Tree document is not valid JSON: " + e.getMessage(), e);
        }
        try {
            if (!root.isJsonArray()) {
                throw malformed("the document must be an array of FunctionDef nodes");
            }
            JsonArray array = root.getAsJsonArray();
            List<FunctionDef> functions = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                path.addLast("[" + i + "]");
                SyntaxNode node = node(array.get(i));
                if (!(node instanceof FunctionDef def)) {
                    throw new TreeException(new UnsupportedConstructException(CompilerErrorCode.UNSUPPORTED_POSITION,
                            node.kind(), currentPath(), "only FunctionDef nodes may appear at top level"));
                }
                functions.add(def);
                path.removeLast();
            }
            return functions;
        } catch (TreeException e) {
            throw e.getCause();
        }
    }

    private SyntaxNode node(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            throw malformed("expected a node object");
        }
        JsonObject obj = element.getAsJsonObject();
        String kind = string(obj, "kind");
        return switch (kind) {
            case "FunctionDef" -> new FunctionDef(string(obj, "name"), strings(obj, "params"), nodes(obj, "body"));
            case "Assign" -> new Assign(child(obj, "target"), child(obj, "value"));
            case "AugAssign" -> new AugAssign(child(obj, "target"), operator(obj, BinaryOperator.class), child(obj, "value"));
            case "Return" -> new Return(optionalChild(obj, "value"));
            case "ExprStatement" -> new ExprStatement(child(obj, "expression"));
            case "If" -> new If(child(obj, "test"), nodes(obj, "body"), obj.has("orElse") ? nodes(obj, "orElse") : List.of());
            case "While" -> new While(child(obj, "test"), nodes(obj, "body"));
            case "BinaryOp" -> new BinaryOp(operator(obj, BinaryOperator.class), child(obj, "left"), child(obj, "right"));
            case "Compare" -> new Compare(operator(obj, CompareOperator.class), child(obj, "left"), child(obj, "right"));
            case "Call" -> new Call(string(obj, "function"), nodes(obj, "args"));
            case "ListLiteral" -> new ListLiteral(nodes(obj, "elements"));
            case "DictLiteral" -> dict(obj);
            case "AttributeAccess" -> new AttributeAccess(child(obj, "value"), string(obj, "attribute"));
            case "NameRef" -> new NameRef(string(obj, "id"));
            case "Constant" -> new Constant(constant(obj.get("value")));
            default -> throw new TreeException(new UnsupportedConstructException(CompilerErrorCode.UNKNOWN_NODE_KIND,
                    kind, currentPath(), "no lowering rule exists for this node kind"));
        };
    }

    private DictLiteral dict(JsonObject obj) {
        List<SyntaxNode> keys = new ArrayList<>();
        JsonArray keyArray = array(obj, "keys");
        for (int i = 0; i < keyArray.size(); i++) {
            JsonElement key = keyArray.get(i);
            keys.add(key.isJsonNull() ? null : inside("DictLiteral.keys[" + i + "]", key));
        }
        List<SyntaxNode> values = nodes(obj, "values");
        if (keys.size() != values.size()) {
            throw malformed("dict literal has " + keys.size() + " keys but " + values.size() + " values");
        }
        return new DictLiteral(keys, values);
    }

    private SyntaxNode child(JsonObject obj, String member) {
        if (!obj.has(member) || obj.get(member).isJsonNull()) {
            throw malformed("missing member '" + member + "'");
        }
        return inside(segment(obj, member), obj.get(member));
    }

    private SyntaxNode optionalChild(JsonObject obj, String member) {
        if (!obj.has(member) || obj.get(member).isJsonNull()) {
            return null;
        }
        return inside(segment(obj, member), obj.get(member));
    }

    private List<SyntaxNode> nodes(JsonObject obj, String member) {
        JsonArray array = array(obj, member);
        List<SyntaxNode> result = new ArrayList<>(array.size());
        String prefix = "FunctionDef".equals(obj.get("kind").getAsString()) ? member : segment(obj, member);
        for (int i = 0; i < array.size(); i++) {
            result.add(inside(prefix + "[" + i + "]", array.get(i)));
        }
        return result;
    }

    private SyntaxNode inside(String segment, JsonElement element) {
        path.addLast(segment);
        SyntaxNode node = node(element);
        path.removeLast();
        return node;
    }

    private JsonArray array(JsonObject obj, String member) {
        JsonElement element = obj.get(member);
        if (element == null || !element.isJsonArray()) {
            throw malformed("member '" + member + "' must be an array");
        }
        return element.getAsJsonArray();
    }

    private String string(JsonObject obj, String member) {
        JsonElement element = obj.get(member);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw malformed("member '" + member + "' must be a string");
        }
        return element.getAsString();
    }

    private List<String> strings(JsonObject obj, String member) {
        JsonArray array = array(obj, member);
        List<String> result = new ArrayList<>(array.size());
        for (JsonElement element : array) {
            if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
                throw malformed("member '" + member + "' must contain strings");
            }
            result.add(element.getAsString());
        }
        return result;
    }

    private <E extends Enum<E>> E operator(JsonObject obj, Class<E> type) {
        String tag = string(obj, "op");
        String constant = tag.contains("_") ? tag : tag.replaceAll("([a-z])([A-Z])", "$1_$2");
        try {
            return Enum.valueOf(type, constant.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw malformed("unknown operator '" + tag + "'");
        }
    }

    private Object constant(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonPrimitive()) {
            throw malformed("constant value must be a number, boolean, string or null");
        }
        JsonPrimitive p = element.getAsJsonPrimitive();
        if (p.isBoolean()) {
            return p.getAsBoolean();
        }
        if (p.isString()) {
            return p.getAsString();
        }
        try {
            return p.getAsBigDecimal().longValueExact();
        } catch (ArithmeticException e) {
            throw malformed("constant " + p + " is not a 64-bit integer");
        }
    }

    private static String segment(JsonObject obj, String member) {
        return obj.get("kind").getAsString() + "." + member;
    }

    private String currentPath() {
        return String.join("/", path);
    }

    private TreeException malformed(String detail) {
        return new TreeException(new CompilationException(CompilerErrorCode.MALFORMED_TREE,
                "Malformed tree document at " + currentPath() + ": " + detail, null));
    }

    /** Carries a checked failure out of the recursive descent. */
    private static final class TreeException extends RuntimeException {
        TreeException(CompilationException cause) {
            super(cause.getMessage(), cause, false, false);
        }

        @Override
        public synchronized CompilationException getCause() {
            return (CompilationException) super.getCause();
        }
    }
}
