package org.tinyasm.compiler.api;

/**
 * Thrown when the tree walk reaches a node for which no lowering rule exists at that position.
 */
public class UnsupportedConstructException extends CompilationException {

    private final String nodeKind;
    private final String path;

    /**
     * @param errorCode The specific error code.
     * @param nodeKind The kind of the offending node.
     * @param path The structural path from the function to the node, e.g. {@code f/body[0]/If.test}.
     * @param detail Additional explanation, may be null.
     */
    public UnsupportedConstructException(CompilerErrorCode errorCode, String nodeKind, String path, String detail) {
        super(errorCode, format(nodeKind, path, detail), null);
        this.nodeKind = nodeKind;
        this.path = path;
    }

    private static String format(String nodeKind, String path, String detail) {
        String base = String.format("Unsupported construct %s at %s", nodeKind, path);
        return detail == null ? base : base + ": " + detail;
    }

    /**
     * @return The kind of the node that could not be lowered.
     */
    public String nodeKind() {
        return nodeKind;
    }

    /**
     * @return The structural path of the node.
     */
    public String path() {
        return path;
    }
}
