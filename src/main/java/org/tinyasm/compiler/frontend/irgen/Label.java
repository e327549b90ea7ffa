package org.tinyasm.compiler.frontend.irgen;

/**
 * A generated label: a readable prefix plus a number drawn from the compilation-wide counter.
 */
public record Label(String prefix, int id) {

    /**
     * @return The label text, e.g. {@code else_7}.
     */
    public String name() {
        return prefix + "_" + id;
    }

    @Override
    public String toString() {
        return name();
    }
}
