package org.tinyasm.compiler.frontend.semantics;

/**
 * Classification of a name reference.
 */
public enum SymbolKind {
    /** A fixed built-in constant such as {@code True}; no storage is emitted. */
    BUILTIN_CONSTANT,
    /** A slot in the current function's frame. */
    LOCAL,
    /** Program-wide storage in the {@code .bss} section. */
    GLOBAL
}
