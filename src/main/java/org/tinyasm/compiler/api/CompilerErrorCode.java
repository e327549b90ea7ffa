package org.tinyasm.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can abort a compilation.
 * This decouples the test logic from the message texts.
 */
public enum CompilerErrorCode {
    // region Tree document errors
    /** The tree document is not valid JSON or misses a required field. */
    MALFORMED_TREE,
    /** The tree document names a node kind the compiler does not know. */
    UNKNOWN_NODE_KIND,
    // endregion

    // region Lowering errors
    /** A known node kind appears where it has no lowering rule (e.g. a statement used as an expression). */
    UNSUPPORTED_POSITION,
    /** A call passes more arguments than there are argument registers. */
    TOO_MANY_ARGUMENTS,
    /** A dict literal uses {@code **mapping} unpacking. */
    DICT_UNPACKING,
    /** Two top-level functions share a name. */
    DUPLICATE_FUNCTION,
    /** A function is defined or called under the name of a label the compiler generates. */
    RESERVED_NAME,
    // endregion

    // region General Errors
    /** An I/O error occurred while reading the tree document. */
    IO_ERROR_READING_FILE,
    /** An unknown or unexpected error occurred. */
    UNKNOWN_ERROR
    // endregion
}
