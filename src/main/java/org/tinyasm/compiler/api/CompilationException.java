package org.tinyasm.compiler.api;

/**
 * An exception that is thrown when an error aborts the compilation of a program.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 * Any compilation exception discards the whole compilation; no partial listing is produced.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        this(CompilerErrorCode.UNKNOWN_ERROR, message, null);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        this(CompilerErrorCode.UNKNOWN_ERROR, message, cause);
    }

    /**
     * Constructs a new compilation exception with an error code.
     * @param errorCode The error code, used by callers and tests instead of the message text.
     * @param message The detail message.
     * @param cause The cause, may be null.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * @return The error code of this failure.
     */
    public CompilerErrorCode errorCode() {
        return errorCode;
    }
}
