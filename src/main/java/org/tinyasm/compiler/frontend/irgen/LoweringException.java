package org.tinyasm.compiler.frontend.irgen;

import org.tinyasm.compiler.api.UnsupportedConstructException;

/**
 * Carries an {@link UnsupportedConstructException} out of the visitor methods, which
 * cannot declare checked exceptions. {@link FunctionLowering} unwraps it.
 */
final class LoweringException extends RuntimeException {

    LoweringException(UnsupportedConstructException cause) {
        super(cause.getMessage(), cause);
    }

    @Override
    public synchronized UnsupportedConstructException getCause() {
        return (UnsupportedConstructException) super.getCause();
    }
}
