package org.tinyasm.compiler.backend.toolchain;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Receives the produced binary while it still exists inside the toolchain's
 * temporary directory.
 *
 * @param <T> The result type.
 */
@FunctionalInterface
public interface BinaryHandler<T> {

    /**
     * @param binary Path of the binary. It is deleted once this method returns.
     * @return The handler's result, passed through to the caller of the toolchain.
     * @throws IOException if the handler fails to read or copy the binary.
     */
    T handle(Path binary) throws IOException;
}
