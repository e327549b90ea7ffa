package org.tinyasm.compiler.backend.toolchain;

import org.tinyasm.compiler.api.ToolchainException;

import java.io.IOException;

/**
 * Turns a listing into a binary.
 */
public interface Toolchain {

    /**
     * Assembles (and optionally links) a listing. All intermediate files are removed
     * before this method returns, on success and on failure.
     *
     * @param listing The complete NASM listing.
     * @param handler Receives the binary path while the binary exists.
     * @param <T> The handler's result type.
     * @return The handler's result.
     * @throws ToolchainException if an external command fails.
     * @throws IOException if the temporary files cannot be written or the handler fails.
     */
    <T> T build(String listing, BinaryHandler<T> handler) throws ToolchainException, IOException;
}
