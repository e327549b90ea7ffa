package org.tinyasm.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Typed view of the {@code tinyasm} configuration block that affects compilation.
 *
 * @param deadStoreElimination Whether dead frame stores are removed.
 * @param peephole Whether the peephole rewrites run.
 * @param workers Number of threads lowering functions; 1 lowers on the calling thread.
 * @param entryPoint Function called by the program launcher; blank for no launcher.
 */
public record CompilerOptions(boolean deadStoreElimination, boolean peephole, int workers, String entryPoint) {

    public CompilerOptions {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, was " + workers);
        }
        entryPoint = entryPoint == null ? "" : entryPoint.strip();
    }

    /**
     * Maps a resolved configuration to options.
     * @param config The configuration, containing the {@code tinyasm} block.
     * @return The options.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config c = config.getConfig("tinyasm");
        return new CompilerOptions(
                c.getBoolean("optimizer.dead-store-elimination"),
                c.getBoolean("optimizer.peephole"),
                c.getInt("lowering.workers"),
                c.getString("listing.entry-point"));
    }

    /**
     * @return The options defined by {@code reference.conf}.
     */
    public static CompilerOptions defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    public CompilerOptions withOptimizations(boolean deadStoreElimination, boolean peephole) {
        return new CompilerOptions(deadStoreElimination, peephole, workers, entryPoint);
    }

    public CompilerOptions withWorkers(int workers) {
        return new CompilerOptions(deadStoreElimination, peephole, workers, entryPoint);
    }
}
