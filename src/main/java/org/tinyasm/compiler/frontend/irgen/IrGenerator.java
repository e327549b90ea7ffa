package org.tinyasm.compiler.frontend.irgen;

import org.tinyasm.compiler.api.CompilationException;
import org.tinyasm.compiler.api.CompilerErrorCode;
import org.tinyasm.compiler.api.UnsupportedConstructException;
import org.tinyasm.compiler.frontend.ast.FunctionDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Phase: lowers every top-level function of a program.
 * <p>
 * With more than one worker the functions are lowered on a fixed thread pool. Each
 * worker owns its function's scope; only the {@link CompilationContext} is shared.
 * The result keeps the input order in both modes, although label numbers depend on
 * scheduling when workers run in parallel.
 */
public final class IrGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(IrGenerator.class);

    private final CompilationContext context;
    private final int workers;

    /**
     * @param context The compilation-wide context.
     * @param workers Number of lowering threads; values below 2 lower on the calling thread.
     */
    public IrGenerator(CompilationContext context, int workers) {
        this.context = context;
        this.workers = workers;
    }

    /**
     * Lowers all functions.
     *
     * @param functions The top-level function definitions, in source order.
     * @return The lowered functions, in the same order.
     * @throws CompilationException if any function fails to lower; no partial result is returned.
     */
    public List<LoweredFunction> generate(List<FunctionDef> functions) throws CompilationException {
        checkNames(functions);
        if (workers < 2 || functions.size() < 2) {
            FunctionLowering lowering = new FunctionLowering(context);
            List<LoweredFunction> result = new ArrayList<>(functions.size());
            for (FunctionDef def : functions) {
                result.add(lowering.lower(def));
            }
            return result;
        }
        return generateInParallel(functions);
    }

    private List<LoweredFunction> generateInParallel(List<FunctionDef> functions) throws CompilationException {
        int threads = Math.min(workers, functions.size());
        LOG.debug("Lowering {} functions on {} workers", functions.size(), threads);
        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "tinyasm-lowering");
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<LoweredFunction>> futures = new ArrayList<>(functions.size());
            for (FunctionDef def : functions) {
                futures.add(pool.submit(() -> new FunctionLowering(context).lower(def)));
            }
            List<LoweredFunction> result = new ArrayList<>(functions.size());
            for (Future<LoweredFunction> future : futures) {
                result.add(future.get());
            }
            return result;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CompilationException ce) {
                throw ce;
            }
            throw new CompilationException("Lowering failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompilationException("Interrupted while lowering", e);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Function labels are the function names, so each name must be unique and must not
     * be one the compiler generates for its own labels.
     */
    private static void checkNames(List<FunctionDef> functions) throws UnsupportedConstructException {
        Set<String> seen = new HashSet<>();
        for (FunctionDef def : functions) {
            if (ReservedNames.isReserved(def.name())) {
                throw new UnsupportedConstructException(CompilerErrorCode.RESERVED_NAME, def.kind(), def.name(),
                        "function " + def.name() + " is named like a generated label");
            }
            if (!seen.add(def.name())) {
                throw new UnsupportedConstructException(CompilerErrorCode.DUPLICATE_FUNCTION, def.kind(), def.name(),
                        "function " + def.name() + " is defined more than once");
            }
        }
    }
}
