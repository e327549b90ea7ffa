package org.tinyasm.compiler.frontend.irgen;

import org.tinyasm.compiler.diagnostics.DiagnosticsEngine;
import org.tinyasm.compiler.frontend.semantics.GlobalScope;
import org.tinyasm.compiler.frontend.semantics.ScopeResolver;
import org.tinyasm.compiler.ir.IrReservation;
import org.tinyasm.compiler.ir.IrStringConstant;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State shared by all functions of one compilation: the label counter, the global
 * scope, the string pool and the heap arena used by aggregate literals. It is passed explicitly to every lowering call, so two
 * compilations never interfere. All members are safe for concurrent lowering workers.
 */
public final class CompilationContext {

    /** Label of the arena that aggregate literals are allocated from. */
    public static final String HEAP_ARENA = "heap_arena";
    /** Label of the word holding the number of arena bytes handed out. */
    public static final String HEAP_USED = "heap_used";
    /** Arena size in 8-byte words. Memory is never reclaimed. */
    public static final int HEAP_QWORDS = 1 << 16;

    private final LabelAllocator labels = new LabelAllocator();
    private final GlobalScope globals = new GlobalScope();
    private final DiagnosticsEngine diagnostics;
    private final ScopeResolver resolver;
    private final Map<String, Label> strings = new ConcurrentHashMap<>();
    private final AtomicBoolean heapUsed = new AtomicBoolean();

    /**
     * @param diagnostics The diagnostics engine for non-fatal messages.
     */
    public CompilationContext(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        this.resolver = new ScopeResolver(globals, diagnostics);
    }

    public LabelAllocator labels() {
        return labels;
    }

    public GlobalScope globals() {
        return globals;
    }

    public ScopeResolver resolver() {
        return resolver;
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    /**
     * Interns a string constant. Equal strings share one label, so their addresses compare equal.
     * @param value The string.
     * @return The data label of the string.
     */
    public String internString(String value) {
        return strings.computeIfAbsent(value, v -> labels.next("str")).name();
    }

    /**
     * @return All interned strings, ordered by label number.
     */
    public List<IrStringConstant> strings() {
        return strings.entrySet().stream()
                .sorted(Comparator.comparingInt(e -> e.getValue().id()))
                .map(e -> new IrStringConstant(e.getValue().name(), e.getKey()))
                .toList();
    }

    /**
     * Marks the heap arena as used by the program.
     * @return The arena label.
     */
    public String heapArena() {
        heapUsed.set(true);
        return HEAP_ARENA;
    }

    /**
     * @return The program-wide {@code .bss} storage besides globals: the allocation
     *         counter and the arena, or nothing when no aggregate literal was lowered.
     */
    public List<IrReservation> storage() {
        if (!heapUsed.get()) {
            return List.of();
        }
        return List.of(new IrReservation(HEAP_USED, 1), new IrReservation(HEAP_ARENA, HEAP_QWORDS));
    }
}
