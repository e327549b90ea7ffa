package org.tinyasm.compiler.frontend.irgen;

import org.tinyasm.compiler.backend.emit.ListingEmitter;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Names that function labels share with labels the compiler generates. A function label
 * is its name, so a function named like a generated label would define that label twice.
 */
public final class ReservedNames {

    /** Numbered labels: control flow, attribute scans and interned strings. */
    private static final Pattern GENERATED = Pattern.compile("(true|false|end|else|loop|attr|found|miss|str)_\\d+");

    private static final Set<String> FIXED = Set.of(
            ListingEmitter.LAUNCHER, CompilationContext.HEAP_ARENA, CompilationContext.HEAP_USED);

    private ReservedNames() {}

    /**
     * @param name A function name.
     * @return {@code true} if a label of that name may be generated by the compiler.
     */
    public static boolean isReserved(String name) {
        return name.startsWith(FunctionContext.GLOBAL_PREFIX)
                || FIXED.contains(name)
                || GENERATED.matcher(name).matches();
    }
}
