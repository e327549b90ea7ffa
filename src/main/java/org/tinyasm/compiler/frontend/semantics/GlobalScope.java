package org.tinyasm.compiler.frontend.semantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Program-wide set of global names. Insertions are serialized so that
 * functions can be lowered concurrently against the same instance.
 */
public final class GlobalScope {

    private final Set<String> names = new HashSet<>();

    /**
     * Adds a name to the global scope.
     * @param name The identifier.
     * @return {@code true} if the name was not global before.
     */
    public synchronized boolean promote(String name) {
        return names.add(name);
    }

    /**
     * @param name The identifier.
     * @return {@code true} if the name is global.
     */
    public synchronized boolean contains(String name) {
        return names.contains(name);
    }

    /**
     * @return A sorted snapshot of all global names.
     */
    public synchronized List<String> snapshot() {
        List<String> sorted = new ArrayList<>(names);
        Collections.sort(sorted);
        return sorted;
    }
}
