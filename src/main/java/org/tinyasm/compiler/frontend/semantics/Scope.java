package org.tinyasm.compiler.frontend.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * The local variables of one function. A scope is created when lowering of the
 * function starts and discarded afterwards; it is never shared between workers.
 * Slots are numbered in first-declaration order, parameters first.
 */
public final class Scope {

    private final String owner;
    private final Map<String, Integer> slots = new LinkedHashMap<>();

    /**
     * @param owner The name of the function owning this scope.
     */
    public Scope(String owner) {
        this.owner = owner;
    }

    /**
     * Declares a local, if it is not declared yet.
     * @param name The identifier.
     * @return The frame slot of the local.
     */
    public int declare(String name) {
        return slots.computeIfAbsent(name, k -> slots.size());
    }

    /**
     * @param name The identifier.
     * @return {@code true} if {@code name} is a local of this function.
     */
    public boolean contains(String name) {
        return slots.containsKey(name);
    }

    /**
     * @param name The identifier.
     * @return The frame slot of the local, or empty if it is not declared.
     */
    public OptionalInt slotOf(String name) {
        Integer slot = slots.get(name);
        return slot == null ? OptionalInt.empty() : OptionalInt.of(slot);
    }

    /**
     * @return The number of declared locals.
     */
    public int size() {
        return slots.size();
    }

    /**
     * @return The owning function name.
     */
    public String owner() {
        return owner;
    }

    /**
     * @return Unmodifiable view of name to slot, in declaration order.
     */
    public Map<String, Integer> slots() {
        return Collections.unmodifiableMap(slots);
    }
}
