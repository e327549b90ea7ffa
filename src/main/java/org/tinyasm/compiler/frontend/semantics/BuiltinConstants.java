package org.tinyasm.compiler.frontend.semantics;

import java.util.Map;
import java.util.OptionalLong;

/**
 * The built-in constant names and the machine values they lower to.
 */
public final class BuiltinConstants {

    private static final Map<String, Long> VALUES = Map.of(
            "True", 1L,
            "False", 0L,
            "None", 0L
    );

    private BuiltinConstants() {}

    /**
     * @param name An identifier.
     * @return {@code true} if the identifier names a built-in constant.
     */
    public static boolean isBuiltin(String name) {
        return VALUES.containsKey(name);
    }

    /**
     * @param name An identifier.
     * @return The value of the built-in constant, or empty if {@code name} is not one.
     */
    public static OptionalLong valueOf(String name) {
        Long value = VALUES.get(name);
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }
}
