package org.tinyasm.compiler.frontend.semantics;

import org.tinyasm.compiler.diagnostics.DiagnosticsEngine;

/**
 * Classifies name references as built-in constant, local or global.
 * <p>
 * A name that is neither built-in, local nor already global is promoted to the
 * global scope on first use instead of being rejected. Later references to it from
 * any function then resolve as global too, unless that function declares a local
 * of the same name.
 */
public final class ScopeResolver {

    private final GlobalScope globals;
    private final DiagnosticsEngine diagnostics;

    /**
     * @param globals The program-wide global scope.
     * @param diagnostics Receives a warning for each promoted name.
     */
    public ScopeResolver(GlobalScope globals, DiagnosticsEngine diagnostics) {
        this.globals = globals;
        this.diagnostics = diagnostics;
    }

    /**
     * Resolves a name read.
     *
     * @param name The identifier.
     * @param scope The scope of the function being lowered.
     * @param path Structural path of the reference, used in diagnostics.
     * @return The classification.
     */
    public SymbolKind resolve(String name, Scope scope, String path) {
        if (BuiltinConstants.isBuiltin(name)) {
            return SymbolKind.BUILTIN_CONSTANT;
        }
        if (scope.contains(name)) {
            return SymbolKind.LOCAL;
        }
        if (globals.promote(name)) {
            diagnostics.reportWarning("Unresolved name '" + name + "' promoted to global", path);
        }
        return SymbolKind.GLOBAL;
    }

    /**
     * Declares an assignment target. Targets always become locals of the current function,
     * and must be declared before the assigned value is lowered.
     *
     * @param name The identifier.
     * @param scope The scope of the function being lowered.
     * @return The frame slot of the target.
     */
    public int declareTarget(String name, Scope scope) {
        return scope.declare(name);
    }
}
