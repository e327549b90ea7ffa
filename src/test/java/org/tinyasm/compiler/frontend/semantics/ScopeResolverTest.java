package org.tinyasm.compiler.frontend.semantics;

import org.tinyasm.compiler.diagnostics.Diagnostic;
import org.tinyasm.compiler.diagnostics.DiagnosticsEngine;
import org.tinyasm.junit.extensions.logging.ExpectLog;
import org.tinyasm.junit.extensions.logging.LogLevel;
import org.tinyasm.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ScopeResolverTest {

    private GlobalScope globals;
    private DiagnosticsEngine diagnostics;
    private ScopeResolver resolver;

    @BeforeEach
    void setUp() {
        globals = new GlobalScope();
        diagnostics = new DiagnosticsEngine();
        resolver = new ScopeResolver(globals, diagnostics);
    }

    @Test
    void builtinConstantsResolveWithoutStorage() {
        Scope scope = new Scope("f");

        assertThat(resolver.resolve("True", scope, "f")).isEqualTo(SymbolKind.BUILTIN_CONSTANT);
        assertThat(resolver.resolve("None", scope, "f")).isEqualTo(SymbolKind.BUILTIN_CONSTANT);
        assertThat(globals.snapshot()).isEmpty();
        assertThat(BuiltinConstants.valueOf("True")).hasValue(1);
        assertThat(BuiltinConstants.valueOf("False")).hasValue(0);
    }

    @Test
    void declaredTargetResolvesAsLocal() {
        Scope scope = new Scope("f");
        int slot = resolver.declareTarget("x", scope);

        assertThat(slot).isZero();
        assertThat(resolver.resolve("x", scope, "f")).isEqualTo(SymbolKind.LOCAL);
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void slotsFollowFirstDeclarationOrder() {
        Scope scope = new Scope("f");
        resolver.declareTarget("a", scope);
        resolver.declareTarget("b", scope);
        resolver.declareTarget("a", scope);

        assertThat(scope.slotOf("a")).hasValue(0);
        assertThat(scope.slotOf("b")).hasValue(1);
        assertThat(scope.size()).isEqualTo(2);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*Unresolved name 'counter' promoted to global.*")
    void unresolvedNameIsPromotedToGlobalOnce() {
        Scope first = new Scope("f");
        Scope second = new Scope("g");

        assertThat(resolver.resolve("counter", first, "f/body[0]")).isEqualTo(SymbolKind.GLOBAL);
        assertThat(resolver.resolve("counter", second, "g/body[0]")).isEqualTo(SymbolKind.GLOBAL);

        assertThat(globals.snapshot()).containsExactly("counter");
        assertThat(diagnostics.getDiagnostics())
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.type()).isEqualTo(Diagnostic.Type.WARNING);
                    assertThat(d.path()).isEqualTo("f/body[0]");
                });
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*'x' promoted.*")
    void localOfAnotherFunctionIsNotVisible() {
        Scope owner = new Scope("f");
        resolver.declareTarget("x", owner);
        Scope other = new Scope("g");

        assertThat(resolver.resolve("x", other, "g")).isEqualTo(SymbolKind.GLOBAL);
        assertThat(resolver.resolve("x", owner, "f")).isEqualTo(SymbolKind.LOCAL);
    }
}
