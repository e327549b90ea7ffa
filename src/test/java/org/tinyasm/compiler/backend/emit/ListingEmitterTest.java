package org.tinyasm.compiler.backend.emit;

import org.tinyasm.compiler.CompilerOptions;
import org.tinyasm.compiler.api.CompiledProgram;
import org.tinyasm.compiler.api.CompiledUnit;
import org.tinyasm.compiler.frontend.irgen.CompilationContext;
import org.tinyasm.compiler.ir.IrImm;
import org.tinyasm.compiler.ir.IrInstruction;
import org.tinyasm.compiler.ir.IrLabelDef;
import org.tinyasm.compiler.ir.IrReg;
import org.tinyasm.compiler.ir.IrReservation;
import org.tinyasm.compiler.ir.IrStringConstant;
import org.tinyasm.compiler.ir.Mnemonic;
import org.tinyasm.compiler.ir.Register;
import org.tinyasm.compiler.support.Listings;
import org.tinyasm.compiler.support.Trees;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ListingEmitterTest {

    private final ListingEmitter emitter = new ListingEmitter();

    private static CompiledUnit returnsZero(String name) {
        return new CompiledUnit(name, List.of(
                new IrLabelDef(name),
                IrInstruction.of(Mnemonic.MOV, new IrReg(Register.RAX), new IrImm(0)),
                IrInstruction.of(Mnemonic.RET)), 0);
    }

    @Test
    void programWithEntryPointStartsWithTheLauncher() {
        CompiledProgram program = new CompiledProgram(List.of(returnsZero("helper"), returnsZero("main")),
                List.of(), List.of(), List.of(), Optional.of("main"));

        assertThat(emitter.render(program)).isEqualTo("""
                default rel

                section .text
                global _start
                global helper
                global main

                _start:
                    call main
                    mov rdi, rax
                    mov rax, 60
                    syscall

                helper:
                    mov rax, 0
                    ret

                main:
                    mov rax, 0
                    ret
                """);
    }

    @Test
    void libraryListingHasNoLauncher() {
        CompiledProgram program = new CompiledProgram(List.of(returnsZero("f")), List.of(), List.of(), List.of(), Optional.empty());

        String listing = emitter.render(program);

        assertThat(listing).doesNotContain("_start").doesNotContain("syscall")
                .doesNotContain("section .data").doesNotContain("section .bss");
        assertThat(listing).contains("global f\n\nf:\n    mov rax, 0\n    ret\n");
    }

    @Test
    void storageSectionsFollowTheCode() {
        CompiledProgram program = new CompiledProgram(
                List.of(returnsZero("f"), returnsZero("g")),
                List.of("counter", "total"),
                List.of(new IrStringConstant("str_1", "hello")),
                List.of(new IrReservation("heap_used", 1), new IrReservation("heap_arena", 64)),
                Optional.empty());

        String listing = emitter.render(program);

        assertThat(listing).endsWith("""

                section .data
                str_1: db 'hello', 0

                section .bss
                g_counter: resq 1
                g_total: resq 1
                heap_used: resq 1
                heap_arena: resq 64
                """);
        assertThat(listing.indexOf("section .text")).isLessThan(listing.indexOf("section .data"));
    }

    @Test
    void stringsAreEncodedAsQuotedRunsAndByteValues() {
        assertThat(ListingEmitter.bytes("hi there")).isEqualTo("'hi there', 0");
        assertThat(ListingEmitter.bytes("")).isEqualTo("0");
        assertThat(ListingEmitter.bytes("it's\n")).isEqualTo("'it', 39, 's', 10, 0");
        assertThat(ListingEmitter.bytes("é")).isEqualTo("195, 169, 0");
    }

    @Test
    void writeAndRenderProduceTheSameText() throws Exception {
        CompiledProgram program = Listings.compile(new CompilerOptions(true, true, 1, "count"), Trees.counter());
        StringWriter out = new StringWriter();

        emitter.write(program, out);

        assertThat(out.toString()).isEqualTo(emitter.render(program));
        assertThat(out.toString()).contains("call count").contains("\ncount:\n    push rbp\n");
    }

    @Test
    void aggregateLiteralsBringTheHeapArena() throws Exception {
        String withList = emitter.render(Listings.compile(
                Trees.fn("f", List.of(), Trees.ret(Trees.list(Trees.num(1))))));
        String without = emitter.render(Listings.compile(Trees.fn("f", List.of(), Trees.ret(Trees.num(1)))));

        assertThat(withList).contains("section .bss\nheap_used: resq 1\nheap_arena: resq " + CompilationContext.HEAP_QWORDS + "\n");
        assertThat(without).doesNotContain("heap_");
    }
}
