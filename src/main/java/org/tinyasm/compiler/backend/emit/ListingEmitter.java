package org.tinyasm.compiler.backend.emit;

import org.tinyasm.compiler.api.CompiledProgram;
import org.tinyasm.compiler.api.CompiledUnit;
import org.tinyasm.compiler.frontend.irgen.FunctionContext;
import org.tinyasm.compiler.ir.IrInstruction;
import org.tinyasm.compiler.ir.IrItem;
import org.tinyasm.compiler.ir.IrLabelDef;
import org.tinyasm.compiler.ir.IrReservation;
import org.tinyasm.compiler.ir.IrStringConstant;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Renders a compiled program as a NASM listing: the text section with one block per
 * unit in input order, then the string constants, then globals and the other
 * uninitialized storage.
 */
public final class ListingEmitter {

    /** Label of the launcher that calls the entry point and exits with its result. */
    public static final String LAUNCHER = "_start";

    private static final String INDENT = "    ";
    private static final int SYS_EXIT = 60;

    /**
     * Writes the listing of a program.
     * @param program The compiled program.
     * @param out The sink.
     * @throws IOException if the sink fails.
     */
    public void write(CompiledProgram program, Appendable out) throws IOException {
        line(out, "default rel");
        line(out, "");
        line(out, "section .text");
        Optional<String> entry = program.entryPoint();
        if (entry.isPresent()) {
            line(out, "global " + LAUNCHER);
        }
        for (CompiledUnit unit : program.units()) {
            line(out, "global " + unit.functionName());
        }
        if (entry.isPresent()) {
            line(out, "");
            line(out, LAUNCHER + ":");
            line(out, INDENT + "call " + entry.get());
            line(out, INDENT + "mov rdi, rax");
            line(out, INDENT + "mov rax, " + SYS_EXIT);
            line(out, INDENT + "syscall");
        }
        for (CompiledUnit unit : program.units()) {
            line(out, "");
            for (IrItem item : unit.items()) {
                if (item instanceof IrLabelDef def) {
                    line(out, def.toString());
                } else {
                    line(out, INDENT + ((IrInstruction) item));
                }
            }
        }

        if (!program.strings().isEmpty()) {
            line(out, "");
            line(out, "section .data");
            for (IrStringConstant s : program.strings()) {
                line(out, s.label() + ": db " + bytes(s.value()));
            }
        }

        if (!program.globals().isEmpty() || !program.storage().isEmpty()) {
            line(out, "");
            line(out, "section .bss");
            for (String global : program.globals()) {
                line(out, FunctionContext.GLOBAL_PREFIX + global + ": resq 1");
            }
            for (IrReservation r : program.storage()) {
                line(out, r.label() + ": resq " + r.qwords());
            }
        }
    }

    /**
     * @param program The compiled program.
     * @return The listing as a string.
     */
    public String render(CompiledProgram program) {
        StringBuilder sb = new StringBuilder();
        try {
            write(program, sb);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    /**
     * Encodes a string as a {@code db} operand list: printable runs are quoted, everything
     * else is written as byte values, followed by the terminating zero.
     */
    static String bytes(String value) {
        StringBuilder sb = new StringBuilder();
        StringBuilder run = new StringBuilder();
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            if (b >= 0x20 && b < 0x7f && b != '\'') {
                run.append((char) b);
            } else {
                flush(sb, run);
                sb.append(b & 0xff).append(", ");
            }
        }
        flush(sb, run);
        return sb.append('0').toString();
    }

    private static void flush(StringBuilder sb, StringBuilder run) {
        if (run.length() > 0) {
            sb.append('\'').append(run).append("', ");
            run.setLength(0);
        }
    }

    private static void line(Appendable out, String text) throws IOException {
        out.append(text).append('\n');
    }
}
