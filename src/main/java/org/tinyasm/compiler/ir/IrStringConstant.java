package org.tinyasm.compiler.ir;

/**
 * A zero-terminated string in the {@code .data} section.
 */
public record IrStringConstant(String label, String value) implements IrData {}
