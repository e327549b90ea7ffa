package org.tinyasm.compiler.ir;

/**
 * Uninitialized storage of {@code qwords} 8-byte slots in the {@code .bss} section.
 */
public record IrReservation(String label, int qwords) implements IrData {}
