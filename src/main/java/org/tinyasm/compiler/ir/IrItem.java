package org.tinyasm.compiler.ir;

/**
 * Marker interface for all elements of a lowered instruction stream.
 * The stream is linear: label definitions and instructions appear in
 * emission order and backends must preserve that order.
 */
public sealed interface IrItem permits IrInstruction, IrLabelDef {}
