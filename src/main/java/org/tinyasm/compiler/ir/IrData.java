package org.tinyasm.compiler.ir;

/**
 * A data definition placed outside the text section.
 */
public sealed interface IrData permits IrReservation, IrStringConstant {

    /**
     * @return The label naming the data.
     */
    String label();
}
