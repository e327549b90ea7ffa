package org.tinyasm.compiler.ir;

/**
 * Label definition in the IR stream. The label anchors the item that follows it.
 */
public record IrLabelDef(String name) implements IrItem {

    @Override
    public String toString() {
        return name + ":";
    }
}
