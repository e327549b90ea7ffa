package org.tinyasm.compiler.frontend.irgen;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out label numbers for one compilation. The counter is never reset between
 * functions, so every construct in the compiled program gets its own number.
 */
public final class LabelAllocator {

    private final AtomicInteger counter = new AtomicInteger();

    /**
     * @return A number not handed out before in this compilation.
     */
    public int nextId() {
        return counter.incrementAndGet();
    }

    /**
     * @param prefix The readable prefix.
     * @return A fresh label.
     */
    public Label next(String prefix) {
        return new Label(prefix, nextId());
    }
}
