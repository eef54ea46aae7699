package io.liparakis.structis.core;

/**
 * Contents of one structure position.
 *
 * @param block  The block on the primary layer, or {@code null} if there is none
 * @param liquid The liquid sharing the position, or {@code null} if there is none
 * @param <B>    The runtime block type
 */
public record StructureCell<B>(B block, B liquid) {

    public boolean isEmpty() {
        return block == null && liquid == null;
    }
}
