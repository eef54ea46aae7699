package io.liparakis.structis.spi;

/**
 * Capability for values whose meaning depends on horizontal orientation, such as
 * a facing direction or a horizontal axis.
 * <p>
 * Block values (or the property values they are built from) implement this
 * directly. The catalog decides which parts of a block are rotatable; the
 * structure core only asks for the rotated result.
 *
 * @param <T> The implementing type
 */
public interface Rotatable<T> {

    /** Returns a copy of this value turned by the given quarter turn. */
    T rotate(Rotation rotation);
}
