package io.liparakis.structis.spi;

/**
 * A quarter turn around the vertical (Y) axis.
 */
public enum Rotation {
    /** 90 degrees anti-clockwise when viewed from above. */
    LEFT,

    /** 90 degrees clockwise when viewed from above. */
    RIGHT;

    /**
     * Returns the quarter turn that undoes this one.
     */
    public Rotation opposite() {
        return this == LEFT ? RIGHT : LEFT;
    }
}
