package io.liparakis.structis.storage;

/**
 * Thrown when a structure is well-formed but violates one of the document
 * invariants.
 */
public class StructureValidationException extends StructureDecodeException {

    /**
     * The invariant that was violated.
     */
    public enum Kind {
        UNSUPPORTED_VERSION,
        BAD_EXTENT,
        BAD_ORIGIN,
        NO_LAYERS,
        NO_PALETTES,
        LAYER_SIZE_MISMATCH,
        PALETTE_SIZE_MISMATCH
    }

    private final Kind kind;

    public StructureValidationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
