package io.liparakis.structis.storage;

import java.io.IOException;

/**
 * Thrown when a tagged tree cannot be mapped to a structure document: a
 * required field is missing or a field has the wrong type.
 */
public class StructureDecodeException extends IOException {

    public StructureDecodeException(String message) {
        super(message);
    }

    public StructureDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
