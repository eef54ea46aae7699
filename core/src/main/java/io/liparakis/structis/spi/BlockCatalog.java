package io.liparakis.structis.spi;

import com.google.gson.JsonObject;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Port to the host's block catalog.
 * <p>
 * The structure core never interprets block semantics itself. Everything it
 * needs to know about a block (its canonical identity, whether it carries
 * per-position data, whether it is a liquid, how it turns) is asked through
 * this interface, which the host application implements.
 *
 * @param <B> The runtime block type
 */
public interface BlockCatalog<B> {

    /** Gets the canonical name and state properties of the block. */
    BlockIdentity encodeIdentity(B block);

    /**
     * Gets the block for the given name and properties, or {@code null} if the
     * catalog does not know it.
     */
    @Nullable
    B resolve(String name, Map<String, Object> properties);

    /** Gets the schema version new palette entries are written with. */
    int currentSchemaVersion();

    /** Gets the identity used to fill freshly allocated structures. */
    default BlockIdentity airIdentity() {
        return BlockIdentity.of("minecraft:air");
    }

    /**
     * Migrates an identity written under an older schema version to the
     * current scheme. Called before every resolution.
     */
    default BlockIdentity upgrade(BlockIdentity identity, int schemaVersion) {
        return identity;
    }

    /** Checks if the block carries per-position data (e.g. container contents). */
    default boolean hasAuxiliaryPayload(B block) {
        return false;
    }

    /** Encodes the per-position data of the block. */
    default JsonObject encodeAuxiliaryPayload(B block) {
        return new JsonObject();
    }

    /** Returns the block with per-position data decoded from the payload merged in. */
    default B decodeAuxiliaryPayload(B block, JsonObject payload) {
        return block;
    }

    /** Checks if the block implements liquid semantics. */
    default boolean isLiquid(B block) {
        return false;
    }

    /**
     * Returns the block turned by a quarter turn. Blocks implementing
     * {@link Rotatable} are rotated through it; all others are returned as is.
     */
    @SuppressWarnings("unchecked")
    default B rotate(B block, Rotation rotation) {
        if (block instanceof Rotatable<?> rotatable) {
            return (B) rotatable.rotate(rotation);
        }
        return block;
    }
}
