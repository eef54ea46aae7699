package io.liparakis.structis.storage;

/**
 * Central constants for the structure document format.
 * <p>
 * This class provides:
 * - File format constants (version, sentinel values, layer indices)
 * - Tagged tree field names
 */
public final class StructureConstants {

    // ==================== File Format Constants ====================

    /**
     * The only supported structure format version.
     */
    public static final int FORMAT_VERSION = 1;

    /**
     * Palette selected when a structure is read or created.
     */
    public static final String DEFAULT_PALETTE = "default";

    /**
     * Grid cell value meaning "no content here". Distinct from an explicit air
     * entry: a structure placed in a world leaves such positions untouched.
     */
    public static final int EMPTY = -1;

    // ==================== Layers ====================

    /** Primary block layer, always present. */
    public static final int BLOCK_LAYER = 0;

    /** Overlay layer for liquids sharing a position with a block (waterlogging). */
    public static final int LIQUID_LAYER = 1;

    /** Number of layers allocated for new structures. */
    public static final int DEFAULT_LAYER_COUNT = 2;

    // ==================== Tagged Tree Field Names ====================

    public static final String TAG_FORMAT_VERSION = "format_version";
    public static final String TAG_SIZE = "size";
    public static final String TAG_WORLD_ORIGIN = "structure_world_origin";
    public static final String TAG_STRUCTURE = "structure";
    public static final String TAG_BLOCK_INDICES = "block_indices";
    public static final String TAG_ENTITIES = "entities";
    public static final String TAG_PALETTE = "palette";
    public static final String TAG_BLOCK_PALETTE = "block_palette";
    public static final String TAG_BLOCK_POSITION_DATA = "block_position_data";
    public static final String TAG_BLOCK_ENTITY_DATA = "block_entity_data";
    public static final String TAG_NAME = "name";
    public static final String TAG_STATES = "states";
    public static final String TAG_VERSION = "version";

    // ==================== Private Constructor ====================

    /**
     * Private constructor prevents instantiation.
     * This is a utility class with only static members.
     */
    private StructureConstants() {
        throw new AssertionError("StructureConstants is a utility class and should not be instantiated");
    }
}
