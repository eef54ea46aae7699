package io.liparakis.structis.core;

import com.google.gson.JsonObject;
import io.liparakis.structis.Structis;
import io.liparakis.structis.spi.BlockCatalog;
import io.liparakis.structis.spi.BlockIdentity;
import io.liparakis.structis.storage.StructureConstants;
import io.liparakis.structis.storage.StructureDecodeException;
import io.liparakis.structis.storage.StructureValidationException;
import io.liparakis.structis.storage.StructureValidationException.Kind;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory structure: a bounded grid of block pointers, the named palettes
 * they point into and free-form entity data.
 * <p>
 * Exactly one palette is active at a time; all reads and writes go through it.
 * Other palettes are carried along untouched and must keep the same number of
 * entries as the active one to pass {@link #validate()}.
 * <p>
 * Not thread-safe. Callers must serialize all access to one instance.
 *
 * @param <B> The runtime block type
 * @see Palette
 * @see VoxelGrid
 */
public final class StructureDocument<B> {
    private final BlockCatalog<B> catalog;
    private final int formatVersion;
    private final VoxelGrid grid;
    private final int[] origin;

    /** Named palettes in file order; the active palette is always among them */
    private final Map<String, Palette<B>> palettes;

    private List<JsonObject> entities;
    private String activePaletteName;
    private Palette<B> activePalette;

    /**
     * Creates a structure of the given size with a liquid layer, filled with
     * the catalog's air block.
     */
    public StructureDocument(BlockCatalog<B> catalog, int sizeX, int sizeY, int sizeZ) {
        this(catalog, sizeX, sizeY, sizeZ, true);
    }

    /**
     * Creates a structure of the given size filled with the catalog's air block.
     * The liquid layer, if requested, starts out empty.
     *
     * @throws IllegalArgumentException if a size is negative
     */
    public StructureDocument(BlockCatalog<B> catalog, int sizeX, int sizeY, int sizeZ, boolean liquidLayer) {
        this(catalog, StructureConstants.FORMAT_VERSION,
                new VoxelGrid(sizeX, sizeY, sizeZ, liquidLayer ? StructureConstants.DEFAULT_LAYER_COUNT : 1),
                new int[3], new LinkedHashMap<>(), new ArrayList<>());

        usePalette(StructureConstants.DEFAULT_PALETTE);
        int air = activePalette.insert(PaletteEntry.of(catalog.airIdentity(), catalog.currentSchemaVersion()));
        grid.fill(StructureConstants.BLOCK_LAYER, air);
        if (liquidLayer) {
            grid.fill(StructureConstants.LIQUID_LAYER, StructureConstants.EMPTY);
        }
    }

    private StructureDocument(BlockCatalog<B> catalog, int formatVersion, VoxelGrid grid, int[] origin,
            Map<String, Palette<B>> palettes, List<JsonObject> entities) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.formatVersion = formatVersion;
        this.grid = grid;
        this.origin = origin;
        this.palettes = palettes;
        this.entities = entities;
    }

    /**
     * Rebuilds a structure from decoded parts, validating them first.
     * <p>
     * The layer arrays and palettes are taken over, not copied. The named
     * palette is activated.
     *
     * @throws StructureValidationException if the parts violate an invariant
     * @throws StructureDecodeException     if there is no palette of the given
     *                                      name
     */
    public static <B> StructureDocument<B> restore(BlockCatalog<B> catalog, int formatVersion, int[] size,
            int[] origin, Map<String, Palette<B>> palettes, List<JsonObject> entities, List<int[]> layers,
            String paletteName) throws StructureDecodeException {
        Map<String, Palette<B>> named = palettes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(palettes);
        check(formatVersion, size, origin, named, layers);
        if (!named.containsKey(paletteName)) {
            throw new StructureDecodeException(
                    "Structure has no palette '" + paletteName + "' (found " + named.keySet() + ")");
        }

        VoxelGrid grid = new VoxelGrid(size[0], size[1], size[2], layers);
        List<JsonObject> entityList = entities == null ? new ArrayList<>() : new ArrayList<>(entities);
        StructureDocument<B> document = new StructureDocument<>(catalog, formatVersion, grid, origin.clone(),
                named, entityList);

        document.usePalette(paletteName);
        return document;
    }

    // ==================== Validation ====================

    /**
     * Checks the structure against the document invariants, failing on the
     * first violation.
     *
     * @throws StructureValidationException if an invariant does not hold
     */
    public void validate() throws StructureValidationException {
        List<int[]> layers = new ArrayList<>(grid.getLayerCount());
        for (int i = 0; i < grid.getLayerCount(); i++) {
            layers.add(grid.getLayer(i));
        }
        check(formatVersion, getDimensions(), origin, palettes, layers);
    }

    /**
     * Checks decoded structure parts. Order: format version, size, origin,
     * layers present, palettes present, layer lengths, palette lengths.
     *
     * @throws StructureValidationException on the first violated invariant
     */
    public static void check(int formatVersion, int[] size, int[] origin, Map<String, ? extends Palette<?>> palettes,
            List<int[]> layers) throws StructureValidationException {
        if (formatVersion != StructureConstants.FORMAT_VERSION) {
            throw new StructureValidationException(Kind.UNSUPPORTED_VERSION, String.format(
                    "Unsupported format version %d: expected version %d",
                    formatVersion, StructureConstants.FORMAT_VERSION));
        }
        if (size == null || size.length != 3) {
            throw new StructureValidationException(Kind.BAD_EXTENT, String.format(
                    "Structure size must have 3 values, but got %s", Arrays.toString(size)));
        }
        if (size[0] < 0 || size[1] < 0 || size[2] < 0) {
            throw new StructureValidationException(Kind.BAD_EXTENT, String.format(
                    "Structure size must not be negative: %s", Arrays.toString(size)));
        }
        long volume = (long) size[0] * size[1] * size[2];
        if (volume > Integer.MAX_VALUE) {
            throw new StructureValidationException(Kind.BAD_EXTENT, String.format(
                    "Structure size %s is too large", Arrays.toString(size)));
        }
        if (origin == null || origin.length != 3) {
            throw new StructureValidationException(Kind.BAD_ORIGIN, String.format(
                    "Structure origin must have 3 values, but got %s", Arrays.toString(origin)));
        }
        if (layers == null || layers.isEmpty()) {
            throw new StructureValidationException(Kind.NO_LAYERS, "Structure has no blocks in it");
        }
        if (palettes == null || palettes.isEmpty()) {
            throw new StructureValidationException(Kind.NO_PALETTES, "Structure has no palettes in it");
        }
        for (int[] layer : layers) {
            if (layer == null || layer.length != volume) {
                throw new StructureValidationException(Kind.LAYER_SIZE_MISMATCH, String.format(
                        "Structure is %dx%dx%d and should have %d blocks, but got %d",
                        size[0], size[1], size[2], volume, layer == null ? 0 : layer.length));
            }
        }

        int paletteSize = -1;
        for (Palette<?> palette : palettes.values()) {
            if (paletteSize == -1) {
                paletteSize = palette.size();
            } else if (palette.size() != paletteSize) {
                throw new StructureValidationException(Kind.PALETTE_SIZE_MISMATCH, String.format(
                        "All palettes must have the same length, but got one with length %d and one with length %d",
                        paletteSize, palette.size()));
            }
        }
    }

    // ==================== Palettes ====================

    /**
     * Makes the named palette the one all reads and writes go through,
     * creating it empty if it does not exist yet.
     */
    public void usePalette(String name) {
        Objects.requireNonNull(name, "name");
        if (activePalette != null) {
            activePalette.deactivate();
        }

        Palette<B> palette = palettes.computeIfAbsent(name, key -> new Palette<>());
        palette.activate(catalog);
        this.activePalette = palette;
        this.activePaletteName = name;

        Structis.LOGGER.debug("Using structure palette '{}' with {} entries", name, palette.size());
    }

    public String getActivePaletteName() {
        return activePaletteName;
    }

    public Palette<B> getActivePalette() {
        return activePalette;
    }

    /**
     * Gets the palette with the given name.
     *
     * @return the palette, or {@code null} if there is none of that name
     */
    public @Nullable Palette<B> getPalette(String name) {
        return palettes.get(name);
    }

    /** Returns an unmodifiable view of all palettes in file order. */
    public Map<String, Palette<B>> getPalettes() {
        return Collections.unmodifiableMap(palettes);
    }

    // ==================== Writes ====================

    /**
     * Sets both layers of a position. A {@code null} liquid clears the liquid
     * layer.
     *
     * @throws IndexOutOfBoundsException if the position is outside the structure
     * @throws IllegalStateException     if a liquid is given but the structure has
     *                                   no liquid layer
     */
    public void set(int x, int y, int z, B block, B liquid) {
        setBlock(x, y, z, block);
        setLiquid(x, y, z, liquid);
    }

    /**
     * Sets the block at a position. Per-position data of the block is stored
     * with it; a {@code null} block leaves the position empty.
     *
     * @throws IndexOutOfBoundsException if the position is outside the structure
     */
    public void setBlock(int x, int y, int z, B block) {
        int offset = grid.offset(x, y, z);
        if (block == null) {
            grid.write(StructureConstants.BLOCK_LAYER, offset, StructureConstants.EMPTY);
            activePalette.removePayload(offset);
            return;
        }

        grid.write(StructureConstants.BLOCK_LAYER, offset, pointerFor(catalog.encodeIdentity(block)));
        if (catalog.hasAuxiliaryPayload(block)) {
            activePalette.putPayload(offset, catalog.encodeAuxiliaryPayload(block));
        } else {
            activePalette.removePayload(offset);
        }
    }

    /**
     * Sets an additional liquid at a position, so that the block on the
     * primary layer is waterlogged. A {@code null} liquid clears it.
     *
     * @throws IndexOutOfBoundsException if the position is outside the structure
     * @throws IllegalStateException     if a liquid is given but the structure has
     *                                   no liquid layer
     */
    public void setLiquid(int x, int y, int z, B liquid) {
        int offset = grid.offset(x, y, z);
        if (!hasLiquidLayer()) {
            if (liquid != null) {
                throw new IllegalStateException("Structure has no liquid layer");
            }
            return;
        }

        int pointer = liquid == null ? StructureConstants.EMPTY : pointerFor(catalog.encodeIdentity(liquid));
        grid.write(StructureConstants.LIQUID_LAYER, offset, pointer);
    }

    /**
     * Writes a raw palette entry to a layer without resolving it through the
     * catalog. A {@code null} entry leaves the cell empty.
     *
     * @throws IndexOutOfBoundsException if the layer or position is out of range
     */
    public void setEntry(int layer, int x, int y, int z, PaletteEntry entry) {
        int offset = grid.offset(x, y, z);
        int pointer = entry == null ? StructureConstants.EMPTY : activePalette.lookupOrInsert(entry);
        grid.write(layer, offset, pointer);
    }

    private int pointerFor(BlockIdentity identity) {
        int pointer = activePalette.lookup(identity);
        if (pointer == -1) {
            pointer = activePalette.insert(PaletteEntry.of(identity, catalog.currentSchemaVersion()));
        }
        return pointer;
    }

    // ==================== Reads ====================

    /**
     * Gets the block and liquid at a position. Entries the catalog cannot
     * resolve read as absent.
     *
     * @throws IndexOutOfBoundsException if the position is outside the structure
     */
    public StructureCell<B> at(int x, int y, int z) {
        int offset = grid.offset(x, y, z);
        return new StructureCell<>(blockAt(offset), liquidAt(offset));
    }

    /**
     * Gets the block at a position with its per-position data merged in.
     *
     * @return the block, or {@code null} if the position is empty or unresolvable
     */
    public @Nullable B blockAt(int x, int y, int z) {
        return blockAt(grid.offset(x, y, z));
    }

    /**
     * Gets the liquid sharing a position with its block.
     *
     * @return the liquid, or {@code null} if there is none
     */
    public @Nullable B liquidAt(int x, int y, int z) {
        return liquidAt(grid.offset(x, y, z));
    }

    private B blockAt(int offset) {
        Palette.Resolved<B> resolved = resolvedAt(StructureConstants.BLOCK_LAYER, offset);
        if (resolved == null) {
            return null;
        }

        B block = resolved.block();
        if (resolved.hasAuxiliaryPayload()) {
            JsonObject payload = activePalette.getPayload(offset);
            if (payload != null) {
                block = catalog.decodeAuxiliaryPayload(block, payload);
            }
        }
        return block;
    }

    private B liquidAt(int offset) {
        if (!hasLiquidLayer()) {
            return null;
        }

        Palette.Resolved<B> resolved = resolvedAt(StructureConstants.LIQUID_LAYER, offset);
        if (resolved == null || !catalog.isLiquid(resolved.block())) {
            return null;
        }
        return resolved.block();
    }

    private Palette.Resolved<B> resolvedAt(int layer, int offset) {
        int pointer = grid.read(layer, offset);
        if (pointer == StructureConstants.EMPTY) {
            return null;
        }

        Palette.Resolved<B> resolved = activePalette.getResolved(pointer);
        return (resolved == null || !resolved.isPresent()) ? null : resolved;
    }

    /**
     * Gets the raw palette pointer stored in a layer.
     *
     * @throws IndexOutOfBoundsException if the layer or position is out of range
     */
    public int pointerAt(int layer, int x, int y, int z) {
        return grid.read(layer, x, y, z);
    }

    /**
     * Computes the linear grid offset of a position, the key of its
     * per-position data.
     *
     * @throws IndexOutOfBoundsException if the position is outside the structure
     */
    public int offset(int x, int y, int z) {
        return grid.offset(x, y, z);
    }

    // ==================== Properties ====================

    public BlockCatalog<B> getCatalog() {
        return catalog;
    }

    public int getFormatVersion() {
        return formatVersion;
    }

    /** Returns a copy of the size as {@code [sizeX, sizeY, sizeZ]}. */
    public int[] getDimensions() {
        return new int[] { grid.getSizeX(), grid.getSizeY(), grid.getSizeZ() };
    }

    /** Returns a copy of the world origin the structure was saved at. */
    public int[] getOrigin() {
        return origin.clone();
    }

    public void setOrigin(int x, int y, int z) {
        origin[0] = x;
        origin[1] = y;
        origin[2] = z;
    }

    /** Returns the grid. Callers must not write to it directly. */
    public VoxelGrid getGrid() {
        return grid;
    }

    public int getLayerCount() {
        return grid.getLayerCount();
    }

    public boolean hasLiquidLayer() {
        return grid.hasLayer(StructureConstants.LIQUID_LAYER);
    }

    public List<JsonObject> getEntities() {
        return Collections.unmodifiableList(entities);
    }

    /** Replaces the entity data. The given blobs are copied. */
    public void setEntities(List<JsonObject> newEntities) {
        List<JsonObject> copies = new ArrayList<>(newEntities == null ? 0 : newEntities.size());
        if (newEntities != null) {
            for (JsonObject entity : newEntities) {
                copies.add(entity.deepCopy());
            }
        }
        this.entities = copies;
    }
}
