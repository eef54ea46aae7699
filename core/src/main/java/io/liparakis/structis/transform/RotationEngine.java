package io.liparakis.structis.transform;

import com.google.gson.JsonObject;
import io.liparakis.structis.Structis;
import io.liparakis.structis.core.Palette;
import io.liparakis.structis.core.PaletteEntry;
import io.liparakis.structis.core.StructureDocument;
import io.liparakis.structis.spi.BlockCatalog;
import io.liparakis.structis.spi.Rotation;
import io.liparakis.structis.storage.StructureConstants;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns structures around the vertical axis in quarter turns.
 * <p>
 * Rotation runs in two independent passes:
 * <ol>
 * <li>Every entry of the source's active palette is resolved and turned once
 * through {@link BlockCatalog#rotate}, so facing and axis properties follow the
 * turn.</li>
 * <li>Every cell is copied to its turned coordinate in a new structure whose X
 * and Z sizes are swapped. Y never changes.</li>
 * </ol>
 * The source structure is left unmodified. Only the active palette is carried
 * over; the result has a single {@code default} palette. Entities are not
 * carried over since their positions are opaque.
 * <p>
 * Entries the catalog cannot resolve are copied verbatim, unrotated, along with
 * their per-position data.
 */
public final class RotationEngine {

    /**
     * An active palette entry after the orientation pass.
     *
     * @param entry               The source entry
     * @param block               The turned block, or {@code null} if the entry
     *                            could not be resolved
     * @param hasAuxiliaryPayload Whether the block carries per-position data
     */
    private record TurnedEntry<B>(PaletteEntry entry, B block, boolean hasAuxiliaryPayload) {
    }

    /**
     * Private constructor to prevent instantiation.
     */
    private RotationEngine() {
    }

    /** Returns a copy of the structure turned 90 degrees anti-clockwise. */
    public static <B> StructureDocument<B> rotateLeft(StructureDocument<B> source) {
        return rotate(source, Rotation.LEFT);
    }

    /** Returns a copy of the structure turned 90 degrees clockwise. */
    public static <B> StructureDocument<B> rotateRight(StructureDocument<B> source) {
        return rotate(source, Rotation.RIGHT);
    }

    /**
     * Turns the structure by a number of clockwise quarter turns. Negative
     * values turn anti-clockwise.
     *
     * @return the source itself for a multiple of four turns, otherwise a new
     *         structure
     */
    public static <B> StructureDocument<B> rotate(StructureDocument<B> source, int quarterTurns) {
        switch (Math.floorMod(quarterTurns, 4)) {
            case 1:
                return rotate(source, Rotation.RIGHT);
            case 2:
                return rotate(rotate(source, Rotation.RIGHT), Rotation.RIGHT);
            case 3:
                return rotate(source, Rotation.LEFT);
            default:
                return source;
        }
    }

    /**
     * Returns a copy of the structure turned by one quarter turn.
     */
    public static <B> StructureDocument<B> rotate(StructureDocument<B> source, Rotation rotation) {
        BlockCatalog<B> catalog = source.getCatalog();
        int[] size = source.getDimensions();
        int sizeX = size[0];
        int sizeY = size[1];
        int sizeZ = size[2];

        StructureDocument<B> rotated = new StructureDocument<>(catalog, sizeZ, sizeY, sizeX,
                source.hasLiquidLayer());
        int[] origin = source.getOrigin();
        rotated.setOrigin(origin[0], origin[1], origin[2]);

        Palette<B> palette = source.getActivePalette();
        List<TurnedEntry<B>> turned = turnEntries(palette, catalog, rotation);

        int maxX = sizeX - 1;
        int maxZ = sizeZ - 1;
        for (int x = 0; x < sizeX; x++) {
            for (int y = 0; y < sizeY; y++) {
                for (int z = 0; z < sizeZ; z++) {
                    int newX;
                    int newZ;
                    if (rotation == Rotation.RIGHT) {
                        newX = maxZ - z;
                        newZ = x;
                    } else {
                        newX = z;
                        newZ = maxX - x;
                    }
                    copyBlock(source, rotated, turned, x, y, z, newX, newZ);
                    if (source.hasLiquidLayer()) {
                        copyLiquid(source, rotated, turned, x, y, z, newX, newZ);
                    }
                }
            }
        }

        if (!source.getEntities().isEmpty()) {
            Structis.LOGGER.debug("Dropped {} entities while rotating structure", source.getEntities().size());
        }
        return rotated;
    }

    private static <B> List<TurnedEntry<B>> turnEntries(Palette<B> palette, BlockCatalog<B> catalog,
            Rotation rotation) {
        List<TurnedEntry<B>> turned = new ArrayList<>(palette.size());
        for (int i = 0; i < palette.size(); i++) {
            PaletteEntry entry = palette.getEntry(i);
            Palette.Resolved<B> resolved = palette.getResolved(i);
            if (resolved == null || !resolved.isPresent()) {
                turned.add(new TurnedEntry<>(entry, null, false));
                continue;
            }
            turned.add(new TurnedEntry<>(entry, turn(catalog, resolved.block(), entry, rotation),
                    resolved.hasAuxiliaryPayload()));
        }
        return turned;
    }

    private static <B> B turn(BlockCatalog<B> catalog, B block, PaletteEntry entry, Rotation rotation) {
        try {
            B result = catalog.rotate(block, rotation);
            return result == null ? block : result;
        } catch (RuntimeException e) {
            Structis.LOGGER.warn("Failed to rotate palette entry {}, keeping its orientation", entry.name(), e);
            return block;
        }
    }

    private static <B> void copyBlock(StructureDocument<B> source, StructureDocument<B> rotated,
            List<TurnedEntry<B>> turned, int x, int y, int z, int newX, int newZ) {
        TurnedEntry<B> entry = entryAt(source, turned, StructureConstants.BLOCK_LAYER, x, y, z);
        if (entry == null) {
            rotated.setBlock(newX, y, newZ, null);
            return;
        }

        JsonObject payload = source.getActivePalette().getPayload(source.offset(x, y, z));
        if (entry.block() == null) {
            rotated.setEntry(StructureConstants.BLOCK_LAYER, newX, y, newZ, entry.entry());
            if (payload != null) {
                rotated.getActivePalette().putPayload(rotated.offset(newX, y, newZ), payload);
            }
            return;
        }

        B block = entry.block();
        if (entry.hasAuxiliaryPayload() && payload != null) {
            block = source.getCatalog().decodeAuxiliaryPayload(block, payload);
        }
        rotated.setBlock(newX, y, newZ, block);
    }

    private static <B> void copyLiquid(StructureDocument<B> source, StructureDocument<B> rotated,
            List<TurnedEntry<B>> turned, int x, int y, int z, int newX, int newZ) {
        TurnedEntry<B> entry = entryAt(source, turned, StructureConstants.LIQUID_LAYER, x, y, z);
        if (entry == null) {
            rotated.setLiquid(newX, y, newZ, null);
        } else if (entry.block() == null) {
            rotated.setEntry(StructureConstants.LIQUID_LAYER, newX, y, newZ, entry.entry());
        } else {
            rotated.setLiquid(newX, y, newZ, entry.block());
        }
    }

    /**
     * Gets the turned entry a cell points to, or {@code null} for empty cells
     * and pointers past the end of the palette.
     */
    private static <B> TurnedEntry<B> entryAt(StructureDocument<B> source, List<TurnedEntry<B>> turned,
            int layer, int x, int y, int z) {
        int pointer = source.pointerAt(layer, x, y, z);
        if (pointer < 0 || pointer >= turned.size()) {
            return null;
        }
        return turned.get(pointer);
    }
}
