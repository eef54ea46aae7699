package io.liparakis.structis.core;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Parallel flat index layers over a 3-D extent.
 * <p>
 * Cells are laid out with Z varying fastest, then Y, then X:
 * {@code offset = x * (sizeY * sizeZ) + y * sizeZ + z}. This order is part of
 * the file format and must not change.
 * <p>
 * Layer 0 holds block pointers, the optional layer 1 holds liquid pointers for
 * positions where a liquid shares the cell with a block. Every coordinate is
 * bounds-checked.
 */
public final class VoxelGrid {
    private final int sizeX;
    private final int sizeY;
    private final int sizeZ;
    private final int[][] layers;

    /**
     * Allocates a grid with zero-filled layers.
     *
     * @throws IllegalArgumentException if a size is negative, the volume does not
     *                                  fit in an int or there are no layers
     */
    public VoxelGrid(int sizeX, int sizeY, int sizeZ, int layerCount) {
        this(sizeX, sizeY, sizeZ, layerCount, null);
    }

    /**
     * Wraps existing layers. The arrays are used directly, not copied.
     *
     * @throws IllegalArgumentException if a layer's length differs from the volume
     */
    public VoxelGrid(int sizeX, int sizeY, int sizeZ, List<int[]> layers) {
        this(sizeX, sizeY, sizeZ, layers.size(), layers);
    }

    private VoxelGrid(int sizeX, int sizeY, int sizeZ, int layerCount, List<int[]> existing) {
        if (sizeX < 0 || sizeY < 0 || sizeZ < 0) {
            throw new IllegalArgumentException(
                    String.format("Grid size must not be negative: %dx%dx%d", sizeX, sizeY, sizeZ));
        }
        if (layerCount < 1) {
            throw new IllegalArgumentException("Grid must have at least one layer");
        }

        long cells = (long) sizeX * sizeY * sizeZ;
        if (cells > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                    String.format("Grid volume too large: %dx%dx%d", sizeX, sizeY, sizeZ));
        }

        int volume = (int) cells;
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.sizeZ = sizeZ;
        this.layers = new int[layerCount][];

        for (int i = 0; i < layerCount; i++) {
            if (existing == null) {
                layers[i] = new int[volume];
                continue;
            }

            int[] layer = Objects.requireNonNull(existing.get(i), "layer");
            if (layer.length != volume) {
                throw new IllegalArgumentException(String.format(
                        "Layer %d has %d cells, expected %d", i, layer.length, volume));
            }
            layers[i] = layer;
        }
    }

    /**
     * Computes the linear offset of a cell.
     *
     * @throws IndexOutOfBoundsException if the coordinates are outside the grid
     */
    public int offset(int x, int y, int z) {
        if (!contains(x, y, z)) {
            throw new IndexOutOfBoundsException(String.format(
                    "Position (%d, %d, %d) outside grid of size %dx%dx%d", x, y, z, sizeX, sizeY, sizeZ));
        }
        return (x * sizeY * sizeZ) + (y * sizeZ) + z;
    }

    /** Checks whether the coordinates lie inside the grid. */
    public boolean contains(int x, int y, int z) {
        return x >= 0 && x < sizeX
                && y >= 0 && y < sizeY
                && z >= 0 && z < sizeZ;
    }

    /**
     * Reads a cell by its coordinates.
     *
     * @throws IndexOutOfBoundsException if the layer or position is out of range
     */
    public int read(int layer, int x, int y, int z) {
        return layer(layer)[offset(x, y, z)];
    }

    /**
     * Reads a cell by its linear offset.
     *
     * @throws IndexOutOfBoundsException if the layer or offset is out of range
     */
    public int read(int layer, int offset) {
        int[] cells = layer(layer);
        return cells[Objects.checkIndex(offset, cells.length)];
    }

    /**
     * Writes a cell by its coordinates.
     *
     * @throws IndexOutOfBoundsException if the layer or position is out of range
     */
    public void write(int layer, int x, int y, int z, int value) {
        layer(layer)[offset(x, y, z)] = value;
    }

    /**
     * Writes a cell by its linear offset.
     *
     * @throws IndexOutOfBoundsException if the layer or offset is out of range
     */
    public void write(int layer, int offset, int value) {
        int[] cells = layer(layer);
        cells[Objects.checkIndex(offset, cells.length)] = value;
    }

    /** Sets every cell of a layer to the same value. */
    public void fill(int layer, int value) {
        Arrays.fill(layer(layer), value);
    }

    private int[] layer(int layer) {
        return layers[Objects.checkIndex(layer, layers.length)];
    }

    /**
     * Returns the internal array of a layer.
     * <p>
     * <b>Warning:</b> the array is returned without copying for serialization;
     * callers must treat it as read-only.
     */
    public int[] getLayer(int layer) {
        return layer(layer);
    }

    /** Gets the number of parallel layers. */
    public int getLayerCount() {
        return layers.length;
    }

    /** Checks whether a layer index exists. */
    public boolean hasLayer(int layer) {
        return layer >= 0 && layer < layers.length;
    }

    /** Gets the extent along X. */
    public int getSizeX() {
        return sizeX;
    }

    /** Gets the extent along Y. */
    public int getSizeY() {
        return sizeY;
    }

    /** Gets the extent along Z. */
    public int getSizeZ() {
        return sizeZ;
    }

    /** Gets the number of cells in each layer. */
    public int volume() {
        return sizeX * sizeY * sizeZ;
    }
}
