package io.liparakis.structis.core;

import com.google.gson.JsonObject;
import io.liparakis.structis.spi.BlockCatalog;
import io.liparakis.structis.spi.BlockIdentity;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * An append-only table of block identities referenced by index from the grid,
 * plus the per-position payloads attached to cells using this palette.
 * <p>
 * Implementation details:
 * <ul>
 * <li>Indices are assigned sequentially starting from 0 and never change</li>
 * <li>Lookups by identity are a linear scan in insertion order; the first match
 * wins</li>
 * <li>Lookups by index are O(1)</li>
 * <li>While active, every entry has a resolved runtime block cached next to it,
 * so grid reads never go back to the catalog</li>
 * <li>Not thread-safe - external synchronization required for concurrent access</li>
 * </ul>
 *
 * @param <B> The runtime block type
 * @see StructureDocument
 */
public final class Palette<B> {
    /** Initial capacity tuned for typical structure block diversity */
    private static final int INITIAL_CAPACITY = 16;

    /** Sequential list mapping indices to entries (Index → Entry) */
    private final List<PaletteEntry> entries = new ArrayList<>(INITIAL_CAPACITY);

    /** Per-position payloads keyed by linear grid offset */
    private final Int2ObjectMap<JsonObject> positionPayloads = new Int2ObjectOpenHashMap<>();

    /** Resolved blocks, parallel to {@link #entries} while active */
    private final List<Resolved<B>> resolved = new ArrayList<>(INITIAL_CAPACITY);

    /** Catalog used for resolution, non-null while active */
    private BlockCatalog<B> catalog;

    /**
     * A palette entry resolved against the catalog.
     *
     * @param block               The runtime block, or {@code null} if the catalog
     *                            does not know the entry
     * @param hasAuxiliaryPayload Whether the block carries per-position data
     */
    public record Resolved<B>(B block, boolean hasAuxiliaryPayload) {

        public boolean isPresent() {
            return block != null;
        }
    }

    // ==================== Entries ====================

    /**
     * Finds the index of the entry with the given name and properties.
     *
     * @return the index of the first matching entry, or {@code -1} if none matches
     */
    public int lookup(String name, Map<String, ?> properties) {
        Map<String, Object> normalized = PaletteEntry.normalizeProperties(properties);
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).matches(name, normalized)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Finds the index of the entry with the identity's name and properties.
     *
     * @return the index of the first matching entry, or {@code -1} if none matches
     */
    public int lookup(BlockIdentity identity) {
        return lookup(identity.name(), identity.properties());
    }

    /**
     * Appends a new entry and, if the palette is active, resolves it right away.
     * No deduplication is done; use {@link #lookup} first.
     *
     * @return the index of the new entry
     */
    public int insert(String name, Map<String, ?> properties, int schemaVersion) {
        return insert(new PaletteEntry(name, PaletteEntry.normalizeProperties(properties), schemaVersion));
    }

    /**
     * Appends an already normalized entry and, if the palette is active,
     * resolves it right away.
     *
     * @return the index of the new entry
     */
    public int insert(PaletteEntry entry) {
        int index = entries.size();
        entries.add(entry);
        if (catalog != null) {
            resolved.add(resolve(entry, catalog));
        }
        return index;
    }

    /**
     * Returns the index of the entry matching the given one's name and
     * properties, inserting it if absent.
     */
    public int lookupOrInsert(PaletteEntry entry) {
        int index = lookup(entry.name(), entry.properties());
        return index != -1 ? index : insert(entry);
    }

    /**
     * Retrieves the entry at the given index.
     *
     * @return the entry, or {@code null} if the index is out of range
     */
    public @Nullable PaletteEntry getEntry(int index) {
        return (index >= 0 && index < entries.size()) ? entries.get(index) : null;
    }

    /** Returns an unmodifiable view of all entries in index order. */
    public List<PaletteEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    /** Gets the number of entries. */
    public int size() {
        return entries.size();
    }

    // ==================== Resolution ====================

    /**
     * Resolves an entry against the catalog, upgrading it from its schema
     * version first.
     */
    public static <B> Resolved<B> resolve(PaletteEntry entry, BlockCatalog<B> catalog) {
        BlockIdentity identity = catalog.upgrade(entry.identity(), entry.schemaVersion());
        B block = catalog.resolve(identity.name(), identity.properties());
        if (block == null) {
            return new Resolved<>(null, false);
        }
        return new Resolved<>(block, catalog.hasAuxiliaryPayload(block));
    }

    /**
     * Marks this palette as the one in use and rebuilds the resolution cache.
     */
    public void activate(BlockCatalog<B> catalog) {
        this.catalog = catalog;
        resolved.clear();
        for (PaletteEntry entry : entries) {
            resolved.add(resolve(entry, catalog));
        }
    }

    /** Drops the resolution cache. */
    public void deactivate() {
        this.catalog = null;
        resolved.clear();
    }

    /** Checks whether the palette currently holds a resolution cache. */
    public boolean isActive() {
        return catalog != null;
    }

    /**
     * Gets the cached resolution of the entry at the given index.
     * <p>
     * Requires the palette to be active. Out of range indices return
     * {@code null}, the same as an entry that pointed nowhere.
     *
     * @throws IllegalStateException if the palette is not active
     */
    public @Nullable Resolved<B> getResolved(int index) {
        if (catalog == null) {
            throw new IllegalStateException("Palette is not active");
        }
        return (index >= 0 && index < resolved.size()) ? resolved.get(index) : null;
    }

    // ==================== Position Payloads ====================

    /**
     * Gets a copy of the payload stored for a grid offset.
     *
     * @return the payload, or {@code null} if the offset has none
     */
    public @Nullable JsonObject getPayload(int offset) {
        JsonObject payload = positionPayloads.get(offset);
        return payload == null ? null : payload.deepCopy();
    }

    /**
     * Stores a copy of the payload for a grid offset, replacing any previous one.
     */
    public void putPayload(int offset, JsonObject payload) {
        positionPayloads.put(offset, payload.deepCopy());
    }

    /** Drops the payload stored for a grid offset, if any. */
    public void removePayload(int offset) {
        positionPayloads.remove(offset);
    }

    /**
     * Returns an unmodifiable view of the payloads keyed by grid offset.
     * <p>
     * The payloads themselves are not copied; callers must not modify them.
     */
    public Int2ObjectMap<JsonObject> getPositionPayloads() {
        return Int2ObjectMaps.unmodifiable(positionPayloads);
    }
}
