package io.liparakis.structis.storage.codec;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import io.liparakis.structis.Structis;
import io.liparakis.structis.core.Palette;
import io.liparakis.structis.core.PaletteEntry;
import io.liparakis.structis.core.StructureDocument;
import io.liparakis.structis.core.VoxelGrid;
import io.liparakis.structis.spi.BlockCatalog;
import io.liparakis.structis.storage.StructureDecodeException;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.liparakis.structis.storage.StructureConstants.*;

/**
 * Maps structure documents to and from the tagged tree they are stored as.
 * <p>
 * Tree layout:
 *
 * <pre>
 * format_version: int
 * size: [int, int, int]
 * structure_world_origin: [int, int, int]
 * structure:
 *   block_indices: [[int...], [int...]]
 *   entities: [{...}]
 *   palette:
 *     &lt;name&gt;:
 *       block_palette: [{name: string, states: {...}, version: int}]
 *       block_position_data: {&lt;offset&gt;: {block_entity_data: {...}}}
 * </pre>
 *
 * @param <B> The runtime block type
 */
public final class StructureCodec<B> {

    private final BlockCatalog<B> catalog;

    /**
     * Constructs a new StructureCodec resolving blocks through the given catalog.
     */
    public StructureCodec(BlockCatalog<B> catalog) {
        this.catalog = catalog;
    }

    // ==================== Decoding ====================

    /**
     * Decodes a tree into a validated structure with the default palette active.
     *
     * @param tree the root compound
     * @return the decoded structure
     * @throws StructureDecodeException if the tree is malformed or the structure
     *                                  is invalid
     */
    public StructureDocument<B> decode(JsonObject tree) throws StructureDecodeException {
        return decode(tree, DEFAULT_PALETTE);
    }

    /**
     * Decodes a tree into a validated structure with the named palette active.
     *
     * @throws StructureDecodeException if the tree is malformed, the structure
     *                                  is invalid or it has no palette of that
     *                                  name
     */
    public StructureDocument<B> decode(JsonObject tree, String paletteName) throws StructureDecodeException {
        if (tree == null) {
            throw new StructureDecodeException("Structure tree is null");
        }

        int formatVersion = readInt(require(tree, TAG_FORMAT_VERSION, ""), TAG_FORMAT_VERSION);
        int[] size = readIntArray(require(tree, TAG_SIZE, ""), TAG_SIZE);
        int[] origin = readIntArray(require(tree, TAG_WORLD_ORIGIN, ""), TAG_WORLD_ORIGIN);
        JsonObject structure = readObject(require(tree, TAG_STRUCTURE, ""), TAG_STRUCTURE);

        String path = TAG_STRUCTURE + "." + TAG_BLOCK_INDICES;
        JsonArray indices = readArray(require(structure, TAG_BLOCK_INDICES, TAG_STRUCTURE), path);
        List<int[]> layers = new ArrayList<>(indices.size());
        for (int i = 0; i < indices.size(); i++) {
            layers.add(readIntArray(indices.get(i), path + "[" + i + "]"));
        }

        List<JsonObject> entities = decodeEntities(structure.get(TAG_ENTITIES));
        Map<String, Palette<B>> palettes = decodePalettes(structure.get(TAG_PALETTE));

        StructureDocument<B> document = StructureDocument.restore(catalog, formatVersion, size, origin, palettes,
                entities, layers, paletteName);

        Structis.LOGGER.debug("Decoded {}x{}x{} structure with {} layer(s), {} palette(s) and {} entities",
                size[0], size[1], size[2], layers.size(), palettes.size(), entities.size());
        return document;
    }

    private List<JsonObject> decodeEntities(JsonElement element) throws StructureDecodeException {
        String path = TAG_STRUCTURE + "." + TAG_ENTITIES;
        if (element == null || element.isJsonNull()) {
            return new ArrayList<>();
        }

        JsonArray array = readArray(element, path);
        List<JsonObject> entities = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            entities.add(readObject(array.get(i), path + "[" + i + "]").deepCopy());
        }
        return entities;
    }

    private Map<String, Palette<B>> decodePalettes(JsonElement element) throws StructureDecodeException {
        Map<String, Palette<B>> palettes = new LinkedHashMap<>();
        if (element == null || element.isJsonNull()) {
            return palettes;
        }

        String path = TAG_STRUCTURE + "." + TAG_PALETTE;
        for (Map.Entry<String, JsonElement> entry : readObject(element, path).entrySet()) {
            String palettePath = path + "." + entry.getKey();
            palettes.put(entry.getKey(), decodePalette(readObject(entry.getValue(), palettePath), palettePath));
        }
        return palettes;
    }

    private Palette<B> decodePalette(JsonObject object, String path) throws StructureDecodeException {
        Palette<B> palette = new Palette<>();

        JsonElement blocks = object.get(TAG_BLOCK_PALETTE);
        if (blocks != null && !blocks.isJsonNull()) {
            String blocksPath = path + "." + TAG_BLOCK_PALETTE;
            JsonArray array = readArray(blocks, blocksPath);
            for (int i = 0; i < array.size(); i++) {
                palette.insert(decodeEntry(readObject(array.get(i), blocksPath + "[" + i + "]"),
                        blocksPath + "[" + i + "]"));
            }
        }

        JsonElement positionData = object.get(TAG_BLOCK_POSITION_DATA);
        if (positionData != null && !positionData.isJsonNull()) {
            String dataPath = path + "." + TAG_BLOCK_POSITION_DATA;
            for (Map.Entry<String, JsonElement> entry : readObject(positionData, dataPath).entrySet()) {
                String entryPath = dataPath + "." + entry.getKey();
                int offset = parseOffset(entry.getKey(), entryPath);
                JsonElement data = readObject(entry.getValue(), entryPath).get(TAG_BLOCK_ENTITY_DATA);
                if (data == null || data.isJsonNull()) {
                    Structis.LOGGER.warn("Skipping position data at {} without {}", entryPath, TAG_BLOCK_ENTITY_DATA);
                    continue;
                }
                palette.putPayload(offset, readObject(data, entryPath + "." + TAG_BLOCK_ENTITY_DATA));
            }
        }
        return palette;
    }

    private static PaletteEntry decodeEntry(JsonObject object, String path) throws StructureDecodeException {
        String name = readString(require(object, TAG_NAME, path), path + "." + TAG_NAME);

        Map<String, Object> states = new LinkedHashMap<>();
        JsonElement statesElement = object.get(TAG_STATES);
        if (statesElement != null && !statesElement.isJsonNull()) {
            String statesPath = path + "." + TAG_STATES;
            for (Map.Entry<String, JsonElement> state : readObject(statesElement, statesPath).entrySet()) {
                states.put(state.getKey(), readScalar(state.getValue(), statesPath + "." + state.getKey()));
            }
        }

        JsonElement versionElement = object.get(TAG_VERSION);
        int version = versionElement == null || versionElement.isJsonNull()
                ? 0
                : readInt(versionElement, path + "." + TAG_VERSION);
        return new PaletteEntry(name, states, version);
    }

    private static int parseOffset(String key, String path) throws StructureDecodeException {
        try {
            return Integer.parseInt(key);
        } catch (NumberFormatException e) {
            throw new StructureDecodeException("Position key at " + path + " is not a decimal offset", e);
        }
    }

    // ==================== Encoding ====================

    /**
     * Encodes a structure into a tree. All palettes are written, the active one
     * under its current name.
     *
     * @param document the structure to encode
     * @return the root compound
     */
    public JsonObject encode(StructureDocument<B> document) {
        JsonObject tree = new JsonObject();
        tree.addProperty(TAG_FORMAT_VERSION, document.getFormatVersion());
        tree.add(TAG_SIZE, encodeIntArray(document.getDimensions()));
        tree.add(TAG_WORLD_ORIGIN, encodeIntArray(document.getOrigin()));

        JsonObject structure = new JsonObject();
        JsonArray indices = new JsonArray();
        VoxelGrid grid = document.getGrid();
        for (int i = 0; i < grid.getLayerCount(); i++) {
            indices.add(encodeIntArray(grid.getLayer(i)));
        }
        structure.add(TAG_BLOCK_INDICES, indices);

        JsonArray entities = new JsonArray();
        for (JsonObject entity : document.getEntities()) {
            entities.add(entity.deepCopy());
        }
        structure.add(TAG_ENTITIES, entities);

        JsonObject palettes = new JsonObject();
        for (Map.Entry<String, Palette<B>> entry : document.getPalettes().entrySet()) {
            palettes.add(entry.getKey(), encodePalette(entry.getValue()));
        }
        structure.add(TAG_PALETTE, palettes);
        tree.add(TAG_STRUCTURE, structure);

        Structis.LOGGER.debug("Encoded structure with {} palette(s), active '{}'",
                document.getPalettes().size(), document.getActivePaletteName());
        return tree;
    }

    private static JsonObject encodePalette(Palette<?> palette) {
        JsonArray blocks = new JsonArray();
        for (PaletteEntry entry : palette.getEntries()) {
            JsonObject block = new JsonObject();
            block.addProperty(TAG_NAME, entry.name());
            JsonObject states = new JsonObject();
            for (Map.Entry<String, Object> state : entry.properties().entrySet()) {
                states.add(state.getKey(), encodeScalar(state.getValue()));
            }
            block.add(TAG_STATES, states);
            block.addProperty(TAG_VERSION, entry.schemaVersion());
            blocks.add(block);
        }

        JsonObject positionData = new JsonObject();
        for (Int2ObjectMap.Entry<JsonObject> entry : palette.getPositionPayloads().int2ObjectEntrySet()) {
            JsonObject data = new JsonObject();
            data.add(TAG_BLOCK_ENTITY_DATA, entry.getValue().deepCopy());
            positionData.add(Integer.toString(entry.getIntKey()), data);
        }

        JsonObject object = new JsonObject();
        object.add(TAG_BLOCK_PALETTE, blocks);
        object.add(TAG_BLOCK_POSITION_DATA, positionData);
        return object;
    }

    private static JsonArray encodeIntArray(int[] values) {
        JsonArray array = new JsonArray(values.length);
        for (int value : values) {
            array.add(value);
        }
        return array;
    }

    private static JsonPrimitive encodeScalar(Object value) {
        if (value instanceof Boolean bool) {
            return new JsonPrimitive(bool);
        }
        if (value instanceof Number number) {
            return new JsonPrimitive(number);
        }
        return new JsonPrimitive(value.toString());
    }

    // ==================== Tree Access ====================

    private static JsonElement require(JsonObject object, String key, String parent) throws StructureDecodeException {
        JsonElement element = object.get(key);
        if (element == null || element.isJsonNull()) {
            throw new StructureDecodeException(
                    "Missing required field " + (parent.isEmpty() ? key : parent + "." + key));
        }
        return element;
    }

    private static JsonObject readObject(JsonElement element, String path) throws StructureDecodeException {
        if (element == null || !element.isJsonObject()) {
            throw new StructureDecodeException("Expected a compound at " + path);
        }
        return element.getAsJsonObject();
    }

    private static JsonArray readArray(JsonElement element, String path) throws StructureDecodeException {
        if (element == null || !element.isJsonArray()) {
            throw new StructureDecodeException("Expected a list at " + path);
        }
        return element.getAsJsonArray();
    }

    private static String readString(JsonElement element, String path) throws StructureDecodeException {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new StructureDecodeException("Expected a string at " + path);
        }
        return element.getAsString();
    }

    private static int readInt(JsonElement element, String path) throws StructureDecodeException {
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new StructureDecodeException("Expected an int at " + path);
        }

        BigDecimal value = element.getAsBigDecimal();
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new StructureDecodeException("Value " + value + " at " + path + " is not a 32-bit int", e);
        }
    }

    private static int[] readIntArray(JsonElement element, String path) throws StructureDecodeException {
        JsonArray array = readArray(element, path);
        int[] values = new int[array.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = readInt(array.get(i), path + "[" + i + "]");
        }
        return values;
    }

    private static Object readScalar(JsonElement element, String path) throws StructureDecodeException {
        if (element == null || !element.isJsonPrimitive()) {
            throw new StructureDecodeException("Expected a scalar state value at " + path);
        }

        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            return PaletteEntry.normalizeValue(primitive.getAsNumber());
        }
        return primitive.getAsString();
    }
}
