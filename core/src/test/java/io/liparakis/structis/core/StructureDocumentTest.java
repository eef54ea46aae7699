package io.liparakis.structis.core;

import com.google.gson.JsonObject;
import io.liparakis.structis.TestBlock;
import io.liparakis.structis.TestCatalog;
import io.liparakis.structis.storage.StructureConstants;
import io.liparakis.structis.storage.StructureDecodeException;
import io.liparakis.structis.storage.StructureValidationException;
import io.liparakis.structis.storage.StructureValidationException.Kind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StructureDocumentTest {

    private TestCatalog catalog;

    @Spy
    private TestCatalog spyCatalog;

    @BeforeEach
    void setUp() {
        catalog = new TestCatalog();
    }

    // ========== Construction ==========

    @Test
    void newDocument_isFilledWithAirAndNoLiquid() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 1, 1, 1);

        StructureCell<TestBlock> cell = document.at(0, 0, 0);

        assertThat(cell.block()).isEqualTo(TestCatalog.AIR);
        assertThat(cell.liquid()).isNull();
        assertThat(document.getActivePaletteName()).isEqualTo(StructureConstants.DEFAULT_PALETTE);
        assertThat(document.getActivePalette().size()).isEqualTo(1);
        assertThat(document.getActivePalette().getEntry(0).schemaVersion()).isEqualTo(TestCatalog.CURRENT_VERSION);
        assertThat(document.getLayerCount()).isEqualTo(2);
        assertThat(document.getOrigin()).containsExactly(0, 0, 0);
    }

    @Test
    void newDocument_passesValidation() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 3, 2, 4);

        assertThatCode(document::validate).doesNotThrowAnyException();
        assertThat(document.getDimensions()).containsExactly(3, 2, 4);
    }

    @Test
    void newDocument_withoutLiquidLayer_hasOneLayer() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 2, 2, 2, false);

        assertThat(document.hasLiquidLayer()).isFalse();
        assertThat(document.liquidAt(1, 1, 1)).isNull();
    }

    @Test
    void newDocument_negativeSize_throws() {
        assertThatThrownBy(() -> new StructureDocument<>(catalog, -1, 1, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ========== Set / At ==========

    @Test
    void set_blockAndLiquid_readsBack() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 1, 1, 1);

        document.set(0, 0, 0, TestCatalog.STONE, TestCatalog.WATER);

        StructureCell<TestBlock> cell = document.at(0, 0, 0);
        assertThat(cell.block()).isEqualTo(TestCatalog.STONE);
        assertThat(cell.liquid()).isEqualTo(TestCatalog.WATER);
    }

    @Test
    void set_withoutLiquid_clearsLiquidLayer() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 1, 1, 1);
        document.set(0, 0, 0, TestCatalog.STONE, TestCatalog.WATER);

        document.set(0, 0, 0, TestCatalog.STONE, null);

        assertThat(document.at(0, 0, 0).liquid()).isNull();
        assertThat(document.pointerAt(StructureConstants.LIQUID_LAYER, 0, 0, 0))
                .isEqualTo(StructureConstants.EMPTY);
    }

    @Test
    void set_sameBlockTwice_doesNotGrowPalette() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 2, 1, 1);

        document.setBlock(0, 0, 0, TestCatalog.STONE);
        int size = document.getActivePalette().size();
        document.setBlock(1, 0, 0, TestCatalog.STONE);

        assertThat(document.getActivePalette().size()).isEqualTo(size);
        assertThat(document.pointerAt(0, 0, 0, 0)).isEqualTo(document.pointerAt(0, 1, 0, 0));
    }

    @Test
    void set_sameNameDistinctProperties_growsPaletteByOne() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 2, 1, 1);
        TestBlock log = TestBlock.of("minecraft:log").with("axis", "y");
        document.setBlock(0, 0, 0, log);
        int size = document.getActivePalette().size();

        document.setBlock(1, 0, 0, log.with("axis", "x"));

        assertThat(document.getActivePalette().size()).isEqualTo(size + 1);
    }

    @Test
    void set_newEntry_usesCurrentSchemaVersion() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 1, 1, 1);

        document.setBlock(0, 0, 0, TestCatalog.DIRT);

        int pointer = document.pointerAt(StructureConstants.BLOCK_LAYER, 0, 0, 0);
        assertThat(document.getActivePalette().getEntry(pointer))
                .isEqualTo(new PaletteEntry("minecraft:dirt", Map.of(), TestCatalog.CURRENT_VERSION));
    }

    @Test
    void setBlock_null_leavesPositionEmpty() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 1, 1, 1);

        document.setBlock(0, 0, 0, null);

        assertThat(document.at(0, 0, 0).isEmpty()).isTrue();
        assertThat(document.pointerAt(StructureConstants.BLOCK_LAYER, 0, 0, 0))
                .isEqualTo(StructureConstants.EMPTY);
    }

    @Test
    void at_outsideStructure_throws() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 2, 2, 2);

        assertThatThrownBy(() -> document.at(2, 0, 0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> document.setBlock(0, -1, 0, TestCatalog.STONE))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void setLiquid_withoutLiquidLayer_throws() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 1, 1, 1, false);

        assertThatThrownBy(() -> document.setLiquid(0, 0, 0, TestCatalog.WATER))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Structure has no liquid layer");
        assertThatCode(() -> document.set(0, 0, 0, TestCatalog.STONE, null)).doesNotThrowAnyException();
    }

    @Test
    void liquidAt_nonLiquidEntry_readsAsAbsent() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 1, 1, 1);

        document.setLiquid(0, 0, 0, TestCatalog.STONE);

        assertThat(document.liquidAt(0, 0, 0)).isNull();
    }

    @Test
    void unresolvableEntry_readsAsAbsent() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 1, 1, 1);

        document.setEntry(StructureConstants.BLOCK_LAYER, 0, 0, 0, new PaletteEntry("unknown:thing", Map.of(), 1));
        document.setEntry(StructureConstants.LIQUID_LAYER, 0, 0, 0, new PaletteEntry("unknown:goo", Map.of(), 1));

        assertThat(document.at(0, 0, 0).isEmpty()).isTrue();
        assertThat(document.getActivePalette().size()).isEqualTo(3);
    }

    // ========== Position Payloads ==========

    @Test
    void payload_survivesSetAtCycle() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 2, 2, 2);
        TestBlock chest = TestCatalog.CHEST.withPayload(TestCatalog.chestPayload("minecraft:diamond"));

        document.setBlock(1, 0, 1, chest);

        assertThat(document.blockAt(1, 0, 1)).isEqualTo(chest);
        assertThat(document.getActivePalette().getPayload(document.offset(1, 0, 1)))
                .isEqualTo(TestCatalog.chestPayload("minecraft:diamond"));
    }

    @Test
    void payload_readBack_isIsolatedFromStoredCopy() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 1, 1, 1);
        document.setBlock(0, 0, 0, TestCatalog.CHEST.withPayload(TestCatalog.chestPayload("minecraft:apple")));

        document.blockAt(0, 0, 0).payload().addProperty("Item", "minecraft:stick");

        assertThat(document.blockAt(0, 0, 0).payload()).isEqualTo(TestCatalog.chestPayload("minecraft:apple"));
    }

    @Test
    void payload_missingForPayloadBlock_returnsPlainBlock() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 1, 1, 1);
        document.setBlock(0, 0, 0, TestCatalog.CHEST);
        document.getActivePalette().removePayload(0);

        assertThat(document.blockAt(0, 0, 0)).isEqualTo(TestCatalog.CHEST);
    }

    @Test
    void payload_blockWithoutPayload_isSkipped() {
        StructureDocument<TestBlock> document = new StructureDocument<>(spyCatalog, 1, 1, 1);

        document.setBlock(0, 0, 0, TestCatalog.STONE);

        assertThat(document.blockAt(0, 0, 0)).isEqualTo(TestCatalog.STONE);
        assertThat(document.getActivePalette().getPositionPayloads()).isEmpty();
        verify(spyCatalog, never()).encodeAuxiliaryPayload(any());
        verify(spyCatalog, never()).decodeAuxiliaryPayload(any(), any());
    }

    @Test
    void payload_storedCopy_isIsolatedFromCatalogAndReaders() {
        JsonObject encoded = TestCatalog.chestPayload("minecraft:apple");
        doReturn(encoded).when(spyCatalog).encodeAuxiliaryPayload(TestCatalog.CHEST);
        StructureDocument<TestBlock> document = new StructureDocument<>(spyCatalog, 1, 1, 1);

        document.setBlock(0, 0, 0, TestCatalog.CHEST);
        encoded.addProperty("Item", "minecraft:stone");
        document.getActivePalette().getPayload(0).addProperty("Item", "minecraft:dirt");

        assertThat(document.getActivePalette().getPayload(0))
                .isEqualTo(TestCatalog.chestPayload("minecraft:apple"));
        assertThat(document.blockAt(0, 0, 0).payload()).isEqualTo(TestCatalog.chestPayload("minecraft:apple"));
    }

    @Test
    void payload_overwrittenByPlainBlock_isRemoved() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 1, 1, 1);
        document.setBlock(0, 0, 0, TestCatalog.CHEST.withPayload(TestCatalog.chestPayload("minecraft:apple")));

        document.setBlock(0, 0, 0, TestCatalog.DIRT);

        assertThat(document.getActivePalette().getPositionPayloads()).isEmpty();
    }

    // ========== Palettes ==========

    @Test
    void usePalette_newName_createsEmptyPalette() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 1, 1, 1);

        document.usePalette("alternative");

        assertThat(document.getActivePaletteName()).isEqualTo("alternative");
        assertThat(document.getActivePalette().size()).isZero();
        assertThat(document.getPalettes()).containsOnlyKeys("default", "alternative");
        assertThat(document.getPalette("default").isActive()).isFalse();
    }

    @Test
    void usePalette_switchingBack_keepsEntries() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 1, 1, 1);
        document.setBlock(0, 0, 0, TestCatalog.STONE);

        document.usePalette("alternative");
        document.usePalette("default");

        assertThat(document.getActivePalette().size()).isEqualTo(2);
        assertThat(document.blockAt(0, 0, 0)).isEqualTo(TestCatalog.STONE);
    }

    @Test
    void validate_divergingPalettes_fails() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 1, 1, 1);
        document.usePalette("alternative");

        assertKind(document::validate, Kind.PALETTE_SIZE_MISMATCH);
    }

    // ========== Restore / Check ==========

    @Test
    void restore_validParts_activatesNamedPalette() throws Exception {
        Map<String, Palette<TestBlock>> palettes = new LinkedHashMap<>();
        palettes.put("default", paletteOf("minecraft:stone"));
        palettes.put("mirror", paletteOf("minecraft:dirt"));

        StructureDocument<TestBlock> document = StructureDocument.restore(catalog, 1, new int[] { 1, 1, 2 },
                new int[] { 10, 64, -3 }, palettes, List.of(), List.of(new int[] { 0, -1 }), "mirror");

        assertThat(document.getActivePaletteName()).isEqualTo("mirror");
        assertThat(document.blockAt(0, 0, 0)).isEqualTo(TestCatalog.DIRT);
        assertThat(document.blockAt(0, 0, 1)).isNull();
        assertThat(document.getOrigin()).containsExactly(10, 64, -3);
        assertThat(document.hasLiquidLayer()).isFalse();
    }

    @Test
    void restore_unknownPaletteName_throwsWithoutAddingPalette() {
        Map<String, Palette<TestBlock>> palettes = new LinkedHashMap<>();
        palettes.put("night", paletteOf("minecraft:stone"));

        assertThatThrownBy(() -> StructureDocument.restore(catalog, 1, new int[] { 1, 1, 1 }, new int[3],
                palettes, List.of(), List.of(new int[] { 0 }), "default"))
                .isExactlyInstanceOf(StructureDecodeException.class)
                .hasMessageContaining("no palette 'default'");
        assertThat(palettes).containsOnlyKeys("night");
    }

    @Test
    void restore_pointerPastPalette_readsAsAbsent() throws Exception {
        Map<String, Palette<TestBlock>> palettes = Map.of("default", paletteOf("minecraft:stone"));

        StructureDocument<TestBlock> document = StructureDocument.restore(catalog, 1, new int[] { 1, 1, 1 },
                new int[3], palettes, null, List.of(new int[] { 5 }), "default");

        assertThat(document.blockAt(0, 0, 0)).isNull();
    }

    @Test
    void check_unsupportedVersion() {
        assertKind(() -> checkParts(2, new int[] { 1, 1, 1 }, new int[3], 1, List.of(new int[1])),
                Kind.UNSUPPORTED_VERSION);
    }

    @Test
    void check_badExtent() {
        assertKind(() -> checkParts(1, new int[] { 1, 1 }, new int[3], 1, List.of(new int[1])),
                Kind.BAD_EXTENT);
        assertKind(() -> checkParts(1, new int[] { 1, -1, 1 }, new int[3], 1, List.of(new int[1])),
                Kind.BAD_EXTENT);
    }

    @Test
    void check_badOrigin() {
        assertKind(() -> checkParts(1, new int[] { 1, 1, 1 }, new int[4], 1, List.of(new int[1])),
                Kind.BAD_ORIGIN);
    }

    @Test
    void check_noLayers() {
        assertKind(() -> checkParts(1, new int[] { 1, 1, 1 }, new int[3], 1, List.of()), Kind.NO_LAYERS);
    }

    @Test
    void check_noPalettes() {
        assertKind(() -> StructureDocument.check(1, new int[] { 1, 1, 1 }, new int[3], Map.of(),
                List.of(new int[1])), Kind.NO_PALETTES);
    }

    @Test
    void check_layerSizeMismatch() {
        assertKind(() -> checkParts(1, new int[] { 2, 1, 1 }, new int[3], 1, List.of(new int[2], new int[1])),
                Kind.LAYER_SIZE_MISMATCH);
    }

    @Test
    void check_paletteSizeMismatch() {
        Map<String, Palette<TestBlock>> palettes = new LinkedHashMap<>();
        palettes.put("default", paletteOf("minecraft:stone"));
        palettes.put("mirror", paletteOf("minecraft:stone", "minecraft:dirt"));

        assertKind(() -> StructureDocument.check(1, new int[] { 1, 1, 1 }, new int[3], palettes,
                List.of(new int[1])), Kind.PALETTE_SIZE_MISMATCH);
    }

    @Test
    void check_failsOnFirstViolation() {
        assertKind(() -> StructureDocument.check(3, new int[2], new int[2], Map.of(), List.of()),
                Kind.UNSUPPORTED_VERSION);
    }

    // ========== Entities / Origin ==========

    @Test
    void setEntities_copiesBlobs() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 1, 1, 1);
        JsonObject entity = new JsonObject();
        entity.addProperty("identifier", "minecraft:pig");
        List<JsonObject> entities = new ArrayList<>(List.of(entity));

        document.setEntities(entities);
        entity.addProperty("identifier", "minecraft:cow");
        entities.clear();

        assertThat(document.getEntities()).hasSize(1);
        assertThat(document.getEntities().get(0).get("identifier").getAsString()).isEqualTo("minecraft:pig");
    }

    @Test
    void setOrigin_updatesOrigin() {
        StructureDocument<TestBlock> document = new StructureDocument<>(catalog, 1, 1, 1);

        document.setOrigin(4, -60, 12);

        assertThat(document.getOrigin()).containsExactly(4, -60, 12);
    }

    // ========== Helpers ==========

    private static Palette<TestBlock> paletteOf(String... names) {
        Palette<TestBlock> palette = new Palette<>();
        for (String name : names) {
            palette.insert(name, Map.of(), TestCatalog.CURRENT_VERSION);
        }
        return palette;
    }

    private static void checkParts(int version, int[] size, int[] origin, int paletteCount, List<int[]> layers)
            throws StructureValidationException {
        Map<String, Palette<TestBlock>> palettes = new LinkedHashMap<>();
        for (int i = 0; i < paletteCount; i++) {
            palettes.put("palette" + i, paletteOf("minecraft:stone"));
        }
        StructureDocument.check(version, size, origin, palettes, layers);
    }

    private interface Check {
        void run() throws StructureValidationException;
    }

    private static void assertKind(Check check, Kind kind) {
        assertThatThrownBy(check::run)
                .isInstanceOfSatisfying(StructureValidationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(kind));
    }
}
