package io.liparakis.structis.storage;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.liparakis.structis.core.StructureDocument;
import io.liparakis.structis.spi.BlockCatalog;
import io.liparakis.structis.storage.codec.StructureCodec;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes structure documents as serialized tagged trees.
 * <p>
 * Reading always selects the {@link StructureConstants#DEFAULT_PALETTE default}
 * palette; use {@link StructureDocument#usePalette(String)} to switch.
 */
public final class StructureFiles {
    private static final Gson GSON = new Gson();

    /**
     * Private constructor to prevent instantiation.
     */
    private StructureFiles() {
    }

    /**
     * Reads a structure from the reader.
     *
     * @throws StructureDecodeException if the content is not a valid structure
     * @throws IOException              if reading fails
     */
    public static <B> StructureDocument<B> read(Reader reader, BlockCatalog<B> catalog) throws IOException {
        JsonElement tree;
        try {
            tree = JsonParser.parseReader(reader);
        } catch (JsonIOException e) {
            throw unwrap(e);
        } catch (JsonParseException e) {
            throw new StructureDecodeException("Malformed structure data: " + e.getMessage(), e);
        }

        if (!tree.isJsonObject()) {
            throw new StructureDecodeException("Structure root must be a compound");
        }
        return new StructureCodec<>(catalog).decode(tree.getAsJsonObject());
    }

    /**
     * Reads a structure from a file.
     *
     * @throws StructureDecodeException if the content is not a valid structure
     * @throws IOException              if the file cannot be read
     */
    public static <B> StructureDocument<B> readFile(Path file, BlockCatalog<B> catalog) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, catalog);
        }
    }

    /**
     * Writes a structure to the writer and flushes it.
     *
     * @throws IOException if writing fails
     */
    public static <B> void write(Writer writer, StructureDocument<B> document) throws IOException {
        try {
            GSON.toJson(new StructureCodec<>(document.getCatalog()).encode(document), writer);
        } catch (JsonIOException e) {
            throw unwrap(e);
        }
        writer.flush();
    }

    /**
     * Writes a structure to a file, creating it if it does not exist and
     * truncating it if it does.
     *
     * @throws IOException if the file cannot be written
     */
    public static <B> void writeFile(Path file, StructureDocument<B> document) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(writer, document);
        }
    }

    private static IOException unwrap(JsonIOException e) {
        if (e.getCause() instanceof IOException cause) {
            return cause;
        }
        return new IOException(e.getMessage(), e);
    }
}
