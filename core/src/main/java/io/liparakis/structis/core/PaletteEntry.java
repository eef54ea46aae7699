package io.liparakis.structis.core;

import io.liparakis.structis.spi.BlockIdentity;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single deduplicated block identity in a {@link Palette}.
 * <p>
 * Property values are normalised on construction so that entries compare by
 * value regardless of where they came from (catalog or tagged tree):
 * <ul>
 * <li>{@code String} and {@code Boolean} are kept as is</li>
 * <li>integral numbers become {@code Integer}, or {@code Long} if wider</li>
 * <li>fractional numbers, and integers too wide for a long, become {@code Double}</li>
 * <li>{@code null} values are dropped (an unset key is an absent key)</li>
 * </ul>
 *
 * @param name          The block name
 * @param properties    The normalised, unmodifiable state properties
 * @param schemaVersion The catalog schema version the entry was written under
 */
public record PaletteEntry(String name, Map<String, Object> properties, int schemaVersion) {

    public PaletteEntry {
        Objects.requireNonNull(name, "name");
        properties = normalizeProperties(properties);
    }

    public static PaletteEntry of(BlockIdentity identity, int schemaVersion) {
        return new PaletteEntry(identity.name(), identity.properties(), schemaVersion);
    }

    /** Gets the (name, properties) part of this entry. */
    public BlockIdentity identity() {
        return new BlockIdentity(name, properties);
    }

    /**
     * Checks if this entry has the given name and exactly the given properties.
     * The query properties must already be normalised.
     */
    boolean matches(String otherName, Map<String, Object> otherProperties) {
        return name.equals(otherName) && properties.equals(otherProperties);
    }

    /**
     * Returns an unmodifiable, normalised copy of the property map.
     *
     * @throws IllegalArgumentException if a value is not a scalar
     */
    public static Map<String, Object> normalizeProperties(Map<String, ?> properties) {
        if (properties == null || properties.isEmpty()) {
            return Collections.emptyMap();
        }

        Map<String, Object> normalized = new LinkedHashMap<>(properties.size());
        for (Map.Entry<String, ?> entry : properties.entrySet()) {
            if (entry.getValue() != null) {
                normalized.put(entry.getKey(), normalizeValue(entry.getValue()));
            }
        }
        return Collections.unmodifiableMap(normalized);
    }

    /**
     * Normalises a single scalar state value.
     *
     * @throws IllegalArgumentException if the value is not a string, boolean or number
     */
    public static Object normalizeValue(Object value) {
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Double || value instanceof Float) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Number number) {
            String text = number.toString();
            if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
                BigInteger integral = new BigInteger(text);
                if (integral.bitLength() < Integer.SIZE) {
                    return integral.intValue();
                }
                if (integral.bitLength() < Long.SIZE) {
                    return integral.longValue();
                }
            }
            return number.doubleValue();
        }
        throw new IllegalArgumentException("State value must be a string, boolean or number, got "
                + value.getClass().getName());
    }
}
