package io.liparakis.structis.spi;

import java.util.Map;
import java.util.Objects;

/**
 * Canonical, catalog-independent identity of a block: its namespaced name and
 * its state properties.
 *
 * @param name       The block name, e.g. {@code minecraft:stone}
 * @param properties The state properties, never null
 */
public record BlockIdentity(String name, Map<String, Object> properties) {

    public BlockIdentity {
        Objects.requireNonNull(name, "name");
        properties = properties == null ? Map.of() : properties;
    }

    public static BlockIdentity of(String name) {
        return new BlockIdentity(name, Map.of());
    }
}
