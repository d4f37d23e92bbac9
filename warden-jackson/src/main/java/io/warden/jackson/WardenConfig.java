package io.warden.jackson;

import io.warden.core.config.WardenSettings;

import java.util.Map;
import java.util.Objects;

/**
 * Settings read from one document: the shared defaults plus per-resource overrides.
 *
 * @param defaults settings for resources without an override
 * @param resources fully resolved settings per resource type name
 * @since 1.0.0
 */
public record WardenConfig(WardenSettings defaults, Map<String, WardenSettings> resources) {

    public WardenConfig {
        Objects.requireNonNull(defaults, "defaults must not be null");
        resources = Map.copyOf(resources);
    }

    /**
     * Returns the settings for a resource type, falling back to the defaults.
     *
     * @param resourceName resource type name
     * @return resolved settings
     */
    public WardenSettings forResource(String resourceName) {
        return resources.getOrDefault(resourceName, defaults);
    }
}
