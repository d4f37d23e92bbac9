package io.warden.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.warden.core.config.WardenSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads {@link WardenSettings} from JSON.
 *
 * <p>Keys are snake_case and durations are whole milliseconds in fields
 * ending with {@code _ms}. Unknown keys are rejected so that a misspelled
 * option does not go unnoticed. Per-resource sections under
 * {@code resources} override the top-level sections field by field.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * WardenConfig config = new SettingsReader().read(Path.of("warden.json"));
 * WardenSettings pets = config.forResource("pets");
 * }</pre>
 *
 * @since 1.0.0
 */
public class SettingsReader {

    private static final Logger log = LoggerFactory.getLogger(SettingsReader.class);

    private final ObjectMapper objectMapper;

    public SettingsReader() {
        this(createDefaultObjectMapper());
    }

    public SettingsReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    private static ObjectMapper createDefaultObjectMapper() {
        return JsonMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public WardenConfig read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            WardenConfig config = read(in);
            log.info("[WARDEN] Loaded settings from {} ({} resource overrides)", path, config.resources().size());
            return config;
        } catch (IOException e) {
            throw new SettingsException("Failed to read settings file " + path, e);
        }
    }

    public WardenConfig read(InputStream in) {
        try {
            return resolve(objectMapper.readValue(in, SettingsDocument.class));
        } catch (IOException e) {
            throw new SettingsException("Failed to parse settings JSON", e);
        }
    }

    public WardenConfig read(Reader reader) {
        try {
            return resolve(objectMapper.readValue(reader, SettingsDocument.class));
        } catch (IOException e) {
            throw new SettingsException("Failed to parse settings JSON", e);
        }
    }

    public WardenConfig read(String json) {
        try {
            return resolve(objectMapper.readValue(json, SettingsDocument.class));
        } catch (IOException e) {
            throw new SettingsException("Failed to parse settings JSON", e);
        }
    }

    private WardenConfig resolve(SettingsDocument document) {
        if (document == null) {
            return new WardenConfig(WardenSettings.defaults(), Map.of());
        }
        WardenSettings defaults = toSettings(document, WardenSettings.defaults(), "defaults");
        Map<String, WardenSettings> resources = new LinkedHashMap<>();
        if (document.resources != null) {
            document.resources.forEach((name, override) ->
                    resources.put(name, toSettings(override, defaults, "resource '" + name + "'")));
        }
        return new WardenConfig(defaults, resources);
    }

    private static WardenSettings toSettings(SettingsDocument document, WardenSettings base, String section) {
        if (document == null) {
            return base;
        }
        try {
            return document.toSettings(base);
        } catch (IllegalArgumentException e) {
            throw new SettingsException("Invalid settings for " + section + ": " + e.getMessage(), e);
        }
    }
}
