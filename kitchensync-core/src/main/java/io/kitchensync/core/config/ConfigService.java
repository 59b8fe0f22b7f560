package io.kitchensync.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.kitchensync.core.config.model.KitchenSyncConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes {@code config.json}. Keys absent from the file, or set to {@code null}, keep
 * their default values.
 */
public final class ConfigService {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public KitchenSyncConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return KitchenSyncConfig.defaults();
        }

        String content = Files.readString(configPath);
        if (content.isBlank()) {
            return KitchenSyncConfig.defaults();
        }
        try {
            ObjectNode settings = MAPPER.valueToTree(KitchenSyncConfig.defaults());
            overlay(settings, MAPPER.readTree(content));
            return MAPPER.treeToValue(settings, KitchenSyncConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Settings file " + configPath + " is not valid: " + e.getOriginalMessage(), e);
        }
    }

    public void save(Path configPath, KitchenSyncConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    /**
     * Writes the defaults (merged with any existing file) and reports whether the file was new.
     */
    public boolean init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        KitchenSyncConfig config = created || overwrite ? KitchenSyncConfig.defaults() : load(configPath);
        save(configPath, config);
        return created;
    }

    private static void overlay(ObjectNode target, JsonNode file) throws ConfigurationException {
        if (!file.isObject()) {
            throw new ConfigurationException("Settings must be a JSON object, found " + file.getNodeType());
        }
        Iterator<Map.Entry<String, JsonNode>> entries = file.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode value = entry.getValue();
            JsonNode current = target.get(entry.getKey());
            if (value.isNull()) {
                continue;
            }
            if (current != null && current.isObject() && value.isObject()) {
                overlay((ObjectNode) current, value);
            } else {
                target.set(entry.getKey(), value);
            }
        }
    }
}
