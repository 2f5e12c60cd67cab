package io.convotest.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.convotest.core.config.model.ConvotestConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public ConvotestConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return ConvotestConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(ConvotestConfig.defaults());
        JsonNode fileNode = camelCaseKeys(mapper.readTree(Files.readString(configPath)));
        return mapper.treeToValue(deepMerge(defaultsNode, fileNode), ConvotestConfig.class);
    }

    public void save(Path configPath, ConvotestConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(configPath, toPrettyJson(config) + System.lineSeparator());
    }

    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        ConvotestConfig config = created || overwrite ? ConvotestConfig.defaults() : load(configPath);
        save(configPath, config);

        Path workspace = ConfigPaths.resolveWorkspace(config.storage().workspace());
        Files.createDirectories(workspace);
        return new InitResult(configPath, workspace, created, !created && overwrite);
    }

    public String toPrettyJson(ConvotestConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    // snake_case keys would otherwise sit next to the camelCase defaults and bind twice.
    private JsonNode camelCaseKeys(JsonNode node) {
        if (node == null || !node.isObject()) {
            return node;
        }
        ObjectNode renamed = mapper.createObjectNode();
        node.fields().forEachRemaining(entry -> {
            String key = toCamelCase(entry.getKey());
            // header names are data, not config keys
            renamed.set(key, "extraHeaders".equals(key) ? entry.getValue() : camelCaseKeys(entry.getValue()));
        });
        return renamed;
    }

    private static String toCamelCase(String key) {
        if (key.indexOf('_') < 0) {
            return key;
        }
        StringBuilder out = new StringBuilder(key.length());
        boolean upper = false;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                upper = out.length() > 0;
            } else {
                out.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return out.toString();
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null || override.isNull()) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry ->
            merged.set(entry.getKey(), deepMerge(merged.get(entry.getKey()), entry.getValue()))
        );
        return merged;
    }
}
