package org.carball.bom.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Shared reading helpers for catalog and order definition files. Files ending in {@code .yaml} or
 * {@code .yml} are read as YAML, everything else as JSON.
 */
final class DefinitionFiles {

    private DefinitionFiles() {
    }

    static JsonNode read(Path path, String kind) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException(kind + " file not found: " + path);
        }

        String content = Files.readString(path);
        JsonNode root = mapperFor(path).readTree(content);
        if (root == null || !root.isObject()) {
            throw new IOException(kind + " file " + path + " does not contain a mapping at the top level");
        }
        return root;
    }

    static ObjectMapper mapperFor(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
            return new ObjectMapper(new YAMLFactory());
        }
        return new ObjectMapper();
    }

    static String requiredText(JsonNode node, String field, String context) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new IllegalArgumentException(context + " is missing '" + field + "'");
        }
        return value.asText();
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }

    static int intValue(JsonNode node, String field, int defaultValue) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? defaultValue : value.asInt(defaultValue);
    }

    static double doubleValue(JsonNode node, String field, double defaultValue) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? defaultValue : value.asDouble(defaultValue);
    }

    static Iterable<JsonNode> array(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new IllegalArgumentException("'" + field + "' must be a list");
        }
        return value;
    }
}
