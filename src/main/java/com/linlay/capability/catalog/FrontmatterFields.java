package com.linlay.capability.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed accessors over one decoded frontmatter mapping. A field with an unexpected shape
 * reads as absent instead of failing the whole document.
 */
public final class FrontmatterFields {

    private final ObjectNode root;
    private final String raw;

    FrontmatterFields(ObjectNode root, String raw) {
        this.root = root == null ? JsonNodeFactory.instance.objectNode() : root;
        this.raw = raw == null ? "" : raw;
    }

    public String raw() {
        return raw;
    }

    public String text(String key) {
        JsonNode node = root.get(key);
        return node != null && node.isTextual() ? node.textValue() : "";
    }

    /**
     * Accepts either a whitespace-delimited string or a sequence of strings.
     */
    public List<String> stringList(String key) {
        JsonNode node = root.get(key);
        if (node == null) {
            return List.of();
        }
        if (node.isTextual()) {
            String value = node.textValue().trim();
            if (value.isEmpty()) {
                return List.of();
            }
            return Arrays.asList(value.split("\\s+"));
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            for (JsonNode element : node) {
                if (element.isTextual()) {
                    values.add(element.textValue());
                }
            }
            return values;
        }
        return List.of();
    }

    public int integer(String key) {
        JsonNode node = root.get(key);
        if (node != null && node.isIntegralNumber() && node.canConvertToInt()) {
            return node.intValue();
        }
        return 0;
    }

    public long longValue(String key) {
        JsonNode node = root.get(key);
        if (node != null && node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        return 0L;
    }

    public boolean bool(String key) {
        JsonNode node = root.get(key);
        return node != null && node.isBoolean() && node.booleanValue();
    }

    /**
     * Flat string map; nested values are dropped, scalars are stringified.
     */
    public Map<String, String> stringMap(String key) {
        JsonNode node = root.get(key);
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        Map<String, String> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isValueNode() && !value.isNull()) {
                values.put(field.getKey(), value.asText());
            }
        }
        return values;
    }
}
