package com.jreinhal.askdocs.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JSON object a model was asked to return. Models often wrap it in prose or code
 * fences, so the outermost {@code {...}} span is parsed.
 */
public final class LlmJson {

    private LlmJson() {
    }

    /**
     * @return the parsed object, or a missing node when no object can be read
     */
    public static JsonNode parseObject(ObjectMapper objectMapper, String raw) {
        if (raw == null) {
            return MissingNode.getInstance();
        }
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return MissingNode.getInstance();
        }
        try {
            JsonNode node = objectMapper.readTree(raw.substring(start, end + 1));
            return node != null && node.isObject() ? node : MissingNode.getInstance();
        } catch (JsonProcessingException e) {
            return MissingNode.getInstance();
        }
    }

    public static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode item : node) {
            if (item.isTextual() && !item.asText().isBlank()) {
                values.add(item.asText().trim());
            }
        }
        return values;
    }
}
