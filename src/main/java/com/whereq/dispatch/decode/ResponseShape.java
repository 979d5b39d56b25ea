package com.whereq.dispatch.decode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Known layouts of job responses returned by the search REST API.
 *
 * <ul>
 *   <li>{@link #ENTRY_LIST}: Atom-style feed, {@code {"entry":[{"name":..,"content":{..}}]}}</li>
 *   <li>{@link #CONTENT_WRAPPED}: single entry, {@code {"name":..,"content":{..}}}</li>
 *   <li>{@link #FLAT}: the object itself is the content, identifier under {@code sid}</li>
 * </ul>
 */
public enum ResponseShape {

    ENTRY_LIST {
        @Override
        public List<Entry> entries(JsonNode root) {
            List<Entry> entries = new ArrayList<>();
            JsonNode array = root.path("entry");
            if (!array.isArray()) {
                return entries;
            }
            for (JsonNode element : array) {
                entries.addAll(CONTENT_WRAPPED.entries(element));
            }
            return entries;
        }
    },

    CONTENT_WRAPPED {
        @Override
        public List<Entry> entries(JsonNode root) {
            JsonNode content = root.path("content");
            if (!content.isObject()) {
                content = JsonNodeFactory.instance.objectNode();
            }
            String identifier = FieldCoercion.text(root.get("name"));
            if (identifier == null || identifier.isEmpty()) {
                identifier = FieldCoercion.text(content.get("sid"));
            }
            return List.of(new Entry(identifier, content));
        }
    },

    FLAT {
        @Override
        public List<Entry> entries(JsonNode root) {
            return List.of(new Entry(FieldCoercion.text(root.get("sid")), root));
        }
    };

    /**
     * Normalize a response of this shape into its entries.
     */
    public abstract List<Entry> entries(JsonNode root);

    /**
     * Select the shape by checking for its marker keys.
     */
    public static ResponseShape detect(JsonNode root) {
        if (root != null && root.has("entry")) {
            return ENTRY_LIST;
        }
        if (root != null && root.path("content").isObject()) {
            return CONTENT_WRAPPED;
        }
        return FLAT;
    }

    /**
     * One normalized job entry: identifier (null when the server omitted it) and content object.
     */
    @Value
    public static class Entry {
        String identifier;
        JsonNode content;
    }
}
