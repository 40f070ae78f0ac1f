package com.example.paging.cache;

import com.example.paging.filter.FilterField;
import com.example.paging.filter.FilterOperation;
import com.example.paging.filter.FilterSpec;
import com.example.paging.filter.SortField;
import com.example.paging.filter.StandardOperation;
import com.example.paging.model.FetchQuery;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Derives the cache key of a {@link FetchQuery}.
 *
 * <p>The page key and filter spec are written as a JSON document with a fixed
 * field order and the bytes are encoded as URL-safe base64:
 *
 * <pre>{@code
 * {"pageKey":"20","filter":{"filters":[{"field":"status","value":"active","operation":"equals"}],
 *                           "sorts":[{"field":"createdAt","order":"desc"}]}}
 * }</pre>
 *
 * <p>An absent page key and an absent filter are both written as JSON {@code null}, so the
 * first page is distinct from a page keyed by the string {@code "null"}, and "no filter" is
 * distinct from an empty filter spec. Page size is not part of the key.
 *
 * <p>Filter values are serialized with Jackson (map entries sorted by key); values Jackson
 * cannot serialize fall back to their {@code toString()}. Collections other than lists are
 * written in a sorted order, so equal sets give equal keys whatever their iteration order.
 * Values with the same JSON form share a key: {@code 1} and {@code 1L} are not told apart.
 */
public final class CacheKeys {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private CacheKeys() {
    }

    /**
     * Returns the deterministic cache key for the query.
     *
     * @param query the query to derive the key from
     * @return an opaque token made of base64url characters
     */
    public static String deriveKey(FetchQuery<?> query) {
        ObjectNode root = MAPPER.createObjectNode();
        if (query.pageKey() == null) {
            root.putNull("pageKey");
        } else {
            root.put("pageKey", String.valueOf(query.pageKey()));
        }
        if (query.filter() == null) {
            root.putNull("filter");
        } else {
            root.set("filter", toNode(query.filter()));
        }

        try {
            return Base64.getUrlEncoder().withoutPadding().encodeToString(MAPPER.writeValueAsBytes(root));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize cache key for " + query, e);
        }
    }

    private static ObjectNode toNode(FilterSpec spec) {
        ObjectNode node = MAPPER.createObjectNode();
        ArrayNode filters = node.putArray("filters");
        for (FilterField field : spec.filters()) {
            ObjectNode f = filters.addObject();
            f.put("field", field.fieldName());
            f.set("value", valueNode(field.value()));
            f.put("operation", operationCode(field.operation()));
        }
        ArrayNode sorts = node.putArray("sorts");
        for (SortField sort : spec.sorts()) {
            ObjectNode s = sorts.addObject();
            s.put("field", sort.fieldName());
            s.put("order", sort.descending() ? "desc" : "asc");
        }
        return node;
    }

    // custom codes are prefixed so custom("equals") never collides with EQUALS
    private static String operationCode(FilterOperation operation) {
        if (operation instanceof StandardOperation standard) {
            return standard.code();
        }
        return "custom:" + operation.code();
    }

    private static JsonNode valueNode(Object value) {
        if (value instanceof Collection<?> collection && !(value instanceof List)) {
            List<JsonNode> elements = new ArrayList<>(collection.size());
            for (Object element : collection) {
                elements.add(valueNode(element));
            }
            elements.sort(Comparator.comparing(JsonNode::toString));
            ArrayNode sorted = MAPPER.createArrayNode();
            sorted.addAll(elements);
            return sorted;
        }
        try {
            return MAPPER.valueToTree(value);
        } catch (IllegalArgumentException e) {
            return TextNode.valueOf(String.valueOf(value));
        }
    }
}
