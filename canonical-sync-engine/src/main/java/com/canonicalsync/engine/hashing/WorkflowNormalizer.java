package com.canonicalsync.engine.hashing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reduces a workflow payload to its semantic content so that two payloads that
 * differ only in bookkeeping (ids, timestamps, canvas positions, key order)
 * serialize to the same string.
 *
 * Rules:
 * - top-level volatile fields are dropped
 * - node ids, webhook ids, notes flags and canvas positions are dropped
 * - null values are dropped
 * - object keys are sorted recursively
 * - the nodes array is sorted by node name
 */
public class WorkflowNormalizer {

    static final Set<String> VOLATILE_FIELDS = Set.of(
        "id", "createdAt", "updatedAt", "versionId", "meta", "staticData",
        "triggerCount", "shared", "homeProject", "sharedWithProjects", "pinData", "_comment"
    );

    static final Set<String> VOLATILE_NODE_FIELDS = Set.of(
        "id", "webhookId", "notesInFlow", "position"
    );

    private static final Comparator<JsonNode> BY_NODE_NAME = Comparator.comparing(
        (JsonNode node) -> node.path("name").asText(""), Comparator.naturalOrder());

    private final ObjectMapper objectMapper;
    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public WorkflowNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Normalize a payload into a new tree. The input is not modified.
     */
    public JsonNode normalize(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            throw new IllegalArgumentException("Workflow payload is empty");
        }
        if (!payload.isObject()) {
            return canonicalize(payload);
        }

        ObjectNode result = nodes.objectNode();
        for (Map.Entry<String, JsonNode> field : sortedFields(payload).entrySet()) {
            String name = field.getKey();
            JsonNode value = field.getValue();
            if (VOLATILE_FIELDS.contains(name)) {
                continue;
            }
            if ("nodes".equals(name) && value.isArray()) {
                result.set(name, normalizeNodes(value));
            } else {
                result.set(name, canonicalize(value));
            }
        }
        return result;
    }

    /**
     * Normalize and serialize to compact JSON, the input of the hash function.
     */
    public String toCanonicalJson(JsonNode payload) {
        try {
            return objectMapper.writeValueAsString(normalize(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Workflow payload cannot be serialized", e);
        }
    }

    private ArrayNode normalizeNodes(JsonNode workflowNodes) {
        List<JsonNode> normalized = new ArrayList<>();
        for (JsonNode node : workflowNodes) {
            if (!node.isObject()) {
                normalized.add(canonicalize(node));
                continue;
            }
            ObjectNode stripped = nodes.objectNode();
            for (Map.Entry<String, JsonNode> field : sortedFields(node).entrySet()) {
                if (!VOLATILE_NODE_FIELDS.contains(field.getKey())) {
                    stripped.set(field.getKey(), canonicalize(field.getValue()));
                }
            }
            normalized.add(stripped);
        }
        normalized.sort(BY_NODE_NAME);

        ArrayNode array = nodes.arrayNode();
        normalized.forEach(array::add);
        return array;
    }

    private JsonNode canonicalize(JsonNode value) {
        if (value.isObject()) {
            ObjectNode sorted = nodes.objectNode();
            sortedFields(value).forEach((key, child) -> sorted.set(key, canonicalize(child)));
            return sorted;
        }
        if (value.isArray()) {
            ArrayNode array = nodes.arrayNode();
            for (JsonNode element : value) {
                array.add(canonicalize(element));
            }
            return array;
        }
        return value;
    }

    private static TreeMap<String, JsonNode> sortedFields(JsonNode object) {
        TreeMap<String, JsonNode> sorted = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNull()) {
                sorted.put(field.getKey(), field.getValue());
            }
        }
        return sorted;
    }
}
