package com.canonicalsync.engine.test;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Workflow payload fixtures.
 */
public final class Workflows {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private Workflows() {
    }

    /**
     * A two-node workflow whose HTTP node calls the given URL.
     */
    public static String json(String name, String url) {
        return """
            {
              "id": "rt-%s",
              "name": "%s",
              "active": true,
              "updatedAt": "2024-01-01T00:00:00.000Z",
              "nodes": [
                {"id": "n2", "name": "Fetch", "type": "http", "position": [400, 200],
                 "parameters": {"url": "%s", "method": "GET"}},
                {"id": "n1", "name": "Start", "type": "trigger", "position": [100, 200], "parameters": {}}
              ],
              "connections": {"Start": {"main": [[{"node": "Fetch", "type": "main", "index": 0}]]}},
              "settings": {"timezone": "UTC"}
            }
            """.formatted(name.replace(' ', '-'), name, url);
    }

    public static JsonNode payload(String name, String url) {
        return parse(json(name, url));
    }

    public static JsonNode parse(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Bad fixture JSON", e);
        }
    }
}
