package com.lunar.protocol.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lunar.script.parser.Environment;
import com.lunar.script.parser.Value;

/**
 * JSON view of an environment frame, for hosts that persist or diff script
 * state. Keys are sorted so equal states print identically.
 */
public final class StateSnapshot {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private StateSnapshot() {}

    /** The frame's own bindings; outer frames are not included. */
    public static ObjectNode capture(Environment env) {
        return capture(env.snapshot());
    }

    public static ObjectNode capture(Map<String, Value> vars) {
        List<String> keys = new ArrayList<>(vars.keySet());
        keys.sort(String::compareTo);

        ObjectNode out = JsonNodeFactory.instance.objectNode();
        for (String k : keys) {
            out.set(k, JsonBridge.toJson(vars.get(k)));
        }
        return out;
    }

    public static String toJsonString(ObjectNode snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("snapshot serialization failed", e);
        }
    }

    public static ObjectNode parse(String json) {
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("snapshot is not valid JSON", e);
        }
        if (!(node instanceof ObjectNode)) {
            throw new IllegalArgumentException("snapshot must be a JSON object, got " + node.getNodeType());
        }
        return (ObjectNode) node;
    }
}
