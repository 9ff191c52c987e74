package com.lunar.protocol.util;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lunar.script.parser.LuaTable;
import com.lunar.script.parser.Value;

/**
 * Converts between script values and Jackson trees.
 *
 * Tables whose keys are exactly 1..n become arrays; any other table becomes an
 * object keyed by the keys' string form. Functions have no JSON form and are
 * written as the string {@code "<function>"}.
 */
public final class JsonBridge {

    public static final String FUNCTION_PLACEHOLDER = "<function>";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonBridge() {}

    public static JsonNode toJson(Value v) {
        return toJson(v, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static JsonNode toJson(Value v, Set<LuaTable> path) {
        switch (v.getType()) {
            case NIL:
                return NODES.nullNode();
            case BOOLEAN:
                return NODES.booleanNode(v.asBool());
            case NUMBER:
                return number(v.asNumber());
            case STRING:
                return NODES.textNode(v.asString());
            case FUNCTION:
                return NODES.textNode(FUNCTION_PLACEHOLDER);
            default:
                return table(v.asTable(), path);
        }
    }

    private static JsonNode number(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            // not representable in JSON
            return NODES.textNode(Value.numberToString(d));
        }
        if (d == Math.rint(d) && Math.abs(d) <= 9007199254740992.0) {
            return NODES.numberNode((long) d);
        }
        return NODES.numberNode(d);
    }

    private static JsonNode table(LuaTable t, Set<LuaTable> path) {
        if (!path.add(t)) {
            throw new IllegalArgumentException("JsonBridge: table cycle detected at " + t);
        }
        try {
            int n = t.length();
            if (n > 0 && n == t.size()) {
                ArrayNode out = NODES.arrayNode(n);
                for (int i = 1; i <= n; i++) {
                    out.add(toJson(t.rawGet(i), path));
                }
                return out;
            }
            ObjectNode out = NODES.objectNode();
            for (Map.Entry<Value, Value> e : t.entries().entrySet()) {
                out.set(e.getKey().toString(), toJson(e.getValue(), path));
            }
            return out;
        } finally {
            path.remove(t);
        }
    }

    /** JSON arrays become 1-based tables; JSON null becomes nil (and leaves a hole in a table). */
    public static Value fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return Value.NIL;
        if (node.isBoolean()) return Value.bool(node.booleanValue());
        if (node.isNumber()) return Value.number(node.doubleValue());
        if (node.isTextual()) return Value.string(node.textValue());
        if (node.isArray()) {
            LuaTable t = new LuaTable();
            for (int i = 0; i < node.size(); i++) {
                t.rawSet(i + 1, fromJson(node.get(i)));
            }
            return Value.table(t);
        }
        if (node.isObject()) {
            LuaTable t = new LuaTable();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                t.rawSet(f.getKey(), fromJson(f.getValue()));
            }
            return Value.table(t);
        }
        return Value.string(node.asText());
    }
}
