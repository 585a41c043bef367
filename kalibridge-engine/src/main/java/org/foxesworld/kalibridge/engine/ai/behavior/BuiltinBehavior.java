package org.foxesworld.kalibridge.engine.ai.behavior;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Built-in goal kind with its raw parameters.
 *
 * @param params the entry object; kind-specific fields are read with defaults
 */
public record BuiltinBehavior(String type, int priority, JsonNode params) implements BehaviorDescriptor {

    public BuiltinBehavior {
        Objects.requireNonNull(type, "type");
        params = params == null ? JsonNodeFactory.instance.objectNode() : params;
    }

    public static BuiltinBehavior of(String type, int priority) {
        return new BuiltinBehavior(type, priority, null);
    }

    public static BuiltinBehavior of(String type, int priority, String key, String value) {
        ObjectNode p = JsonNodeFactory.instance.objectNode();
        p.put(key, value);
        return new BuiltinBehavior(type, priority, p);
    }

    public double number(String key, double def) {
        JsonNode v = params.get(key);
        return v != null && v.isNumber() ? v.doubleValue() : def;
    }

    public boolean flag(String key, boolean def) {
        JsonNode v = params.get(key);
        return v != null && v.isBoolean() ? v.booleanValue() : def;
    }

    public String text(String key, String def) {
        JsonNode v = params.get(key);
        return v != null && v.isTextual() ? v.textValue() : def;
    }
}
