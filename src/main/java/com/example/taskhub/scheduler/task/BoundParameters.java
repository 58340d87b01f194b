package com.example.taskhub.scheduler.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Parameters after schema validation: unknown keys removed, defaults applied, values coerced.
 */
public final class BoundParameters {

    private final ObjectNode values;

    public BoundParameters(ObjectNode values) {
        this.values = values.deepCopy();
    }

    public boolean has(String name) {
        return values.hasNonNull(name);
    }

    public String getString(String name) {
        return has(name) ? values.get(name).asText() : null;
    }

    public String getString(String name, String fallback) {
        return has(name) ? values.get(name).asText() : fallback;
    }

    public long getLong(String name, long fallback) {
        return has(name) ? values.get(name).asLong() : fallback;
    }

    public double getDouble(String name, double fallback) {
        return has(name) ? values.get(name).asDouble() : fallback;
    }

    public boolean getBoolean(String name, boolean fallback) {
        return has(name) ? values.get(name).asBoolean() : fallback;
    }

    public JsonNode getJson(String name) {
        return has(name) ? values.get(name).deepCopy() : null;
    }

    public ObjectNode toJson() {
        return values.deepCopy();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
