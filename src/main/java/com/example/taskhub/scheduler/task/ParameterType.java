package com.example.taskhub.scheduler.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;

import java.util.regex.Pattern;

/**
 * Declared type of a task parameter and the coercion rules applied when binding.
 */
public enum ParameterType {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    JSON,
    EMAIL,
    URL;

    private static final Pattern INTEGER_TEXT = Pattern.compile("[-+]?\\d+");
    private static final Pattern FLOAT_TEXT = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    /**
     * @throws IllegalArgumentException when the value cannot be coerced to this type
     */
    public JsonNode coerce(JsonNode value, ObjectMapper mapper) {
        switch (this) {
            case STRING:
                if (value.isTextual()) return value;
                break;
            case INTEGER:
                // 超出 long 范围的值不截断
                if (value.isIntegralNumber() && value.canConvertToLong()) return LongNode.valueOf(value.asLong());
                if (value.isTextual() && INTEGER_TEXT.matcher(value.asText().trim()).matches()) {
                    try {
                        return LongNode.valueOf(Long.parseLong(value.asText().trim()));
                    } catch (NumberFormatException e) {
                        break;
                    }
                }
                break;
            case FLOAT: {
                double d;
                if (value.isNumber()) {
                    d = value.asDouble();
                } else if (value.isTextual() && FLOAT_TEXT.matcher(value.asText().trim()).matches()) {
                    d = Double.parseDouble(value.asText().trim());
                } else {
                    break;
                }
                // 1e999 之类溢出成 Infinity，存下来后无法再通过校验
                if (Double.isFinite(d)) return DoubleNode.valueOf(d);
                break;
            }
            case BOOLEAN:
                if (value.isBoolean()) return value;
                if (value.isTextual()) {
                    String s = value.asText().trim();
                    if ("true".equalsIgnoreCase(s)) return BooleanNode.TRUE;
                    if ("false".equalsIgnoreCase(s)) return BooleanNode.FALSE;
                }
                break;
            case JSON:
                if (value.isContainerNode()) return value;
                if (value.isTextual()) {
                    try {
                        JsonNode parsed = mapper.readTree(value.asText());
                        if (parsed != null && parsed.isContainerNode()) return parsed;
                    } catch (JsonProcessingException e) {
                        throw new IllegalArgumentException("not valid JSON: " + e.getOriginalMessage(), e);
                    }
                }
                break;
            case EMAIL:
                if (value.isTextual()) {
                    String s = value.asText().trim();
                    int at = s.indexOf('@');
                    if (at > 0 && at < s.length() - 1) return value;
                }
                break;
            case URL:
                if (value.isTextual() && (value.asText().startsWith("http://") || value.asText().startsWith("https://"))) {
                    return value;
                }
                break;
            default:
                break;
        }
        throw new IllegalArgumentException("expected " + name().toLowerCase());
    }
}
