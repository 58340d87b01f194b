package com.example.taskhub.scheduler.task;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class ParameterSpec {
    private final String name;
    private final ParameterType type;
    private final boolean required;
    private final JsonNode defaultValue;
    private final String description;

    public static ParameterSpec required(String name, ParameterType type, String description) {
        return ParameterSpec.builder().name(name).type(type).required(true).description(description).build();
    }

    public static ParameterSpec optional(String name, ParameterType type, JsonNode defaultValue, String description) {
        return ParameterSpec.builder().name(name).type(type).required(false).defaultValue(defaultValue).description(description).build();
    }
}
