package com.example.taskhub.scheduler.web.dto;

import com.example.taskhub.scheduler.task.ParameterSpec;
import com.example.taskhub.scheduler.task.ParameterType;
import com.example.taskhub.scheduler.task.TaskDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResponse {
    private String name;
    private String description;
    private Long timeoutMs;
    private List<Parameter> parameters;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Parameter {
        private String name;
        private ParameterType type;
        private boolean required;
        private JsonNode defaultValue;
        private String description;
    }

    public static TaskResponse from(TaskDescriptor d) {
        List<Parameter> params = new ArrayList<>();
        for (ParameterSpec p : d.getParameters()) {
            params.add(Parameter.builder()
                    .name(p.getName())
                    .type(p.getType())
                    .required(p.isRequired())
                    .defaultValue(p.getDefaultValue())
                    .description(p.getDescription())
                    .build());
        }
        return TaskResponse.builder()
                .name(d.getName())
                .description(d.getDescription())
                .timeoutMs(d.getTimeout() == null ? null : d.getTimeout().toMillis())
                .parameters(params)
                .build();
    }
}
