package com.example.taskhub.scheduler.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RunTaskRequest {
    @NotBlank
    private String taskName;
    private JsonNode parameters;
}
