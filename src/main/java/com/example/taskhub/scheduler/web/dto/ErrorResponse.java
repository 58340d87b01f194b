package com.example.taskhub.scheduler.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    /**
     * Machine-readable error code, e.g. PARAMETER_VALIDATION
     */
    private String error;
    private String message;
    private List<String> details;
}
