package com.example.taskhub.scheduler.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteNowRequest {
    /**
     * Merged over the job's parameters for this execution only.
     */
    private JsonNode parameters;
    /**
     * Run even when a SKIP_IF_RUNNING job already has an open execution.
     */
    private boolean force;
}
