package com.clouddeploy.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Simulated invocation result. No function code is executed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunctionInvokeResponse {
    private String functionId;
    private String status;
    private long executionTimeMs;
    private Map<String, Object> output;
    private LocalDateTime timestamp;
}
