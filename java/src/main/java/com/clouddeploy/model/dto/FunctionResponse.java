package com.clouddeploy.model.dto;

import com.clouddeploy.model.enums.FunctionRuntime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunctionResponse {
    private String id;
    private String name;
    private String userId;
    private FunctionRuntime runtime;
    private String handler;
    private Map<String, String> envVars;
    private int timeout;
    private String endpoint;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
