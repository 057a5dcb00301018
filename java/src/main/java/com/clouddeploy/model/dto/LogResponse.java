package com.clouddeploy.model.dto;

import com.clouddeploy.model.entity.LogEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogResponse {
    private String id;
    private String appId;
    private String deploymentId;
    private String functionId;
    private String logType;
    private String message;
    private String level;
    private LocalDateTime createdAt;

    public static LogResponse from(LogEntry entry) {
        return LogResponse.builder()
                .id(entry.getId().toString())
                .appId(asString(entry.getAppId()))
                .deploymentId(asString(entry.getDeploymentId()))
                .functionId(asString(entry.getFunctionId()))
                .logType(entry.getLogType())
                .message(entry.getMessage())
                .level(entry.getLevel())
                .createdAt(entry.getCreatedAt())
                .build();
    }

    private static String asString(UUID id) {
        return id == null ? null : id.toString();
    }
}
