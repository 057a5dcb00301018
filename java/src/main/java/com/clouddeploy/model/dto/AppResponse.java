package com.clouddeploy.model.dto;

import com.clouddeploy.model.enums.AppStatus;
import com.clouddeploy.model.enums.DeploymentSource;
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
public class AppResponse {
    private String id;
    private String name;
    private String description;
    private String userId;
    private AppStatus status;
    private DeploymentSource sourceType;
    private Map<String, Object> sourceConfig;
    private Map<String, String> envVars;
    private String url;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
