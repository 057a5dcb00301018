package com.clouddeploy.model.dto;

import com.clouddeploy.model.entity.Deployment;
import com.clouddeploy.model.enums.DeploymentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentResponse {
    private String id;
    private String appId;
    private String userId;
    private DeploymentStatus status;
    private String commitSha;
    private String dockerImage;
    private List<String> logs;
    private LocalDateTime createdAt;
    private LocalDateTime completedAt;

    public static DeploymentResponse from(Deployment deployment) {
        return DeploymentResponse.builder()
                .id(deployment.getId().toString())
                .appId(deployment.getAppId().toString())
                .userId(deployment.getUserId().toString())
                .status(deployment.getStatus())
                .commitSha(deployment.getCommitSha())
                .dockerImage(deployment.getDockerImage())
                .logs(deployment.getLogs() == null ? List.of() : List.copyOf(deployment.getLogs()))
                .createdAt(deployment.getCreatedAt())
                .completedAt(deployment.getCompletedAt())
                .build();
    }
}
