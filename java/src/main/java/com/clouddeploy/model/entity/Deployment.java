package com.clouddeploy.model.entity;

import com.clouddeploy.model.enums.DeploymentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Deployment of an app. Created pending by the request layer; every later
 * change is made by the deployment lifecycle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("deployments")
public class Deployment {

    @Id
    private UUID id;

    @Column("app_id")
    private UUID appId;

    @Column("user_id")
    private UUID userId;

    @Column("status")
    private DeploymentStatus status;

    @Column("commit_sha")
    private String commitSha;

    @Column("docker_image")
    private String dockerImage;

    @Builder.Default
    @Column("logs")
    private List<String> logs = new ArrayList<>();

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("completed_at")
    private LocalDateTime completedAt;
}
