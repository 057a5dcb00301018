package com.clouddeploy.model.entity;

import com.clouddeploy.model.enums.AppStatus;
import com.clouddeploy.model.enums.DeploymentSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Application entity. Name is unique per owning user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("apps")
public class App {

    @Id
    private UUID id;

    @Column("user_id")
    private UUID userId;

    @Column("name")
    private String name;

    @Column("description")
    private String description;

    @Column("status")
    private AppStatus status;

    @Column("source_type")
    private DeploymentSource sourceType;

    @Column("source_config")
    private String sourceConfig; // JSON object

    @Column("env_vars")
    private String envVars; // JSON object

    @Column("url")
    private String url;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
