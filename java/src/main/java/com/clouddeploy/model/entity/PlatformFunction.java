package com.clouddeploy.model.entity;

import com.clouddeploy.model.enums.FunctionRuntime;
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
 * Serverless function entity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("functions")
public class PlatformFunction {

    @Id
    private UUID id;

    @Column("user_id")
    private UUID userId;

    @Column("name")
    private String name;

    @Column("runtime")
    private FunctionRuntime runtime;

    @Column("code")
    private String code;

    @Column("handler")
    private String handler;

    @Column("env_vars")
    private String envVars; // JSON object

    @Column("timeout_seconds")
    private int timeoutSeconds;

    @Column("endpoint")
    private String endpoint;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
