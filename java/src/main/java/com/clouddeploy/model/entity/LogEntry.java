package com.clouddeploy.model.entity;

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
 * Platform log entry for app, deployment and function events.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("logs")
public class LogEntry {

    public static final String TYPE_DEPLOYMENT = "deployment";
    public static final String TYPE_RUNTIME = "runtime";
    public static final String TYPE_FUNCTION_EXECUTION = "function_execution";

    @Id
    private UUID id;

    @Column("user_id")
    private UUID userId;

    @Column("app_id")
    private UUID appId;

    @Column("deployment_id")
    private UUID deploymentId;

    @Column("function_id")
    private UUID functionId;

    @Column("log_type")
    private String logType;

    @Column("message")
    private String message;

    @Column("level")
    private String level;

    @Column("created_at")
    private LocalDateTime createdAt;
}
