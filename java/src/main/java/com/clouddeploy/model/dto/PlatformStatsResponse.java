package com.clouddeploy.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Platform totals plus deployment queue counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlatformStatsResponse {
    private long totalUsers;
    private long totalApps;
    private long totalDeployments;
    private long totalFunctions;
    private int queuedDeployments;
    private long acceptedDeployments;
    private long rejectedDeployments;
    private long completedDeployments;
    private LocalDateTime timestamp;
}
