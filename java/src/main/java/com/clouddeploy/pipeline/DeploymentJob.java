package com.clouddeploy.pipeline;

import java.time.Instant;
import java.util.UUID;

/**
 * Queued request to run the lifecycle of one deployment.
 */
public record DeploymentJob(UUID deploymentId, UUID appId, Instant enqueuedAt) {
}
