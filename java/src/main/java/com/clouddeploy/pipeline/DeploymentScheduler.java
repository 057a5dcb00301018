package com.clouddeploy.pipeline;

import java.util.UUID;

/**
 * Entry point for starting a deployment run without waiting for it.
 */
public interface DeploymentScheduler {

    /**
     * Queue one lifecycle run for a freshly created pending deployment.
     * Callers schedule each deployment at most once.
     *
     * @param deploymentId Deployment to drive
     * @param appId        Owning application whose status mirrors the outcome
     * @return true when accepted, false when the queue is full
     */
    boolean scheduleDeploymentRun(UUID deploymentId, UUID appId);
}
