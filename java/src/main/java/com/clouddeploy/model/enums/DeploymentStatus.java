package com.clouddeploy.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Deployment lifecycle states: pending, then deploying, then running or failed.
 */
public enum DeploymentStatus {
    PENDING("pending"),
    DEPLOYING("deploying"),
    RUNNING("running"),
    FAILED("failed");

    private final String value;

    DeploymentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == RUNNING || this == FAILED;
    }
}
