package com.clouddeploy.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of an application. Mirrors its latest deployment, plus {@code stopped}
 * which only the start/stop actions set.
 */
public enum AppStatus {
    PENDING("pending"),
    DEPLOYING("deploying"),
    RUNNING("running"),
    FAILED("failed"),
    STOPPED("stopped");

    private final String value;

    AppStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AppStatus fromValue(String value) {
        for (AppStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown app status: " + value);
    }

    public static AppStatus mirror(DeploymentStatus status) {
        return valueOf(status.name());
    }
}
