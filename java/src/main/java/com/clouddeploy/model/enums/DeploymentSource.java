package com.clouddeploy.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where an application's source comes from.
 */
public enum DeploymentSource {
    GITHUB("github"),
    DOCKER("docker"),
    PYTHON_SCRIPT("python_script");

    private final String value;

    DeploymentSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DeploymentSource fromValue(String value) {
        for (DeploymentSource source : values()) {
            if (source.value.equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + value);
    }
}
