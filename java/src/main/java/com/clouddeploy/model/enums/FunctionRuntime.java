package com.clouddeploy.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FunctionRuntime {
    PYTHON("python"),
    NODEJS("nodejs");

    private final String value;

    FunctionRuntime(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FunctionRuntime fromValue(String value) {
        for (FunctionRuntime runtime : values()) {
            if (runtime.value.equalsIgnoreCase(value)) {
                return runtime;
            }
        }
        throw new IllegalArgumentException("Unknown runtime: " + value);
    }
}
