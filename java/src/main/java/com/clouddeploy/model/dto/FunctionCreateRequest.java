package com.clouddeploy.model.dto;

import com.clouddeploy.model.enums.FunctionRuntime;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunctionCreateRequest {

    @NotBlank(message = "Name is required")
    @Size(min = 3, max = 50, message = "Name must be 3-50 characters")
    private String name;

    @NotNull(message = "Runtime is required")
    private FunctionRuntime runtime;

    @NotBlank(message = "Code is required")
    private String code;

    @Builder.Default
    private String handler = "main";

    private Map<String, String> envVars;

    @Builder.Default
    @Min(value = 1, message = "Timeout must be at least 1 second")
    @Max(value = 300, message = "Timeout must be at most 300 seconds")
    private int timeout = 30;
}
