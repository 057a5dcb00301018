package com.clouddeploy.model.dto;

import com.clouddeploy.model.enums.DeploymentSource;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for creating an app.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppCreateRequest {

    @NotBlank(message = "Name is required")
    @Size(min = 3, max = 50, message = "Name must be 3-50 characters")
    @Pattern(regexp = "^[A-Za-z0-9_-]+$", message = "Name must be alphanumeric with hyphens or underscores")
    private String name;

    private String description;

    @NotNull(message = "Source type is required")
    private DeploymentSource sourceType;

    @NotNull(message = "Source config is required")
    private Map<String, Object> sourceConfig;

    private Map<String, String> envVars;
}
