package com.clouddeploy.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentCreateRequest {

    @NotNull(message = "App ID is required")
    private UUID appId;

    private String commitSha;

    private String dockerImage;
}
