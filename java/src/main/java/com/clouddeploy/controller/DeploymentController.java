package com.clouddeploy.controller;

import com.clouddeploy.model.dto.DeploymentCreateRequest;
import com.clouddeploy.model.dto.DeploymentResponse;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.service.DeploymentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Controller for deployments. Creation returns as soon as the run is queued.
 */
@RestController
@RequestMapping("/api/v1/deployments")
@RequiredArgsConstructor
public class DeploymentController {

    private final DeploymentService deploymentService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<DeploymentResponse> createDeployment(
            @AuthenticationPrincipal User user,
            @Valid @RequestBody DeploymentCreateRequest request) {
        return deploymentService.createDeployment(user, request);
    }

    @GetMapping
    public Flux<DeploymentResponse> listDeployments(
            @AuthenticationPrincipal User user,
            @RequestParam(required = false) UUID appId) {
        return deploymentService.listDeployments(user, appId);
    }

    @GetMapping("/{deploymentId}")
    public Mono<DeploymentResponse> getDeployment(
            @AuthenticationPrincipal User user,
            @PathVariable UUID deploymentId) {
        return deploymentService.getDeployment(user, deploymentId);
    }
}
