package com.clouddeploy.controller;

import com.clouddeploy.model.dto.FunctionCreateRequest;
import com.clouddeploy.model.dto.FunctionInvokeRequest;
import com.clouddeploy.model.dto.FunctionInvokeResponse;
import com.clouddeploy.model.dto.FunctionResponse;
import com.clouddeploy.model.dto.FunctionUpdateRequest;
import com.clouddeploy.model.dto.MessageResponse;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.service.FunctionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Controller for serverless functions.
 */
@RestController
@RequestMapping("/api/v1/functions")
@RequiredArgsConstructor
public class FunctionController {

    private final FunctionService functionService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<FunctionResponse> createFunction(
            @AuthenticationPrincipal User user,
            @Valid @RequestBody FunctionCreateRequest request) {
        return functionService.createFunction(user, request);
    }

    @GetMapping
    public Flux<FunctionResponse> listFunctions(@AuthenticationPrincipal User user) {
        return functionService.listFunctions(user);
    }

    @GetMapping("/{functionId}")
    public Mono<FunctionResponse> getFunction(@AuthenticationPrincipal User user, @PathVariable UUID functionId) {
        return functionService.getFunction(user, functionId);
    }

    @PatchMapping("/{functionId}")
    public Mono<FunctionResponse> updateFunction(
            @AuthenticationPrincipal User user,
            @PathVariable UUID functionId,
            @Valid @RequestBody FunctionUpdateRequest request) {
        return functionService.updateFunction(user, functionId, request);
    }

    @DeleteMapping("/{functionId}")
    public Mono<MessageResponse> deleteFunction(@AuthenticationPrincipal User user, @PathVariable UUID functionId) {
        return functionService.deleteFunction(user, functionId)
                .thenReturn(MessageResponse.of("Function deleted successfully"));
    }

    @PostMapping("/{functionId}/invoke")
    public Mono<FunctionInvokeResponse> invokeFunction(
            @AuthenticationPrincipal User user,
            @PathVariable UUID functionId,
            @RequestBody(required = false) FunctionInvokeRequest request) {
        return functionService.invokeFunction(user, functionId, request);
    }
}
