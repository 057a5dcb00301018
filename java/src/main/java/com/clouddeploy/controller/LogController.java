package com.clouddeploy.controller;

import com.clouddeploy.model.dto.LogResponse;
import com.clouddeploy.model.entity.User;
import com.clouddeploy.service.LogService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.UUID;

/**
 * Controller for querying platform logs.
 */
@RestController
@RequestMapping("/api/v1/logs")
@RequiredArgsConstructor
public class LogController {

    private final LogService logService;

    @GetMapping
    public Flux<LogResponse> getLogs(
            @AuthenticationPrincipal User user,
            @RequestParam(required = false) UUID appId,
            @RequestParam(required = false) UUID deploymentId,
            @RequestParam(required = false) UUID functionId,
            @RequestParam(required = false) String logType,
            @RequestParam(required = false) Integer limit) {
        return logService.getLogs(user, appId, deploymentId, functionId, logType, limit);
    }
}
