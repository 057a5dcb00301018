package com.clouddeploy.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * API key view. {@code key} holds the full secret only in the creation
 * response; listings carry the masked form.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyResponse {
    private String id;
    private String name;
    private String key;
    private LocalDateTime createdAt;
    private LocalDateTime lastUsedAt;
}
