package com.clouddeploy.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Standard error response DTO.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private String detail;
    private String traceId;

    public static ErrorResponse of(String detail) {
        return ErrorResponse.builder()
                .detail(detail)
                .traceId(UUID.randomUUID().toString())
                .build();
    }
}
