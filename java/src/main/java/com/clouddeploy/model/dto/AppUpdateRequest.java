package com.clouddeploy.model.dto;

import com.clouddeploy.model.enums.AppStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppUpdateRequest {
    private String description;
    private Map<String, String> envVars;
    private AppStatus status;
}
