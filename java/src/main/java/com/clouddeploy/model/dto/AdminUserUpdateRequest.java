package com.clouddeploy.model.dto;

import com.clouddeploy.model.enums.UserRole;
import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminUserUpdateRequest {
    @JsonAlias("isActive")
    private Boolean active;
    private UserRole role;
}
