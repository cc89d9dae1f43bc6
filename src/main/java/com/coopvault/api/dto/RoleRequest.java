package com.coopvault.api.dto;

import com.coopvault.access.Role;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for granting or revoking a role.
 */
@Data
public class RoleRequest {

    private String principal;

    @NotNull(message = "Role is required")
    private Role role;
}
