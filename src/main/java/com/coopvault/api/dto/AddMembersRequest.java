package com.coopvault.api.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

/**
 * DTO for registering a batch of members.
 */
@Data
public class AddMembersRequest {

    @NotEmpty(message = "At least one principal is required")
    private List<String> principals;
}
