package com.coopvault.api.dto;

import com.coopvault.governance.ProposalStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class StatusUpdateRequest {

    @NotNull(message = "Status is required")
    private ProposalStatus status;
}
