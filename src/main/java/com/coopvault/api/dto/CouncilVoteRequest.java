package com.coopvault.api.dto;

import com.coopvault.governance.VoteType;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class CouncilVoteRequest {

    @NotNull(message = "Vote is required")
    private VoteType vote;
}
