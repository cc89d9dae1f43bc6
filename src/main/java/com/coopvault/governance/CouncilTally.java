package com.coopvault.governance;

import lombok.Builder;
import lombok.Value;

/**
 * Council vote counts for a proposal, read at one point in time.
 */
@Value
@Builder
public class CouncilTally {
    String proposalId;

    /**
     * The vote just cast, null for a plain read.
     */
    VoteType vote;

    long forCount;
    long againstCount;
    long abstainCount;

    /**
     * Status the tally moved the proposal to, null if it did not decide.
     */
    ProposalStatus newStatus;

    public long getTotal() {
        return forCount + againstCount + abstainCount;
    }
}
