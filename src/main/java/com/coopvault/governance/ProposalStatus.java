package com.coopvault.governance;

public enum ProposalStatus {
    SUBMITTED,
    VOTABLE,
    APPROVED,
    REJECTED,
    FUNDED,
    FAILED,
    WITHDRAWN
}
