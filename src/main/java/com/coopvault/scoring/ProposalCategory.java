package com.coopvault.scoring;

public enum ProposalCategory {
    BUSINESS_FUNDING,
    PROCUREMENT,
    INFRASTRUCTURE,
    TRANSPORT,
    WALLET_INCENTIVE,
    GOVERNANCE,
    OTHER
}
