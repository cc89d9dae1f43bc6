package com.coopvault.governance;

public enum VoteType {
    FOR,
    AGAINST,
    ABSTAIN
}
