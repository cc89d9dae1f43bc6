package com.coopvault.membership;

public enum MemberStatus {
    ACTIVE,
    SUSPENDED
}
