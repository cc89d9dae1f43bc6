package com.coopvault.audit;

/**
 * Kinds of audited mutations.
 */
public enum AuditEventType {
    REDEMPTION_REQUESTED,
    REDEMPTION_FULFILLED,
    REDEMPTION_CANCELLED,
    REDEMPTION_FORFEITED,
    REDEMPTION_EMERGENCY_RESOLVED,
    MAX_REDEMPTION_PER_USER_CHANGED,
    MAX_DAILY_REDEMPTIONS_CHANGED,
    RESERVE_RESYNCED,
    ONBOARDING_PROCESSED,
    CLEARING_ACCOUNT_CHANGED,
    TREASURY_WITHDRAWAL,
    EMERGENCY_WITHDRAWAL,
    RESERVE_CURRENCY_WITHDRAWN,
    ROLE_GRANTED,
    ROLE_REVOKED,
    ADMIN_TRANSFER_INITIATED,
    ADMIN_TRANSFER_COMPLETED,
    MEMBER_ADDED,
    MEMBER_SUSPENDED,
    MEMBER_REACTIVATED,
    PROPOSAL_SUBMITTED,
    PROPOSAL_EVALUATED,
    PROPOSAL_VOTE_CAST,
    PROPOSAL_STATUS_CHANGED,
    PROPOSAL_WITHDRAWN
}
