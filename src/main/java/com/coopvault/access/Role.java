package com.coopvault.access;

/**
 * Capabilities held by principals. Roles are not exclusive and none implies another.
 */
public enum Role {
    /**
     * Full control and role management.
     */
    DEFAULT_ADMIN,

    /**
     * Day-to-day redemption fulfilment, cancellation and forfeiture.
     */
    BACKEND,

    /**
     * Withdrawals, cap configuration and emergency resolution.
     */
    TREASURER
}
