package com.coopvault.membership;

/**
 * Source of truth for whether a principal is an active cooperative member.
 *
 * Consulted by redemption fulfilment and cancellation; suspended members can only be
 * resolved through forfeiture or the emergency path.
 */
public interface MembershipRegistry {

    boolean isActiveMember(String principal);
}
