package com.coopvault.common.exception;

/**
 * Error kinds surfaced to callers.
 *
 * Every failure reaching an API caller carries exactly one kind so that operator
 * tooling can render an actionable message. Retryable kinds describe external
 * systems being unavailable; the failed operation left no persisted change and can
 * be repeated as a whole.
 */
public enum ErrorKind {
    INVALID_AMOUNT,
    INSUFFICIENT_FUNDS,
    EXCEEDS_PER_USER_CAP,
    EXCEEDS_DAILY_CAP,
    NOT_PENDING,
    NOT_FOUND,
    MEMBERSHIP_INACTIVE,
    ALREADY_SETTLED,
    FORBIDDEN,
    BAD_REQUEST_TRANSITION,
    REASON_REQUIRED,
    INSUFFICIENT_CUSTODY_BALANCE,
    INSUFFICIENT_CACHED_RESERVE,
    INSUFFICIENT_VAULT_BALANCE,
    ZERO_ADDRESS,
    ZERO_AMOUNT,
    ROLE_ALREADY_GRANTED,
    WOULD_LEAVE_WITHOUT_ADMIN,
    SETTLEMENT_UNAVAILABLE(true),
    SCORING_UNAVAILABLE(true);

    private final boolean retryable;

    ErrorKind() {
        this(false);
    }

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
