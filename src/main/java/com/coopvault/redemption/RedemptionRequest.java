package com.coopvault.redemption;

import com.coopvault.common.IdempotencyKey;
import com.coopvault.common.Money;
import com.coopvault.common.exception.ErrorKind;
import com.coopvault.common.exception.InvalidStateException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A request to redeem reserve units for the external reserve currency.
 *
 * Created PENDING with the units escrowed in vault custody. Exactly one of fulfil,
 * cancel or forfeit can move it out of PENDING. A PENDING or FORFEITED request can
 * additionally be closed through the emergency path, which ends in CANCELLED with
 * {@link #resolvedViaEmergency} set so it stays distinguishable from a normal cancel.
 */
@Entity
@Table(name = "redemption_requests",
    uniqueConstraints = @UniqueConstraint(name = "uk_redemption_idempotency", columnNames = "idempotency_key"),
    indexes = {
        @Index(name = "idx_redemption_requester", columnList = "requester"),
        @Index(name = "idx_redemption_status", columnList = "status"),
        @Index(name = "idx_redemption_created_at", columnList = "created_at")
    })
@Data
@NoArgsConstructor
public class RedemptionRequest {

    @Id
    private String requestId;

    @Column(nullable = false)
    private String requester;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "amount", precision = 38, scale = 18)),
        @AttributeOverride(name = "currency", column = @Column(name = "currency"))
    })
    private Money amount;

    @Enumerated(EnumType.STRING)
    private RedemptionStatus status;

    /**
     * Forfeiture reason.
     */
    private String reason;

    @Column(name = "idempotency_key", length = IdempotencyKey.MAX_LENGTH)
    private String idempotencyKey;

    /**
     * Reserve currency actually paid on fulfilment.
     */
    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "payout_amount", precision = 38, scale = 6)),
        @AttributeOverride(name = "currency", column = @Column(name = "payout_currency"))
    })
    private Money payoutAmount;

    /**
     * Rail confirmation of the payout.
     */
    private String payoutReference;

    private boolean resolvedViaEmergency;

    private String emergencyNote;

    private String settledBy;

    private Instant settledAt;

    @Version
    private Long version;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public RedemptionRequest(String requester, Money amount, String idempotencyKey) {
        this.requestId = UUID.randomUUID().toString();
        this.requester = requester;
        this.amount = amount;
        this.idempotencyKey = idempotencyKey;
        this.status = RedemptionStatus.PENDING;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public boolean isPending() {
        return status == RedemptionStatus.PENDING;
    }

    public void requirePending(String operation) {
        if (!isPending()) {
            throw new InvalidStateException(ErrorKind.NOT_PENDING, "Redemption", requestId,
                status.name(), operation);
        }
    }

    public void fulfill(String operator, Money payout, String payoutReference) {
        requirePending("fulfill");
        this.status = RedemptionStatus.FULFILLED;
        this.payoutAmount = payout;
        this.payoutReference = payoutReference;
        settle(operator);
    }

    public void cancel(String operator) {
        requirePending("cancel");
        this.status = RedemptionStatus.CANCELLED;
        settle(operator);
    }

    public void forfeit(String operator, String reason) {
        requirePending("forfeit");
        this.status = RedemptionStatus.FORFEITED;
        this.reason = reason;
        settle(operator);
    }

    public void resolveViaEmergency(String operator, String note) {
        if (status != RedemptionStatus.PENDING && status != RedemptionStatus.FORFEITED) {
            throw new InvalidStateException(ErrorKind.ALREADY_SETTLED, "Redemption", requestId,
                status.name(), "mark emergency resolved");
        }
        this.status = RedemptionStatus.CANCELLED;
        this.resolvedViaEmergency = true;
        this.emergencyNote = note;
        settle(operator);
    }

    private void settle(String operator) {
        this.settledBy = operator;
        this.settledAt = Instant.now();
        this.updatedAt = this.settledAt;
    }
}
