package com.coopvault.audit;

import com.coopvault.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of a state mutation, written in the same transaction as the
 * mutation itself so that reconciliation can rely on it.
 */
@Entity
@Table(name = "audit_events", indexes = {
    @Index(name = "idx_audit_subject", columnList = "subject_type, subject_id"),
    @Index(name = "idx_audit_actor", columnList = "actor"),
    @Index(name = "idx_audit_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
public class AuditEvent {

    @Id
    private String eventId;

    @Enumerated(EnumType.STRING)
    private AuditEventType eventType;

    private String actor;

    @Column(name = "subject_type")
    private String subjectType;

    @Column(name = "subject_id")
    private String subjectId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "amount", precision = 38, scale = 18)),
        @AttributeOverride(name = "currency", column = @Column(name = "currency"))
    })
    private Money amount;

    @Column(length = 2000)
    private String detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public AuditEvent(AuditEventType eventType, String actor, String subjectType,
                      String subjectId, Money amount, String detail) {
        this.eventId = UUID.randomUUID().toString();
        this.eventType = eventType;
        this.actor = actor;
        this.subjectType = subjectType;
        this.subjectId = subjectId;
        this.amount = amount;
        this.detail = detail;
        this.createdAt = Instant.now();
    }
}
