package com.coopvault.ledger;

import com.coopvault.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable ledger entry recording one reserve-unit movement.
 *
 * A mint has no source account, a burn has no destination account.
 * Ledger entries are never updated or deleted - they are append-only.
 */
@Entity
@Table(name = "ledger_entries", indexes = {
    @Index(name = "idx_ledger_from_account", columnList = "from_account"),
    @Index(name = "idx_ledger_to_account", columnList = "to_account"),
    @Index(name = "idx_ledger_reference", columnList = "reference"),
    @Index(name = "idx_ledger_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
public class LedgerEntry {

    @Id
    private String entryId;

    @Enumerated(EnumType.STRING)
    private TransactionType transactionType;

    @Column(name = "from_account")
    private String fromAccount;

    @Column(name = "to_account")
    private String toAccount;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "amount", precision = 38, scale = 18)),
        @AttributeOverride(name = "currency", column = @Column(name = "currency"))
    })
    private Money amount;

    /**
     * Principal that caused the movement.
     */
    private String actor;

    /**
     * Business reference, e.g. the redemption request id.
     */
    private String reference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public LedgerEntry(TransactionType transactionType, String fromAccount, String toAccount,
                       Money amount, String actor, String reference) {
        this.entryId = UUID.randomUUID().toString();
        this.transactionType = transactionType;
        this.fromAccount = fromAccount;
        this.toAccount = toAccount;
        this.amount = amount;
        this.actor = actor;
        this.reference = reference;
        this.createdAt = Instant.now();
    }
}
