package com.coopvault.ledger;

import com.coopvault.common.Currency;
import com.coopvault.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Reserve-unit balance of a single account.
 *
 * Only {@link LedgerService} mutates this row, always under a pessimistic lock and
 * always together with a ledger entry.
 */
@Entity
@Table(name = "token_balances")
@Data
@NoArgsConstructor
public class TokenBalance {

    @Id
    private String accountId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "balance_amount", precision = 38, scale = 18)),
        @AttributeOverride(name = "currency", column = @Column(name = "balance_currency"))
    })
    private Money balance;

    @Version
    private Long version;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public TokenBalance(String accountId) {
        this.accountId = accountId;
        this.balance = Money.zero(Currency.UC);
        this.updatedAt = Instant.now();
    }

    void credit(Money amount) {
        this.balance = balance.add(amount);
        this.updatedAt = Instant.now();
    }

    void debit(Money amount) {
        this.balance = balance.subtract(amount);
        this.updatedAt = Instant.now();
    }
}
