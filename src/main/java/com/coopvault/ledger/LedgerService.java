package com.coopvault.ledger;

import com.coopvault.common.Currency;
import com.coopvault.common.Money;
import com.coopvault.common.exception.ErrorKind;
import com.coopvault.common.exception.InsufficientFundsException;
import com.coopvault.common.exception.InvalidAmountException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Service for the reserve-unit ledger.
 *
 * Every balance change goes through mint, burn or transfer and is recorded as an
 * immutable ledger entry carrying actor, amount and timestamp. Balances never go
 * negative: the debited account is locked and checked before it is touched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final TokenBalanceRepository balanceRepository;
    private final LedgerRepository ledgerRepository;

    /**
     * Issue new reserve units to an account.
     */
    @Transactional
    public LedgerEntry mint(String to, Money amount, String actor, String reference) {
        requirePositiveUnits(amount);

        TokenBalance balance = lockOrCreate(to);
        balance.credit(amount);
        balanceRepository.save(balance);

        LedgerEntry entry = ledgerRepository.save(
            new LedgerEntry(TransactionType.MINT, null, to, amount, actor, reference));

        log.info("Recorded MINT: txn={}, to={}, amount={} {}, actor={}",
            entry.getEntryId(), to, amount.getAmount(), amount.getCurrency(), actor);

        return entry;
    }

    /**
     * Destroy reserve units held by an account.
     */
    @Transactional
    public LedgerEntry burn(String from, Money amount, String actor, String reference) {
        requirePositiveUnits(amount);

        TokenBalance balance = lockOrCreate(from);
        requireCovered(balance, amount);
        balance.debit(amount);
        balanceRepository.save(balance);

        LedgerEntry entry = ledgerRepository.save(
            new LedgerEntry(TransactionType.BURN, from, null, amount, actor, reference));

        log.info("Recorded BURN: txn={}, from={}, amount={} {}, actor={}",
            entry.getEntryId(), from, amount.getAmount(), amount.getCurrency(), actor);

        return entry;
    }

    /**
     * Move reserve units between two accounts.
     */
    @Transactional
    public LedgerEntry transfer(String from, String to, Money amount, String actor, String reference) {
        requirePositiveUnits(amount);
        if (from.equals(to)) {
            throw new IllegalArgumentException("Cannot transfer to the same account: " + from);
        }

        // Lock in a fixed order so that opposite transfers cannot deadlock
        TokenBalance source;
        TokenBalance target;
        if (from.compareTo(to) < 0) {
            source = lockOrCreate(from);
            target = lockOrCreate(to);
        } else {
            target = lockOrCreate(to);
            source = lockOrCreate(from);
        }

        requireCovered(source, amount);
        source.debit(amount);
        target.credit(amount);
        balanceRepository.save(source);
        balanceRepository.save(target);

        LedgerEntry entry = ledgerRepository.save(
            new LedgerEntry(TransactionType.TRANSFER, from, to, amount, actor, reference));

        log.info("Recorded TRANSFER: txn={}, from={}, to={}, amount={} {}, actor={}",
            entry.getEntryId(), from, to, amount.getAmount(), amount.getCurrency(), actor);

        return entry;
    }

    @Transactional(readOnly = true)
    public Money balanceOf(String accountId) {
        return balanceRepository.findById(accountId)
            .map(TokenBalance::getBalance)
            .orElse(Money.zero(Currency.UC));
    }

    /**
     * Read a balance while holding its row lock until the surrounding transaction ends.
     */
    @Transactional
    public Money lockedBalanceOf(String accountId) {
        return lockOrCreate(accountId).getBalance();
    }

    @Transactional(readOnly = true)
    public Money totalSupply() {
        BigDecimal sum = balanceRepository.sumBalances();
        return sum == null ? Money.zero(Currency.UC) : Money.of(sum, Currency.UC);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getAccountLedger(String accountId) {
        return ledgerRepository.findByFromAccountOrToAccountOrderByCreatedAtDesc(accountId, accountId);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getReferenceLedger(String reference) {
        return ledgerRepository.findByReferenceOrderByCreatedAtAsc(reference);
    }

    private TokenBalance lockOrCreate(String accountId) {
        return balanceRepository.findForUpdate(accountId)
            .orElseGet(() -> {
                log.debug("Opening balance row for account {}", accountId);
                balanceRepository.saveAndFlush(new TokenBalance(accountId));
                return balanceRepository.findForUpdate(accountId).orElseThrow();
            });
    }

    private void requireCovered(TokenBalance balance, Money amount) {
        if (balance.getBalance().isLessThan(amount)) {
            throw new InsufficientFundsException(balance.getAccountId(), amount, balance.getBalance());
        }
    }

    private void requirePositiveUnits(Money amount) {
        if (amount == null || amount.getCurrency() != Currency.UC || !amount.isPositive()) {
            throw new InvalidAmountException(ErrorKind.INVALID_AMOUNT,
                "Ledger amount must be a positive UC amount, got " + amount);
        }
    }
}
