package com.coopvault.treasury;

import com.coopvault.access.AccessControlService;
import com.coopvault.access.Role;
import com.coopvault.audit.AuditEventType;
import com.coopvault.audit.AuditService;
import com.coopvault.common.Currency;
import com.coopvault.common.Money;
import com.coopvault.common.exception.ErrorKind;
import com.coopvault.common.exception.InsufficientReserveException;
import com.coopvault.common.exception.InvalidAmountException;
import com.coopvault.common.exception.InvalidDestinationException;
import com.coopvault.ledger.LedgerAccounts;
import com.coopvault.ledger.LedgerService;
import com.coopvault.settlement.SettlementRail;
import com.coopvault.vault.VaultReserve;
import com.coopvault.vault.VaultReserveRepository;
import com.coopvault.vault.VaultService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Privileged extraction of value from the vault.
 *
 * Treasury and emergency withdrawals move reserve units out of vault custody; they
 * share the same checks and differ in the role they require. Reserve-currency
 * withdrawals pay the external currency out of custody through the rail.
 *
 * Checks run in a fixed order: role, destination, amount, balance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TreasuryService {

    private final LedgerService ledgerService;
    private final SettlementRail settlementRail;
    private final VaultService vaultService;
    private final VaultReserveRepository reserveRepository;
    private final AccessControlService accessControl;
    private final AuditService auditService;

    @Transactional
    public TreasuryWithdrawal withdrawToTreasury(String caller, Money amount, String destination) {
        accessControl.requireRole(caller, Role.TREASURER, "withdraw to treasury");
        return moveUnitsOut(caller, amount, destination, false);
    }

    /**
     * Incident-response withdrawal of reserve units, e.g. to return escrowed units to a
     * suspended member before marking the request emergency resolved.
     */
    @Transactional
    public TreasuryWithdrawal emergencyWithdraw(String caller, Money amount, String destination) {
        accessControl.requireRole(caller, Role.DEFAULT_ADMIN, "emergency withdraw");
        return moveUnitsOut(caller, amount, destination, true);
    }

    /**
     * Pay external reserve currency out of custody. The cached reserve is reduced by
     * the amount paid, never below zero.
     */
    @Transactional
    public TreasuryWithdrawal withdrawReserveCurrency(String caller, Money amount, String destination) {
        accessControl.requireRole(caller, Role.TREASURER, "withdraw reserve currency");
        requireDestination(destination, "withdraw reserve currency");
        requireAmount(amount, Currency.USDC);

        Money custody = settlementRail.getCustodyBalance();
        if (custody.isLessThan(amount)) {
            throw new InsufficientReserveException(ErrorKind.INSUFFICIENT_CUSTODY_BALANCE, amount, custody);
        }

        String reference = "reserve-withdrawal:" + UUID.randomUUID();
        VaultReserve reserve = vaultService.lockReserve();

        settlementRail.payOut(destination, amount, reference);

        reserve.debitCachedReserveFloored(amount);
        reserveRepository.save(reserve);

        auditService.record(AuditEventType.RESERVE_CURRENCY_WITHDRAWN, caller,
            AuditService.SUBJECT_TREASURY, reference, amount, "destination=" + destination);

        log.info("Reserve currency withdrawn: ref={}, amount={}, destination={}, actor={}",
            reference, amount, destination, caller);

        return TreasuryWithdrawal.builder()
            .reference(reference)
            .destination(destination)
            .amount(amount)
            .actor(caller)
            .emergency(false)
            .executedAt(Instant.now())
            .build();
    }

    private TreasuryWithdrawal moveUnitsOut(String caller, Money amount, String destination, boolean emergency) {
        String operation = emergency ? "emergency withdraw" : "withdraw to treasury";
        requireDestination(destination, operation);
        requireAmount(amount, Currency.UC);

        Money vaultBalance = ledgerService.lockedBalanceOf(LedgerAccounts.VAULT_CUSTODY);
        if (vaultBalance.isLessThan(amount)) {
            throw new InsufficientReserveException(ErrorKind.INSUFFICIENT_VAULT_BALANCE, amount, vaultBalance);
        }

        String reference = (emergency ? "emergency-withdrawal:" : "treasury-withdrawal:") + UUID.randomUUID();
        ledgerService.transfer(LedgerAccounts.VAULT_CUSTODY, destination, amount, caller, reference);

        auditService.record(emergency ? AuditEventType.EMERGENCY_WITHDRAWAL : AuditEventType.TREASURY_WITHDRAWAL,
            caller, AuditService.SUBJECT_TREASURY, reference, amount, "destination=" + destination);

        log.info("Recorded {}: ref={}, amount={}, destination={}, actor={}",
            emergency ? "EMERGENCY_WITHDRAWAL" : "TREASURY_WITHDRAWAL", reference, amount, destination, caller);

        return TreasuryWithdrawal.builder()
            .reference(reference)
            .destination(destination)
            .amount(amount)
            .actor(caller)
            .emergency(emergency)
            .executedAt(Instant.now())
            .build();
    }

    private void requireDestination(String destination, String operation) {
        if (destination == null || destination.isBlank()) {
            throw new InvalidDestinationException(operation);
        }
    }

    private void requireAmount(Money amount, Currency currency) {
        if (amount == null || amount.getCurrency() != currency) {
            throw new InvalidAmountException(ErrorKind.INVALID_AMOUNT,
                "Withdrawal amount must be in " + currency + ", got " + amount);
        }
        if (!amount.isPositive()) {
            throw new InvalidAmountException(ErrorKind.ZERO_AMOUNT, "Amount must be greater than 0");
        }
    }
}
