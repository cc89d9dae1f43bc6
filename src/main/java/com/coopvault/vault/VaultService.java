package com.coopvault.vault;

import com.coopvault.access.AccessControlService;
import com.coopvault.access.Role;
import com.coopvault.audit.AuditEventType;
import com.coopvault.audit.AuditService;
import com.coopvault.common.Currency;
import com.coopvault.common.Money;
import com.coopvault.common.ReserveConversion;
import com.coopvault.common.exception.ErrorKind;
import com.coopvault.common.exception.InvalidAmountException;
import com.coopvault.common.exception.InvalidDestinationException;
import com.coopvault.ledger.LedgerAccounts;
import com.coopvault.ledger.LedgerService;
import com.coopvault.settlement.SettlementRail;
import com.coopvault.settlement.SettlementRailException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Vault configuration, cached reserve bookkeeping and reserve-currency onboarding.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VaultService {

    private final VaultReserveRepository reserveRepository;
    private final LedgerService ledgerService;
    private final SettlementRail settlementRail;
    private final AccessControlService accessControl;
    private final AuditService auditService;

    @Value("${coop-vault.coop-id:soulaan}")
    private String coopId;

    @Value("${coop-vault.redemption.max-per-user-default:0}")
    private BigDecimal maxPerUserDefault;

    @Value("${coop-vault.redemption.max-daily-default:0}")
    private BigDecimal maxDailyDefault;

    @Value("${coop-vault.redemption.daily-window-hours:24}")
    private long dailyWindowHours;

    public String getCoopId() {
        return coopId;
    }

    public Duration getDailyWindow() {
        return Duration.ofHours(dailyWindowHours);
    }

    /**
     * Lock the vault row for the rest of the current transaction, creating it on
     * first use.
     */
    @Transactional
    public VaultReserve lockReserve() {
        return reserveRepository.findForUpdate(coopId)
            .orElseGet(() -> {
                reserveRepository.saveAndFlush(newReserve());
                log.info("Created vault reserve for coop {}", coopId);
                return reserveRepository.findForUpdate(coopId).orElseThrow();
            });
    }

    @Transactional
    public VaultReserve getReserve() {
        return reserveRepository.findById(coopId)
            .orElseGet(() -> reserveRepository.save(newReserve()));
    }

    @Transactional
    public VaultOverview overview() {
        VaultReserve reserve = getReserve();
        Instant now = Instant.now();

        Money custody = null;
        try {
            custody = settlementRail.getCustodyBalance();
        } catch (SettlementRailException e) {
            log.warn("Custody balance unavailable from {}: {}", settlementRail.getRailName(), e.getMessage());
        }

        return VaultOverview.builder()
            .coopId(reserve.getCoopId())
            .vaultBalance(ledgerService.balanceOf(LedgerAccounts.VAULT_CUSTODY))
            .totalSupply(ledgerService.totalSupply())
            .cachedExternalReserve(reserve.getCachedExternalReserve())
            .custodyBalance(custody)
            .maxRedemptionPerUser(reserve.getMaxRedemptionPerUser())
            .maxDailyRedemptions(reserve.getMaxDailyRedemptions())
            .dailyRedeemedAmount(reserve.effectiveDailyAggregate(now, getDailyWindow()))
            .dailyWindowStart(reserve.isWindowExpired(now, getDailyWindow()) ? null : reserve.getDailyWindowStart())
            .clearingAccount(reserve.getClearingAccount())
            .build();
    }

    /**
     * Set the per-request redemption cap; zero removes it. Pending requests are not
     * affected.
     */
    @Transactional
    public VaultReserve setMaxRedemptionPerUser(String caller, Money amount) {
        accessControl.requireAnyRole(caller, "set max redemption per user", Role.TREASURER, Role.DEFAULT_ADMIN);
        requireCap(amount);

        VaultReserve reserve = lockReserve();
        Money previous = reserve.getMaxRedemptionPerUser();
        reserve.setMaxRedemptionPerUser(amount);
        reserve.setUpdatedAt(Instant.now());
        reserveRepository.save(reserve);

        auditService.record(AuditEventType.MAX_REDEMPTION_PER_USER_CHANGED, caller,
            AuditService.SUBJECT_VAULT, coopId, amount, "previous=" + previous);

        log.info("Max redemption per user changed: coop={}, {} -> {}, by={}", coopId, previous, amount, caller);
        return reserve;
    }

    /**
     * Set the daily aggregate cap; zero removes it. The current window is kept.
     */
    @Transactional
    public VaultReserve setMaxDailyRedemptions(String caller, Money amount) {
        accessControl.requireAnyRole(caller, "set max daily redemptions", Role.TREASURER, Role.DEFAULT_ADMIN);
        requireCap(amount);

        VaultReserve reserve = lockReserve();
        Money previous = reserve.getMaxDailyRedemptions();
        reserve.setMaxDailyRedemptions(amount);
        reserve.setUpdatedAt(Instant.now());
        reserveRepository.save(reserve);

        auditService.record(AuditEventType.MAX_DAILY_REDEMPTIONS_CHANGED, caller,
            AuditService.SUBJECT_VAULT, coopId, amount, "previous=" + previous);

        log.info("Max daily redemptions changed: coop={}, {} -> {}, by={}", coopId, previous, amount, caller);
        return reserve;
    }

    /**
     * Overwrite the cached reserve figure with the live custody balance.
     */
    @Transactional
    public VaultReserve resyncReserve(String caller) {
        accessControl.requireRole(caller, Role.TREASURER, "resync reserve");

        Money live = settlementRail.getCustodyBalance();

        VaultReserve reserve = lockReserve();
        Money previous = reserve.getCachedExternalReserve();
        reserve.setCachedExternalReserve(live);
        reserve.setUpdatedAt(Instant.now());
        reserveRepository.save(reserve);

        auditService.record(AuditEventType.RESERVE_RESYNCED, caller,
            AuditService.SUBJECT_VAULT, coopId, live, "previous=" + previous);

        log.info("Reserve resynced: coop={}, cached {} -> {}, by={}", coopId, previous, live, caller);
        return reserve;
    }

    /**
     * Exchange reserve currency for reserve units: the caller's currency is collected
     * into custody and the exactly converted amount of units is minted to the caller.
     *
     * @return the minted amount
     */
    @Transactional
    public Money processOnboarding(String caller, Money usdcAmount) {
        if (usdcAmount == null || usdcAmount.getCurrency() != Currency.USDC || !usdcAmount.isPositive()) {
            throw new InvalidAmountException(ErrorKind.INVALID_AMOUNT,
                "Onboarding amount must be a positive USDC amount, got " + usdcAmount);
        }
        if (caller == null || caller.isBlank()) {
            throw new InvalidDestinationException("process onboarding");
        }

        Money units = ReserveConversion.toReserveUnits(usdcAmount);
        String reference = "onboarding:" + UUID.randomUUID();

        VaultReserve reserve = lockReserve();

        // Collected last before the local writes: a rail failure leaves nothing to undo
        settlementRail.collect(caller, usdcAmount, reference);

        ledgerService.mint(caller, units, caller, reference);
        reserve.creditCachedReserve(usdcAmount);
        reserveRepository.save(reserve);

        auditService.record(AuditEventType.ONBOARDING_PROCESSED, caller,
            AuditService.SUBJECT_PRINCIPAL, caller, units, "collected=" + usdcAmount + ", ref=" + reference);

        log.info("Processed onboarding: user={}, collected={}, minted={}, ref={}",
            caller, usdcAmount, units, reference);
        return units;
    }

    @Transactional
    public VaultReserve setClearingAccount(String caller, String clearingAccount) {
        accessControl.requireRole(caller, Role.DEFAULT_ADMIN, "set clearing account");
        if (clearingAccount == null || clearingAccount.isBlank()) {
            throw new InvalidDestinationException("set clearing account");
        }

        VaultReserve reserve = lockReserve();
        String previous = reserve.getClearingAccount();
        reserve.setClearingAccount(clearingAccount);
        reserve.setUpdatedAt(Instant.now());
        reserveRepository.save(reserve);

        auditService.record(AuditEventType.CLEARING_ACCOUNT_CHANGED, caller,
            AuditService.SUBJECT_VAULT, coopId, "previous=" + previous + ", new=" + clearingAccount);

        log.info("Clearing account changed: coop={}, {} -> {}, by={}", coopId, previous, clearingAccount, caller);
        return reserve;
    }

    private VaultReserve newReserve() {
        return new VaultReserve(coopId,
            Money.of(maxPerUserDefault, Currency.UC),
            Money.of(maxDailyDefault, Currency.UC));
    }

    private void requireCap(Money amount) {
        if (amount == null || amount.getCurrency() != Currency.UC || amount.isNegative()) {
            throw new InvalidAmountException(ErrorKind.INVALID_AMOUNT,
                "Cap must be a non-negative UC amount, got " + amount);
        }
    }
}
