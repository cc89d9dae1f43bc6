package com.coopvault.redemption;

import com.coopvault.access.AccessControlService;
import com.coopvault.access.Role;
import com.coopvault.audit.AuditEventType;
import com.coopvault.audit.AuditService;
import com.coopvault.common.Currency;
import com.coopvault.common.IdempotencyKey;
import com.coopvault.common.Money;
import com.coopvault.common.ReserveConversion;
import com.coopvault.common.exception.ErrorKind;
import com.coopvault.common.exception.InsufficientReserveException;
import com.coopvault.common.exception.InvalidAmountException;
import com.coopvault.common.exception.LimitExceededException;
import com.coopvault.common.exception.MembershipInactiveException;
import com.coopvault.common.exception.MissingReasonException;
import com.coopvault.common.exception.NotFoundException;
import com.coopvault.ledger.LedgerAccounts;
import com.coopvault.ledger.LedgerService;
import com.coopvault.membership.MembershipRegistry;
import com.coopvault.rules.RedemptionCheck;
import com.coopvault.rules.RedemptionRulesEngine;
import com.coopvault.rules.RuleResult;
import com.coopvault.settlement.SettlementRail;
import com.coopvault.vault.VaultReserve;
import com.coopvault.vault.VaultReserveRepository;
import com.coopvault.vault.VaultService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Redemption lifecycle: escrow on redeem, then exactly one of fulfil, cancel or
 * forfeit, plus the emergency resolution overlay.
 *
 * Concurrency: redeem locks the vault row first, which serializes all redemptions
 * (daily aggregate and the requester's balance check included). Fulfil, cancel,
 * forfeit and emergency resolution lock the request row first, so only one of them
 * can observe PENDING; the others fail with NOT_PENDING or ALREADY_SETTLED.
 *
 * Fulfilment pays out through the rail inside the transaction after every check has
 * passed. A rail failure rolls the transaction back and the request stays PENDING.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedemptionService {

    private final RedemptionRepository redemptionRepository;
    private final VaultService vaultService;
    private final VaultReserveRepository reserveRepository;
    private final LedgerService ledgerService;
    private final RedemptionRulesEngine rulesEngine;
    private final MembershipRegistry membershipRegistry;
    private final SettlementRail settlementRail;
    private final AccessControlService accessControl;
    private final AuditService auditService;

    /**
     * Escrow reserve units from the caller into vault custody and open a request.
     *
     * @param idempotencyKey optional client key; a repeat returns the existing request
     */
    @Transactional
    public RedemptionRequest redeem(String caller, Money amount, String idempotencyKey) {
        if (amount == null || amount.getCurrency() != Currency.UC || !amount.isPositive()) {
            throw new InvalidAmountException(ErrorKind.INVALID_AMOUNT,
                "Redemption amount must be a positive UC amount, got " + amount);
        }
        if (idempotencyKey != null) {
            IdempotencyKey.validate(idempotencyKey);
        }

        VaultReserve reserve = vaultService.lockReserve();

        if (idempotencyKey != null) {
            Optional<RedemptionRequest> existing = redemptionRepository.findByIdempotencyKey(idempotencyKey);
            if (existing.isPresent()) {
                if (!existing.get().getRequester().equals(caller)) {
                    throw new IllegalArgumentException("Idempotency key already used by another requester");
                }
                log.info("Duplicate redemption request with idempotency key {}", idempotencyKey);
                return existing.get();
            }
        }

        Instant now = Instant.now();
        RuleResult result = rulesEngine.evaluateRules(RedemptionCheck.builder()
            .requester(caller)
            .amount(amount)
            .reserve(reserve)
            .now(now)
            .dailyWindow(vaultService.getDailyWindow())
            .build());
        if (!result.isApproved()) {
            throw new LimitExceededException(result.getKind(), result.getReason());
        }

        RedemptionRequest request = new RedemptionRequest(caller, amount, idempotencyKey);

        ledgerService.transfer(caller, LedgerAccounts.VAULT_CUSTODY, amount, caller, request.getRequestId());

        reserve.recordRedemption(amount, now, vaultService.getDailyWindow());
        reserveRepository.save(reserve);

        redemptionRepository.save(request);
        auditService.record(AuditEventType.REDEMPTION_REQUESTED, caller,
            AuditService.SUBJECT_REDEMPTION, request.getRequestId(), amount, null);

        log.info("Redemption requested: id={}, requester={}, amount={}",
            request.getRequestId(), caller, amount);
        return request;
    }

    /**
     * Burn the escrowed units and pay out the converted reserve currency.
     */
    @Transactional
    public RedemptionRequest fulfill(String caller, String requestId) {
        accessControl.requireRole(caller, Role.BACKEND, "fulfill redemptions");

        RedemptionRequest request = lockRequest(requestId);
        request.requirePending("fulfill");
        requireActiveMember(request.getRequester(), "fulfill redemption");

        Money payout = ReserveConversion.toSettlementCurrency(request.getAmount());

        Money custody = settlementRail.getCustodyBalance();
        if (custody.isLessThan(payout)) {
            throw new InsufficientReserveException(ErrorKind.INSUFFICIENT_CUSTODY_BALANCE, payout, custody);
        }

        VaultReserve reserve = vaultService.lockReserve();
        if (reserve.getCachedExternalReserve().isLessThan(payout)) {
            throw new InsufficientReserveException(ErrorKind.INSUFFICIENT_CACHED_RESERVE,
                payout, reserve.getCachedExternalReserve());
        }

        ledgerService.burn(LedgerAccounts.VAULT_CUSTODY, request.getAmount(), caller, requestId);

        // Anything thrown from here on rolls the burn back and leaves the request PENDING
        String confirmation = settlementRail.payOut(request.getRequester(), payout, requestId);

        reserve.debitCachedReserve(payout);
        reserveRepository.save(reserve);

        request.fulfill(caller, payout, confirmation);
        redemptionRepository.save(request);
        auditService.record(AuditEventType.REDEMPTION_FULFILLED, caller,
            AuditService.SUBJECT_REDEMPTION, requestId, payout,
            "burned=" + request.getAmount() + ", confirmation=" + confirmation);

        log.info("Redemption fulfilled: id={}, burned={}, paid={}, operator={}",
            requestId, request.getAmount(), payout, caller);
        return request;
    }

    /**
     * Return the escrowed units to the requester.
     */
    @Transactional
    public RedemptionRequest cancel(String caller, String requestId) {
        accessControl.requireRole(caller, Role.BACKEND, "cancel redemptions");

        RedemptionRequest request = lockRequest(requestId);
        request.requirePending("cancel");
        requireActiveMember(request.getRequester(), "cancel redemption");

        ledgerService.transfer(LedgerAccounts.VAULT_CUSTODY, request.getRequester(),
            request.getAmount(), caller, requestId);

        request.cancel(caller);
        redemptionRepository.save(request);
        auditService.record(AuditEventType.REDEMPTION_CANCELLED, caller,
            AuditService.SUBJECT_REDEMPTION, requestId, request.getAmount(), null);

        log.info("Redemption cancelled: id={}, returned={} to {}, operator={}",
            requestId, request.getAmount(), request.getRequester(), caller);
        return request;
    }

    /**
     * Burn the escrowed units without payout. Works regardless of membership status.
     */
    @Transactional
    public RedemptionRequest forfeit(String caller, String requestId, String reason) {
        accessControl.requireRole(caller, Role.BACKEND, "forfeit redemptions");
        if (reason == null || reason.isBlank()) {
            throw new MissingReasonException("forfeit redemption");
        }

        RedemptionRequest request = lockRequest(requestId);
        request.requirePending("forfeit");

        ledgerService.burn(LedgerAccounts.VAULT_CUSTODY, request.getAmount(), caller, requestId);

        request.forfeit(caller, reason);
        redemptionRepository.save(request);
        auditService.record(AuditEventType.REDEMPTION_FORFEITED, caller,
            AuditService.SUBJECT_REDEMPTION, requestId, request.getAmount(), reason);

        log.info("Redemption forfeited: id={}, burned={}, reason={}, operator={}",
            requestId, request.getAmount(), reason, caller);
        return request;
    }

    /**
     * Close a request whose value was already moved out of band. Ledger balances are
     * not touched.
     */
    @Transactional
    public RedemptionRequest markEmergencyResolved(String caller, String requestId, String note) {
        accessControl.requireRole(caller, Role.TREASURER, "mark emergency resolution");

        RedemptionRequest request = lockRequest(requestId);
        RedemptionStatus previous = request.getStatus();
        request.resolveViaEmergency(caller, note);
        redemptionRepository.save(request);
        auditService.record(AuditEventType.REDEMPTION_EMERGENCY_RESOLVED, caller,
            AuditService.SUBJECT_REDEMPTION, requestId, request.getAmount(),
            "previous=" + previous + ", note=" + note);

        log.info("Redemption emergency resolved: id={}, previous={}, operator={}", requestId, previous, caller);
        return request;
    }

    @Transactional(readOnly = true)
    public RedemptionRequest getRedemption(String requestId) {
        return redemptionRepository.findById(requestId)
            .orElseThrow(() -> new NotFoundException("Redemption", requestId));
    }

    @Transactional(readOnly = true)
    public List<RedemptionRequest> findRedemptions(RedemptionStatus status, String requester) {
        if (status != null && requester != null) {
            return redemptionRepository.findByRequesterAndStatusOrderByCreatedAtDesc(requester, status);
        }
        if (status != null) {
            return redemptionRepository.findByStatusOrderByCreatedAtAsc(status);
        }
        if (requester != null) {
            return redemptionRepository.findByRequesterOrderByCreatedAtDesc(requester);
        }
        return redemptionRepository.findAllByOrderByCreatedAtDesc();
    }

    private RedemptionRequest lockRequest(String requestId) {
        return redemptionRepository.findForUpdate(requestId)
            .orElseThrow(() -> new NotFoundException("Redemption", requestId));
    }

    private void requireActiveMember(String principal, String operation) {
        if (!membershipRegistry.isActiveMember(principal)) {
            throw new MembershipInactiveException(principal, operation);
        }
    }
}
