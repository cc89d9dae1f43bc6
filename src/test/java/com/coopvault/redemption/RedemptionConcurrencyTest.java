package com.coopvault.redemption;

import com.coopvault.audit.AuditRepository;
import com.coopvault.common.Currency;
import com.coopvault.common.Money;
import com.coopvault.common.exception.ErrorKind;
import com.coopvault.ledger.LedgerAccounts;
import com.coopvault.ledger.LedgerRepository;
import com.coopvault.ledger.LedgerService;
import com.coopvault.ledger.TokenBalanceRepository;
import com.coopvault.membership.CoopMemberRepository;
import com.coopvault.membership.MembershipService;
import com.coopvault.settlement.SettlementRailException;
import com.coopvault.settlement.mock.MockSettlementRail;
import com.coopvault.vault.VaultReserveRepository;
import com.coopvault.vault.VaultService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Races and rollbacks against committed state. Not transactional: every service call
 * commits on its own, and the tables are cleared after each test.
 */
@SpringBootTest
@ActiveProfiles("test")
class RedemptionConcurrencyTest {

    private static final String ADMIN = "admin";
    private static final String MEMBER = "racer-1";

    @Autowired
    private RedemptionService redemptionService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private VaultService vaultService;

    @Autowired
    private MembershipService membershipService;

    @Autowired
    private MockSettlementRail settlementRail;

    @Autowired
    private RedemptionRepository redemptionRepository;

    @Autowired
    private LedgerRepository ledgerRepository;

    @Autowired
    private TokenBalanceRepository balanceRepository;

    @Autowired
    private VaultReserveRepository reserveRepository;

    @Autowired
    private CoopMemberRepository memberRepository;

    @Autowired
    private AuditRepository auditRepository;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        settlementRail.reset();
        executor = Executors.newFixedThreadPool(2);

        membershipService.addMembers(ADMIN, List.of(MEMBER));
        settlementRail.fundWallet(MEMBER, new BigDecimal("100"));
        vaultService.processOnboarding(MEMBER, Money.of("100", Currency.USDC));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);

        redemptionRepository.deleteAll();
        ledgerRepository.deleteAll();
        balanceRepository.deleteAll();
        reserveRepository.deleteAll();
        memberRepository.deleteAll();
        auditRepository.deleteAll();
        settlementRail.reset();
    }

    @Test
    void testConcurrentFulfillPaysOutOnce() throws Exception {
        RedemptionRequest request = redemptionService.redeem(MEMBER, uc("50"), null);
        String requestId = request.getRequestId();

        List<Throwable> failures = race(
            () -> redemptionService.fulfill(ADMIN, requestId),
            () -> redemptionService.fulfill(ADMIN, requestId));

        assertEquals(1, failures.size(), "exactly one fulfill must win");
        assertEquals(RedemptionStatus.FULFILLED, redemptionService.getRedemption(requestId).getStatus());
        assertEquals(1, settlementRail.getPayoutCount());
        assertTrue(ledgerService.balanceOf(LedgerAccounts.VAULT_CUSTODY).isZero());
    }

    @Test
    void testFulfillRacingCancelAppliesOneOutcome() throws Exception {
        RedemptionRequest request = redemptionService.redeem(MEMBER, uc("50"), null);
        String requestId = request.getRequestId();

        List<Throwable> failures = race(
            () -> redemptionService.fulfill(ADMIN, requestId),
            () -> redemptionService.cancel(ADMIN, requestId));

        assertEquals(1, failures.size());
        RedemptionStatus status = redemptionService.getRedemption(requestId).getStatus();
        if (status == RedemptionStatus.FULFILLED) {
            assertEquals(1, settlementRail.getPayoutCount());
            assertTrue(ledgerService.balanceOf(MEMBER).isSameAmount(uc("50")));
        } else {
            assertEquals(RedemptionStatus.CANCELLED, status);
            assertEquals(0, settlementRail.getPayoutCount());
            assertTrue(ledgerService.balanceOf(MEMBER).isSameAmount(uc("100")));
        }
        assertTrue(ledgerService.balanceOf(LedgerAccounts.VAULT_CUSTODY).isZero());
    }

    @Test
    void testConcurrentRedeemsCannotOverdrawBalance() throws Exception {
        List<Throwable> failures = race(
            () -> redemptionService.redeem(MEMBER, uc("80"), null),
            () -> redemptionService.redeem(MEMBER, uc("80"), null));

        assertEquals(1, failures.size());
        assertTrue(ledgerService.balanceOf(MEMBER).isSameAmount(uc("20")));
        assertTrue(ledgerService.balanceOf(LedgerAccounts.VAULT_CUSTODY).isSameAmount(uc("80")));
        assertEquals(1, redemptionService.findRedemptions(RedemptionStatus.PENDING, MEMBER).size());
    }

    @Test
    void testConcurrentRedeemsRespectDailyCap() throws Exception {
        vaultService.setMaxDailyRedemptions(ADMIN, uc("50"));

        List<Throwable> failures = race(
            () -> redemptionService.redeem(MEMBER, uc("30"), null),
            () -> redemptionService.redeem(MEMBER, uc("30"), null));

        assertEquals(1, failures.size());
        assertTrue(vaultService.getReserve().getDailyRedeemedAmount().isSameAmount(uc("30")));
    }

    @Test
    void testPayoutFailureLeavesRequestPending() {
        RedemptionRequest request = redemptionService.redeem(MEMBER, uc("50"), null);
        Money supplyBefore = ledgerService.totalSupply();
        Money cachedBefore = vaultService.getReserve().getCachedExternalReserve();
        settlementRail.setRejectPayouts(true);

        SettlementRailException ex = assertThrows(SettlementRailException.class,
            () -> redemptionService.fulfill(ADMIN, request.getRequestId()));

        assertEquals(ErrorKind.SETTLEMENT_UNAVAILABLE, ex.getKind());
        assertTrue(ex.getKind().isRetryable());
        assertEquals(RedemptionStatus.PENDING, redemptionService.getRedemption(request.getRequestId()).getStatus());
        assertTrue(ledgerService.totalSupply().isSameAmount(supplyBefore));
        assertTrue(ledgerService.balanceOf(LedgerAccounts.VAULT_CUSTODY).isSameAmount(uc("50")));
        assertTrue(vaultService.getReserve().getCachedExternalReserve().isSameAmount(cachedBefore));

        // Retry once the rail is back
        settlementRail.setRejectPayouts(false);
        RedemptionRequest fulfilled = redemptionService.fulfill(ADMIN, request.getRequestId());
        assertEquals(RedemptionStatus.FULFILLED, fulfilled.getStatus());
    }

    private List<Throwable> race(Callable<?> first, Callable<?> second) throws InterruptedException {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (Callable<?> task : List.of(first, second)) {
            futures.add(executor.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();

        List<Throwable> failures = new ArrayList<>();
        for (Future<?> future : futures) {
            try {
                future.get(30, TimeUnit.SECONDS);
            } catch (ExecutionException e) {
                failures.add(e.getCause());
            } catch (TimeoutException e) {
                fail("Race did not finish: " + e.getMessage());
            }
        }
        return failures;
    }

    private static Money uc(String amount) {
        return Money.of(amount, Currency.UC);
    }
}
