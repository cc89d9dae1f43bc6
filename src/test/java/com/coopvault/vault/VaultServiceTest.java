package com.coopvault.vault;

import com.coopvault.access.AccessControlService;
import com.coopvault.access.Role;
import com.coopvault.audit.AuditEvent;
import com.coopvault.audit.AuditEventType;
import com.coopvault.audit.AuditService;
import com.coopvault.common.Currency;
import com.coopvault.common.Money;
import com.coopvault.common.exception.ErrorKind;
import com.coopvault.common.exception.ForbiddenException;
import com.coopvault.common.exception.InvalidAmountException;
import com.coopvault.common.exception.InvalidDestinationException;
import com.coopvault.ledger.LedgerService;
import com.coopvault.settlement.SettlementRailException;
import com.coopvault.settlement.mock.MockSettlementRail;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for vault configuration and onboarding.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class VaultServiceTest {

    private static final String ADMIN = "admin";
    private static final String USER = "newcomer";
    private static final String TREASURER = "treasurer-v";

    @Autowired
    private VaultService vaultService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccessControlService accessControl;

    @Autowired
    private AuditService auditService;

    @Autowired
    private MockSettlementRail settlementRail;

    @BeforeEach
    void setUp() {
        settlementRail.reset();
        accessControl.grantRole(ADMIN, TREASURER, Role.TREASURER);
    }

    @Test
    void testOnboardingMintsConvertedUnits() {
        settlementRail.fundWallet(USER, new BigDecimal("25.5"));

        Money minted = vaultService.processOnboarding(USER, Money.of("25.5", Currency.USDC));

        assertEquals(Currency.UC, minted.getCurrency());
        assertTrue(minted.isSameAmount(Money.of("25.5", Currency.UC)));
        assertTrue(ledgerService.balanceOf(USER).isSameAmount(minted));
        assertTrue(vaultService.getReserve().getCachedExternalReserve()
            .isSameAmount(Money.of("25.5", Currency.USDC)));
        assertEquals(0, BigDecimal.ZERO.compareTo(settlementRail.getWalletBalance(USER)));
    }

    @Test
    void testOnboardingRejectsZero() {
        InvalidAmountException ex = assertThrows(InvalidAmountException.class,
            () -> vaultService.processOnboarding(USER, Money.of("0", Currency.USDC)));

        assertEquals(ErrorKind.INVALID_AMOUNT, ex.getKind());
    }

    @Test
    void testOnboardingWithUnfundedWalletMintsNothing() {
        Money supplyBefore = ledgerService.totalSupply();

        assertThrows(SettlementRailException.class,
            () -> vaultService.processOnboarding(USER, Money.of("10", Currency.USDC)));

        assertTrue(ledgerService.totalSupply().isSameAmount(supplyBefore));
        assertTrue(ledgerService.balanceOf(USER).isZero());
    }

    @Test
    void testCapChangesAreAudited() {
        vaultService.setMaxRedemptionPerUser(TREASURER, Money.of("500", Currency.UC));
        vaultService.setMaxDailyRedemptions(ADMIN, Money.of("2000", Currency.UC));

        VaultReserve reserve = vaultService.getReserve();
        assertTrue(reserve.hasPerUserCap());
        assertTrue(reserve.getMaxDailyRedemptions().isSameAmount(Money.of("2000", Currency.UC)));

        List<AuditEvent> trail = auditService.getTrail(AuditService.SUBJECT_VAULT, vaultService.getCoopId());
        assertTrue(trail.stream().anyMatch(e -> e.getEventType() == AuditEventType.MAX_REDEMPTION_PER_USER_CHANGED
            && TREASURER.equals(e.getActor())));
        assertTrue(trail.stream().anyMatch(e -> e.getEventType() == AuditEventType.MAX_DAILY_REDEMPTIONS_CHANGED));
    }

    @Test
    void testCapChangeRequiresTreasurerOrAdmin() {
        assertThrows(ForbiddenException.class,
            () -> vaultService.setMaxRedemptionPerUser(USER, Money.of("500", Currency.UC)));
    }

    @Test
    void testNegativeCapRejected() {
        assertThrows(InvalidAmountException.class,
            () -> vaultService.setMaxDailyRedemptions(ADMIN, Money.of("-1", Currency.UC)));
    }

    @Test
    void testResyncOverwritesCachedReserve() {
        settlementRail.setCustodyBalance(new BigDecimal("4321.123456"));

        VaultReserve reserve = vaultService.resyncReserve(TREASURER);

        assertTrue(reserve.getCachedExternalReserve().isSameAmount(Money.of("4321.123456", Currency.USDC)));
        assertEquals(AuditEventType.RESERVE_RESYNCED,
            auditService.getByType(AuditEventType.RESERVE_RESYNCED).get(0).getEventType());
    }

    @Test
    void testResyncRequiresTreasurer() {
        assertThrows(ForbiddenException.class, () -> vaultService.resyncReserve(USER));
    }

    @Test
    void testClearingAccount() {
        assertThrows(InvalidDestinationException.class, () -> vaultService.setClearingAccount(ADMIN, ""));
        assertThrows(ForbiddenException.class, () -> vaultService.setClearingAccount(TREASURER, "clearing-1"));

        VaultReserve reserve = vaultService.setClearingAccount(ADMIN, "clearing-1");

        assertEquals("clearing-1", reserve.getClearingAccount());
    }

    @Test
    void testOverviewReportsCustodyAndWindow() {
        VaultOverview overview = vaultService.overview();

        assertEquals(vaultService.getCoopId(), overview.getCoopId());
        assertNotNull(overview.getCustodyBalance());
        assertNull(overview.getDailyWindowStart());
        assertTrue(overview.getDailyRedeemedAmount().isZero());
    }

    @Test
    void testOverviewToleratesRailOutage() {
        settlementRail.setHealthy(false);

        VaultOverview overview = vaultService.overview();

        assertNull(overview.getCustodyBalance());
        assertNotNull(overview.getCachedExternalReserve());
    }
}
