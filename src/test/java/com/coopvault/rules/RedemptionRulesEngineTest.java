package com.coopvault.rules;

import com.coopvault.common.Currency;
import com.coopvault.common.Money;
import com.coopvault.common.exception.ErrorKind;
import com.coopvault.vault.VaultReserve;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the redemption cap rules.
 */
class RedemptionRulesEngineTest {

    private static final Duration WINDOW = Duration.ofHours(24);

    private RedemptionRulesEngine rulesEngine;
    private VaultReserve reserve;
    private Instant now;

    @BeforeEach
    void setUp() {
        rulesEngine = new RedemptionRulesEngine(List.of(new PerUserCapRule(), new DailyCapRule()));
        reserve = new VaultReserve("coop", uc("100"), uc("250"));
        now = Instant.parse("2026-03-01T12:00:00Z");
    }

    @Test
    void testAmountAtPerUserCapApproved() {
        assertTrue(rulesEngine.evaluateRules(check("100", now)).isApproved());
    }

    @Test
    void testAmountAbovePerUserCapDeclined() {
        RuleResult result = rulesEngine.evaluateRules(check("100.000000000000000001", now));

        assertFalse(result.isApproved());
        assertEquals(ErrorKind.EXCEEDS_PER_USER_CAP, result.getKind());
    }

    @Test
    void testDailyAggregateIncludesWindow() {
        reserve.recordRedemption(uc("200"), now.minus(Duration.ofHours(1)), WINDOW);

        assertTrue(rulesEngine.evaluateRules(check("50", now)).isApproved());

        RuleResult result = rulesEngine.evaluateRules(check("51", now));
        assertFalse(result.isApproved());
        assertEquals(ErrorKind.EXCEEDS_DAILY_CAP, result.getKind());
    }

    @Test
    void testWindowResetsAfterItsLength() {
        Instant windowStart = now.minus(WINDOW);
        reserve.recordRedemption(uc("250"), windowStart, WINDOW);

        // Exactly one window later the aggregate starts over
        assertTrue(rulesEngine.evaluateRules(check("100", now)).isApproved());
        assertFalse(rulesEngine.evaluateRules(check("1", now.minusSeconds(1))).isApproved());
    }

    @Test
    void testRecordRedemptionOpensNewWindow() {
        reserve.recordRedemption(uc("250"), now.minus(Duration.ofDays(2)), WINDOW);

        reserve.recordRedemption(uc("10"), now, WINDOW);

        assertEquals(now, reserve.getDailyWindowStart());
        assertTrue(reserve.getDailyRedeemedAmount().isSameAmount(uc("10")));
    }

    @Test
    void testZeroCapsDisableRules() {
        reserve.setMaxRedemptionPerUser(uc("0"));
        reserve.setMaxDailyRedemptions(uc("0"));

        assertTrue(rulesEngine.evaluateRules(check("1000000", now)).isApproved());
    }

    private RedemptionCheck check(String amount, Instant at) {
        return RedemptionCheck.builder()
            .requester("member")
            .amount(uc(amount))
            .reserve(reserve)
            .now(at)
            .dailyWindow(WINDOW)
            .build();
    }

    private static Money uc(String amount) {
        return Money.of(amount, Currency.UC);
    }
}
