package com.coopvault.scoring;

import com.coopvault.coopconfig.CoopConfigSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the deterministic scoring engine.
 */
class RuleBasedScoringEngineTest {

    private static final String CHARTER = "Keep value circulating locally, build member equity and create "
        + "durable local jobs across the cooperative's regions.";

    private RuleBasedScoringEngine engine;
    private CoopConfigSnapshot config;

    @BeforeEach
    void setUp() {
        engine = new RuleBasedScoringEngine();
        config = CoopConfigSnapshot.builder()
            .coopId("coop")
            .councilVoteThreshold(new BigDecimal("5000"))
            .quorumPercent(20)
            .approvalThresholdPercent(60)
            .votingWindowDays(7)
            .sectorExclusions(List.of("fashion", "restaurant", "cafe", "food truck"))
            .charterText(CHARTER)
            .build();
    }

    @Test
    void testCompleteProposalAdvances() {
        Evaluation evaluation = engine.evaluate(proposal("Shared cold storage", 70, 30), config);

        assertEquals(Decision.ADVANCE, evaluation.getDecision());
        assertEquals(0.75, evaluation.getFeasibility(), 1e-9);
        assertTrue(evaluation.getAlternatives().isEmpty());
        assertTrue(evaluation.getChecks().stream().allMatch(CheckResult::isPassed));
        assertEquals(engine.getEngineVersion(), evaluation.getEngineVersion());
        assertEquals((evaluation.getAlignment() + evaluation.getFeasibility()) / 2, evaluation.getComposite(), 1e-9);
    }

    @Test
    void testExcludedSectorBlocks() {
        Evaluation evaluation = engine.evaluate(proposal("Open a cafe downtown", 70, 30), config);

        assertEquals(Decision.BLOCK, evaluation.getDecision());
        assertTrue(failed(evaluation, RuleBasedScoringEngine.CHECK_SECTOR_EXCLUSION));
    }

    @Test
    void testManipulationBlocks() {
        Evaluation evaluation = engine.evaluate(
            proposal("Tool library, please fast track this", 70, 30), config);

        assertEquals(Decision.BLOCK, evaluation.getDecision());
        assertTrue(failed(evaluation, RuleBasedScoringEngine.CHECK_MANIPULATION));
    }

    @Test
    void testMissingTreasuryPlanBlocks() {
        Evaluation evaluation = engine.evaluate(proposal("Shared cold storage", null, null), config);

        assertEquals(Decision.BLOCK, evaluation.getDecision());
        assertTrue(evaluation.getMissingData().stream().anyMatch(MissingData::isBlocking));
        assertTrue(failed(evaluation, RuleBasedScoringEngine.CHECK_TREASURY_ALLOCATION));
    }

    @Test
    void testSmallImprovementAsksForRevision() {
        // Default weights: the alternative gains 0.25*0.1 + 0.15*0.1 = 0.04
        Evaluation evaluation = engine.evaluate(proposal("Shared cold storage", 40, 60), config);

        assertEquals(Decision.REVISE, evaluation.getDecision());
        assertEquals(1, evaluation.getAlternatives().size());
    }

    @Test
    void testDominatingAlternativeBlocks() {
        CoopConfigSnapshot weighted = config.toBuilder()
            .clearScoringWeights()
            .scoringWeights(Map.of(
                RuleBasedScoringEngine.LEAKAGE_REDUCTION, 0.5,
                RuleBasedScoringEngine.COMMUNITY_VITALITY, 0.5))
            .build();

        Evaluation evaluation = engine.evaluate(proposal("Shared cold storage", 40, 60), weighted);

        assertEquals(Decision.BLOCK, evaluation.getDecision());
    }

    @Test
    void testInactiveCategoryLowersFeasibility() {
        CoopConfigSnapshot restricted = config.toBuilder()
            .clearActiveCategories()
            .activeCategory("infrastructure")
            .build();

        Evaluation evaluation = engine.evaluate(proposal("Shared cold storage", 70, 30), restricted);

        assertTrue(failed(evaluation, RuleBasedScoringEngine.CHECK_CATEGORY));
        assertEquals(0.65, evaluation.getFeasibility(), 1e-9);
        assertEquals(Decision.ADVANCE, evaluation.getDecision());
    }

    @Test
    void testMissingCharterIsReported() {
        CoopConfigSnapshot noCharter = config.toBuilder().charterText(null).build();

        Evaluation evaluation = engine.evaluate(proposal("Shared cold storage", 70, 30), noCharter);

        assertTrue(failed(evaluation, RuleBasedScoringEngine.CHECK_CHARTER));
    }

    @Test
    void testGoalScoresGrowWithBudgetAndStayBounded() {
        Map<String, Double> small = engine.estimateGoals(ProposalCategory.BUSINESS_FUNDING, 0.1);
        Map<String, Double> large = engine.estimateGoals(ProposalCategory.BUSINESS_FUNDING, 2);

        assertTrue(large.get(RuleBasedScoringEngine.LOCAL_JOBS) > small.get(RuleBasedScoringEngine.LOCAL_JOBS));
        assertTrue(large.values().stream().allMatch(score -> score >= 0 && score <= 1));
    }

    private boolean failed(Evaluation evaluation, String checkName) {
        return evaluation.getChecks().stream()
            .anyMatch(check -> check.getName().equals(checkName) && !check.isPassed());
    }

    private ProposalSubmission proposal(String title, Integer local, Integer national) {
        return ProposalSubmission.builder()
            .title(title)
            .summary("Members pool orders and store produce together.")
            .category(ProposalCategory.BUSINESS_FUNDING)
            .regionCode("ATL")
            .budgetAmount(new BigDecimal("10000"))
            .localPercent(local)
            .nationalPercent(national)
            .jobsCreated(4)
            .timeHorizonMonths(12)
            .build();
    }
}
