package com.coopvault.scoring;

import com.coopvault.coopconfig.CoopConfigSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Deterministic scoring engine.
 *
 * Goal scores are estimated from category and budget, compliance checks screen the
 * proposal text, and the decision compares the proposal with generated alternatives:
 * an alternative ahead by at least {@link #DOMINANCE_DELTA} blocks the proposal, a
 * smaller lead asks for a revision.
 *
 * A model-backed engine can replace this bean through the {@link ScoringEngine}
 * interface.
 */
@Component
@Slf4j
public class RuleBasedScoringEngine implements ScoringEngine {

    public static final String LEAKAGE_REDUCTION = "LeakageReduction";
    public static final String MEMBER_BENEFIT = "MemberBenefit";
    public static final String EQUITY_GROWTH = "EquityGrowth";
    public static final String LOCAL_JOBS = "LocalJobs";
    public static final String COMMUNITY_VITALITY = "CommunityVitality";
    public static final String RESILIENCE = "Resilience";

    static final double DOMINANCE_DELTA = 0.08;

    private static final String VERSION = "rule-engine@1.0.0";

    private static final double DEFAULT_BUDGET = 10000;

    private static final Map<String, Double> DEFAULT_WEIGHTS = new LinkedHashMap<>();

    static {
        DEFAULT_WEIGHTS.put(LEAKAGE_REDUCTION, 0.25);
        DEFAULT_WEIGHTS.put(MEMBER_BENEFIT, 0.20);
        DEFAULT_WEIGHTS.put(EQUITY_GROWTH, 0.15);
        DEFAULT_WEIGHTS.put(LOCAL_JOBS, 0.15);
        DEFAULT_WEIGHTS.put(COMMUNITY_VITALITY, 0.15);
        DEFAULT_WEIGHTS.put(RESILIENCE, 0.10);
    }

    private static final List<String> MANIPULATION_PATTERNS = List.of(
        "ignore previous instructions",
        "do not research",
        "fast track",
        "approve regardless",
        "bypass checks",
        "override",
        "skip validation",
        "emergency approval",
        "urgent bypass",
        "disable guardrails"
    );

    private static final List<String> UNREALISTIC_CLAIMS = List.of(
        "guaranteed profit",
        "risk-free",
        "100% success",
        "no downside",
        "unlimited potential",
        "revolutionary breakthrough"
    );

    static final String CHECK_TREASURY_ALLOCATION = "treasury_allocation_sum";
    static final String CHECK_SECTOR_EXCLUSION = "sector_exclusion_screen";
    static final String CHECK_MANIPULATION = "manipulation_attempt_detected";
    static final String CHECK_UNREALISTIC = "unrealistic_claims_detected";
    static final String CHECK_CATEGORY = "category_active";
    static final String CHECK_CHARTER = "charter_loaded";

    @Override
    public Evaluation evaluate(ProposalSubmission submission, CoopConfigSnapshot config) {
        double budget = submission.getBudgetAmount() != null
            ? submission.getBudgetAmount().doubleValue()
            : DEFAULT_BUDGET;
        double budgetFactor = Math.min(budget / 100000, 2);

        Map<String, Double> weights = config.getScoringWeights().isEmpty()
            ? DEFAULT_WEIGHTS
            : config.getScoringWeights();

        Map<String, Double> goals = estimateGoals(submission.getCategory(), budgetFactor);
        double alignment = weightedComposite(goals, weights);

        List<CheckResult> checks = runComplianceChecks(submission, config);
        List<MissingData> missing = findMissingData(submission);
        List<Alternative> alternatives = generateAlternatives(submission, goals, weights);

        long failedChecks = checks.stream().filter(c -> !c.isPassed()).count();
        double feasibility = clamp01(0.75 - 0.1 * failedChecks - (budgetFactor > 1 ? 0.1 : 0));
        double composite = clamp01((alignment + feasibility) / 2);

        Evaluation.EvaluationBuilder builder = Evaluation.builder()
            .alignment(alignment)
            .feasibility(feasibility)
            .composite(composite)
            .goalScores(goals)
            .alternatives(alternatives)
            .checks(checks)
            .missingData(missing)
            .engineVersion(VERSION);

        decide(alignment, checks, alternatives, missing, builder);
        Evaluation evaluation = builder.build();

        log.debug("Scored '{}': decision={}, alignment={}, feasibility={}, composite={}",
            submission.getTitle(), evaluation.getDecision(), alignment, feasibility, composite);
        return evaluation;
    }

    @Override
    public String getEngineVersion() {
        return VERSION;
    }

    Map<String, Double> estimateGoals(ProposalCategory category, double budgetFactor) {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put(LEAKAGE_REDUCTION, 0.5);
        scores.put(MEMBER_BENEFIT, 0.5);
        scores.put(EQUITY_GROWTH, 0.4);
        scores.put(LOCAL_JOBS, 0.4);
        scores.put(COMMUNITY_VITALITY, 0.5);
        scores.put(RESILIENCE, 0.4);

        if (category == ProposalCategory.INFRASTRUCTURE) {
            scores.merge(RESILIENCE, 0.2, Double::sum);
            scores.merge(COMMUNITY_VITALITY, 0.1, Double::sum);
        } else if (category == ProposalCategory.BUSINESS_FUNDING) {
            scores.merge(LEAKAGE_REDUCTION, 0.2, Double::sum);
            scores.merge(LOCAL_JOBS, 0.2, Double::sum);
            scores.merge(MEMBER_BENEFIT, 0.1, Double::sum);
        } else if (category == ProposalCategory.TRANSPORT) {
            scores.merge(COMMUNITY_VITALITY, 0.2, Double::sum);
            scores.merge(MEMBER_BENEFIT, 0.1, Double::sum);
        }

        // Larger budgets can carry more impact, up to 2x of 100k
        double multiplier = 0.8 + budgetFactor * 0.2;
        scores.replaceAll((goal, score) -> Math.min(score * multiplier, 1.0));
        return scores;
    }

    List<CheckResult> runComplianceChecks(ProposalSubmission submission, CoopConfigSnapshot config) {
        List<CheckResult> checks = new ArrayList<>();

        if (submission.getLocalPercent() == null || submission.getNationalPercent() == null) {
            checks.add(CheckResult.fail(CHECK_TREASURY_ALLOCATION, "Treasury plan missing"));
        } else {
            int sum = submission.getLocalPercent() + submission.getNationalPercent();
            checks.add(sum == 100
                ? CheckResult.pass(CHECK_TREASURY_ALLOCATION)
                : CheckResult.fail(CHECK_TREASURY_ALLOCATION, "local+national=" + sum + " must equal 100"));
        }

        String text = (nullToEmpty(submission.getTitle()) + " " + nullToEmpty(submission.getSummary()))
            .toLowerCase(Locale.ROOT);

        boolean excluded = config.getSectorExclusions().stream()
            .anyMatch(keyword -> text.contains(keyword.toLowerCase(Locale.ROOT)));
        checks.add(excluded
            ? CheckResult.fail(CHECK_SECTOR_EXCLUSION, "Proposal appears to match excluded sectors")
            : CheckResult.pass(CHECK_SECTOR_EXCLUSION));

        boolean manipulation = MANIPULATION_PATTERNS.stream().anyMatch(text::contains);
        checks.add(manipulation
            ? CheckResult.fail(CHECK_MANIPULATION, "Detected language attempting to manipulate the evaluation")
            : CheckResult.pass(CHECK_MANIPULATION));

        boolean unrealistic = UNREALISTIC_CLAIMS.stream().anyMatch(text::contains);
        checks.add(unrealistic
            ? CheckResult.fail(CHECK_UNREALISTIC, "Detected unrealistic or overly optimistic claims")
            : CheckResult.pass(CHECK_UNREALISTIC));

        if (!config.getActiveCategories().isEmpty() && submission.getCategory() != null) {
            String key = submission.getCategory().name().toLowerCase(Locale.ROOT);
            checks.add(config.getActiveCategories().contains(key)
                ? CheckResult.pass(CHECK_CATEGORY)
                : CheckResult.fail(CHECK_CATEGORY, "Category " + key + " is not active"));
        }

        String charter = config.getCharterText();
        checks.add(charter != null && charter.length() > 50
            ? CheckResult.pass(CHECK_CHARTER)
            : CheckResult.fail(CHECK_CHARTER, "charter_missing"));

        return checks;
    }

    List<MissingData> findMissingData(ProposalSubmission submission) {
        List<MissingData> missing = new ArrayList<>();
        if (submission.getLocalPercent() == null || submission.getNationalPercent() == null) {
            missing.add(new MissingData("treasuryPlan",
                "Local/national allocation is needed to assess feasibility", true));
        }
        if (submission.getJobsCreated() == null || submission.getTimeHorizonMonths() == null) {
            missing.add(new MissingData("impact", "Impact estimate would refine goal scoring", false));
        }
        return missing;
    }

    List<Alternative> generateAlternatives(ProposalSubmission submission, Map<String, Double> goals,
                                           Map<String, Double> weights) {
        List<Alternative> alternatives = new ArrayList<>();

        Integer local = submission.getLocalPercent();
        if (local != null && local < 50) {
            Map<String, Double> improved = new LinkedHashMap<>(goals);
            improved.compute(LEAKAGE_REDUCTION, (goal, score) -> Math.min(score + 0.1, 1.0));
            improved.compute(COMMUNITY_VITALITY, (goal, score) -> Math.min(score + 0.1, 1.0));
            alternatives.add(new Alternative("Raise local allocation to 70%",
                "Keeping more of the budget local reduces leakage and supports community vitality",
                improved, weightedComposite(improved, weights)));
        }

        return alternatives;
    }

    private void decide(double goalComposite, List<CheckResult> checks, List<Alternative> alternatives,
                        List<MissingData> missing, Evaluation.EvaluationBuilder builder) {
        List<String> guardrailFailures = checks.stream()
            .filter(c -> !c.isPassed())
            .map(CheckResult::getName)
            .filter(name -> name.equals(CHECK_SECTOR_EXCLUSION) || name.equals(CHECK_MANIPULATION))
            .collect(Collectors.toList());
        if (!guardrailFailures.isEmpty()) {
            builder.decision(Decision.BLOCK)
                .reason("Failed guardrail checks: " + String.join(", ", guardrailFailures));
            return;
        }

        if (missing.stream().anyMatch(MissingData::isBlocking)) {
            builder.decision(Decision.BLOCK)
                .reason("Blocking missing data (feasibility/legal), supply before voting.");
            return;
        }

        Optional<Alternative> best = alternatives.stream()
            .max(Comparator.comparingDouble(Alternative::getComposite));
        if (best.isEmpty() || best.get().getComposite() <= goalComposite) {
            builder.decision(Decision.ADVANCE).reason("No superior alternative over charter goals.");
            return;
        }

        double diff = BigDecimal.valueOf(best.get().getComposite() - goalComposite)
            .setScale(3, RoundingMode.HALF_UP)
            .doubleValue();
        if (diff >= DOMINANCE_DELTA) {
            builder.decision(Decision.BLOCK)
                .reason(String.format("Dominated by '%s' (+%s composite).", best.get().getLabel(), diff));
        } else {
            builder.decision(Decision.REVISE)
                .reason(String.format("Improvement available: '%s' (+%s).", best.get().getLabel(), diff));
        }
    }

    private double weightedComposite(Map<String, Double> goals, Map<String, Double> weights) {
        double composite = 0;
        for (Map.Entry<String, Double> weight : weights.entrySet()) {
            composite += goals.getOrDefault(weight.getKey(), 0.0) * weight.getValue();
        }
        return clamp01(composite);
    }

    private static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.max(0, Math.min(1, value));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
