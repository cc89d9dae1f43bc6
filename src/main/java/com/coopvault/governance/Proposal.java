package com.coopvault.governance;

import com.coopvault.common.exception.ErrorKind;
import com.coopvault.common.exception.InvalidStateException;
import com.coopvault.coopconfig.CoopConfigSnapshot;
import com.coopvault.scoring.Alternative;
import com.coopvault.scoring.CheckResult;
import com.coopvault.scoring.Decision;
import com.coopvault.scoring.Evaluation;
import com.coopvault.scoring.ProposalCategory;
import com.coopvault.scoring.ProposalSubmission;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A governance proposal with its scoring outcome and routing.
 *
 * Governance thresholds are copied from the coop configuration at creation and never
 * re-read, so later config changes do not move proposals already in flight.
 */
@Entity
@Table(name = "proposals", indexes = {
    @Index(name = "idx_proposal_status", columnList = "status"),
    @Index(name = "idx_proposal_proposer", columnList = "proposer_wallet")
})
@Data
@NoArgsConstructor
public class Proposal {

    @Id
    private String proposalId;

    @Column(nullable = false)
    private String coopId;

    @Column(nullable = false)
    private String title;

    @Column(length = 4000)
    private String summary;

    @Enumerated(EnumType.STRING)
    private ProposalCategory category;

    private String regionCode;

    private String regionName;

    @Column(name = "proposer_wallet", nullable = false)
    private String proposerWallet;

    @Enumerated(EnumType.STRING)
    private ProposerRole proposerRole;

    private String proposerDisplayName;

    @Enumerated(EnumType.STRING)
    private BudgetCurrency budgetCurrency;

    @Column(precision = 19, scale = 2)
    private BigDecimal budgetAmount;

    private Integer localPercent;

    private Integer nationalPercent;

    private Integer jobsCreated;

    @Column(precision = 19, scale = 2)
    private BigDecimal leakageReductionUsd;

    private Integer timeHorizonMonths;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProposalStatus status;

    private Double alignment;

    private Double feasibility;

    private Double composite;

    @Enumerated(EnumType.STRING)
    private Decision decision;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "proposal_goal_scores", joinColumns = @JoinColumn(name = "proposal_id"))
    @MapKeyColumn(name = "goal")
    @Column(name = "score")
    private Map<String, Double> goalScores = new HashMap<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "proposal_decision_reasons", joinColumns = @JoinColumn(name = "proposal_id"))
    @OrderColumn(name = "position")
    @Column(name = "reason", length = 1000)
    private List<String> decisionReasons = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "proposal_checks", joinColumns = @JoinColumn(name = "proposal_id"))
    @OrderColumn(name = "position")
    private List<ComplianceCheck> checks = new ArrayList<>();

    private String bestAlternative;

    private Double bestAlternativeComposite;

    private boolean councilRequired;

    @Column(precision = 19, scale = 2)
    private BigDecimal councilThreshold;

    private Integer configVersion;

    private int quorumPercent;

    private int approvalThresholdPercent;

    private int votingWindowDays;

    private String engineVersion;

    private Instant evaluatedAt;

    private Instant withdrawnAt;

    private String withdrawnBy;

    @Version
    private Long version;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Proposal(String proposerWallet, ProposerRole proposerRole, String proposerDisplayName,
                    BudgetCurrency budgetCurrency, ProposalSubmission submission, CoopConfigSnapshot config) {
        this.proposalId = UUID.randomUUID().toString();
        this.coopId = config.getCoopId();
        this.title = submission.getTitle();
        this.summary = submission.getSummary();
        this.category = submission.getCategory();
        this.regionCode = submission.getRegionCode();
        this.proposerWallet = proposerWallet;
        this.proposerRole = proposerRole;
        this.proposerDisplayName = proposerDisplayName;
        this.budgetCurrency = budgetCurrency;
        this.budgetAmount = submission.getBudgetAmount();
        this.localPercent = submission.getLocalPercent();
        this.nationalPercent = submission.getNationalPercent();
        this.jobsCreated = submission.getJobsCreated();
        this.leakageReductionUsd = submission.getLeakageReductionUsd();
        this.timeHorizonMonths = submission.getTimeHorizonMonths();
        this.status = ProposalStatus.SUBMITTED;
        this.councilThreshold = config.getCouncilVoteThreshold();
        this.configVersion = config.getVersion();
        this.quorumPercent = config.getQuorumPercent();
        this.approvalThresholdPercent = config.getApprovalThresholdPercent();
        this.votingWindowDays = config.getVotingWindowDays();
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public ProposalSubmission toSubmission() {
        return ProposalSubmission.builder()
            .title(title)
            .summary(summary)
            .category(category)
            .regionCode(regionCode)
            .budgetAmount(budgetAmount)
            .localPercent(localPercent)
            .nationalPercent(nationalPercent)
            .jobsCreated(jobsCreated)
            .leakageReductionUsd(leakageReductionUsd)
            .timeHorizonMonths(timeHorizonMonths)
            .build();
    }

    public boolean isEvaluated() {
        return decision != null;
    }

    /**
     * Store a scoring result and route the proposal: advance below the council threshold
     * approves, advance at or above it opens council voting, anything else stays
     * SUBMITTED.
     */
    public void applyEvaluation(Evaluation evaluation) {
        if (status != ProposalStatus.SUBMITTED) {
            throw new InvalidStateException(ErrorKind.BAD_REQUEST_TRANSITION, "Proposal", proposalId,
                status.name(), "apply evaluation");
        }

        this.decision = evaluation.getDecision();
        this.alignment = evaluation.getAlignment();
        this.feasibility = evaluation.getFeasibility();
        this.composite = evaluation.getComposite();
        this.engineVersion = evaluation.getEngineVersion();
        this.goalScores = new HashMap<>(evaluation.getGoalScores());
        this.decisionReasons = new ArrayList<>(evaluation.getReasons());
        this.checks = evaluation.getChecks().stream()
            .map(this::toComplianceCheck)
            .collect(Collectors.toList());

        Alternative best = evaluation.getAlternatives().stream()
            .max(Comparator.comparingDouble(Alternative::getComposite))
            .orElse(null);
        this.bestAlternative = best != null ? best.getLabel() : null;
        this.bestAlternativeComposite = best != null ? best.getComposite() : null;

        if (decision == Decision.ADVANCE) {
            if (budgetAmount.compareTo(councilThreshold) < 0) {
                this.status = ProposalStatus.APPROVED;
                this.councilRequired = false;
            } else {
                this.status = ProposalStatus.VOTABLE;
                this.councilRequired = true;
            }
        }

        this.evaluatedAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    /**
     * Apply a council outcome. Deciding to the current status is a no-op; any other
     * decision needs the proposal to still be VOTABLE.
     *
     * @return true if the status changed
     */
    public boolean decide(ProposalStatus outcome) {
        if (status == outcome) {
            return false;
        }
        if (status != ProposalStatus.VOTABLE) {
            throw new InvalidStateException(ErrorKind.BAD_REQUEST_TRANSITION, "Proposal", proposalId,
                status.name(), "decide " + outcome);
        }
        this.status = outcome;
        this.updatedAt = Instant.now();
        return true;
    }

    public void withdraw(String by) {
        this.status = ProposalStatus.WITHDRAWN;
        this.withdrawnAt = Instant.now();
        this.withdrawnBy = by;
        this.updatedAt = Instant.now();
    }

    private ComplianceCheck toComplianceCheck(CheckResult result) {
        return new ComplianceCheck(result.getName(), result.isPassed(), result.getNote());
    }
}
