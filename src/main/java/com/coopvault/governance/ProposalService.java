package com.coopvault.governance;

import com.coopvault.access.AccessControlService;
import com.coopvault.access.Role;
import com.coopvault.audit.AuditEventType;
import com.coopvault.audit.AuditService;
import com.coopvault.common.exception.ErrorKind;
import com.coopvault.common.exception.ForbiddenException;
import com.coopvault.common.exception.InvalidAmountException;
import com.coopvault.common.exception.InvalidStateException;
import com.coopvault.common.exception.NotFoundException;
import com.coopvault.coopconfig.CoopConfigService;
import com.coopvault.coopconfig.CoopConfigSnapshot;
import com.coopvault.scoring.Evaluation;
import com.coopvault.scoring.ProposalCategory;
import com.coopvault.scoring.ProposalSubmission;
import com.coopvault.scoring.ScoringEngine;
import com.coopvault.scoring.ScoringEngineException;
import com.coopvault.vault.VaultService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Proposal lifecycle: submission and scoring, routing to auto-approval or council
 * voting, council tally, withdrawal and admin status updates.
 *
 * Council votes lock the proposal row, so tallies for one proposal are computed one at
 * a time. A decision only ever moves a proposal out of VOTABLE; repeating the same
 * decision is a no-op.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProposalService {

    /**
     * Minimum number of council votes before a tally decides.
     */
    static final int COUNCIL_MIN_VOTES = 2;

    private static final Set<ProposalStatus> WITHDRAWABLE = EnumSet.of(ProposalStatus.SUBMITTED, ProposalStatus.VOTABLE);

    private final ProposalRepository proposalRepository;
    private final ProposalVoteRepository voteRepository;
    private final ProposalStateMachine stateMachine;
    private final ScoringEngine scoringEngine;
    private final CoopConfigService configService;
    private final VaultService vaultService;
    private final AccessControlService accessControl;
    private final AuditService auditService;

    /**
     * Create a proposal and score it. If the scoring engine is unavailable the
     * proposal is kept SUBMITTED without a decision and can be re-evaluated later.
     */
    @Transactional
    public Proposal submit(String caller, ProposalDraft draft) {
        if (caller == null || caller.isBlank()) {
            throw new ForbiddenException(caller, "submit proposals");
        }
        ProposalSubmission submission = draft.getSubmission();
        if (submission == null || submission.getTitle() == null || submission.getTitle().isBlank()) {
            throw new IllegalArgumentException("Proposal title is required");
        }
        if (submission.getCategory() == null) {
            throw new IllegalArgumentException("Proposal category is required");
        }
        requireBudget(submission.getBudgetAmount());

        CoopConfigSnapshot config = configService.activeSnapshot(vaultService.getCoopId());
        Proposal proposal = new Proposal(caller, draft.getProposerRole(), draft.getProposerDisplayName(),
            draft.getBudgetCurrency(), submission, config);
        proposal.setRegionName(draft.getRegionName());
        proposalRepository.save(proposal);

        auditService.record(AuditEventType.PROPOSAL_SUBMITTED, caller,
            AuditService.SUBJECT_PROPOSAL, proposal.getProposalId(),
            "budget=" + proposal.getBudgetAmount() + " " + proposal.getBudgetCurrency()
                + ", threshold=" + proposal.getCouncilThreshold());

        log.info("Proposal submitted: id={}, proposer={}, category={}, budget={} {}",
            proposal.getProposalId(), caller, proposal.getCategory(),
            proposal.getBudgetAmount(), proposal.getBudgetCurrency());

        try {
            evaluate(proposal, config, caller);
        } catch (ScoringEngineException e) {
            log.warn("Scoring unavailable for proposal {}, left SUBMITTED: {}",
                proposal.getProposalId(), e.getMessage());
        }
        return proposal;
    }

    /**
     * Score a proposal that was left SUBMITTED without a decision. Scoring failures
     * propagate to the caller.
     */
    @Transactional
    public Proposal reevaluate(String caller, String proposalId) {
        Proposal proposal = lockProposal(proposalId);
        if (!proposal.getProposerWallet().equals(caller) && !accessControl.hasRole(caller, Role.DEFAULT_ADMIN)) {
            throw new ForbiddenException(caller, "re-evaluate proposal " + proposalId);
        }
        if (proposal.getStatus() != ProposalStatus.SUBMITTED || proposal.isEvaluated()) {
            throw new InvalidStateException(ErrorKind.BAD_REQUEST_TRANSITION, "Proposal", proposalId,
                proposal.getStatus().name(), "re-evaluate");
        }

        CoopConfigSnapshot config = snapshotOf(proposal);
        evaluate(proposal, config, caller);
        return proposal;
    }

    /**
     * Proposer-only withdrawal from SUBMITTED or VOTABLE.
     */
    @Transactional
    public Proposal withdraw(String caller, String proposalId) {
        Proposal proposal = lockProposal(proposalId);
        if (!proposal.getProposerWallet().equals(caller)) {
            throw new ForbiddenException(caller, "withdraw proposal " + proposalId);
        }
        if (!WITHDRAWABLE.contains(proposal.getStatus())) {
            throw new InvalidStateException(ErrorKind.BAD_REQUEST_TRANSITION, "Proposal", proposalId,
                proposal.getStatus().name(), "withdraw");
        }

        ProposalStatus previous = proposal.getStatus();
        proposal.withdraw(caller);
        proposalRepository.save(proposal);

        auditService.record(AuditEventType.PROPOSAL_WITHDRAWN, caller,
            AuditService.SUBJECT_PROPOSAL, proposalId, "previous=" + previous);

        log.info("Proposal withdrawn: id={}, previous={}, by={}", proposalId, previous, caller);
        return proposal;
    }

    /**
     * Record a council vote, replacing the voter's earlier vote, and decide once at
     * least two votes are in: more FOR approves, more AGAINST rejects, a tie waits.
     */
    @Transactional
    public CouncilTally councilVote(String caller, String proposalId, VoteType vote) {
        accessControl.requireRole(caller, Role.DEFAULT_ADMIN, "cast council votes");
        if (vote == null) {
            throw new IllegalArgumentException("Vote is required");
        }

        Proposal proposal = lockProposal(proposalId);
        if (!proposal.isCouncilRequired() || proposal.getStatus() != ProposalStatus.VOTABLE) {
            throw new InvalidStateException(ErrorKind.BAD_REQUEST_TRANSITION, "Proposal", proposalId,
                proposal.getStatus().name(), "council vote");
        }

        voteRepository.findByProposalIdAndVoterWallet(proposalId, caller)
            .ifPresentOrElse(
                existing -> existing.change(vote),
                () -> voteRepository.save(new ProposalVote(proposalId, caller, vote)));
        voteRepository.flush();

        long forCount = voteRepository.countByProposalIdAndVote(proposalId, VoteType.FOR);
        long againstCount = voteRepository.countByProposalIdAndVote(proposalId, VoteType.AGAINST);
        long abstainCount = voteRepository.countByProposalIdAndVote(proposalId, VoteType.ABSTAIN);

        auditService.record(AuditEventType.PROPOSAL_VOTE_CAST, caller,
            AuditService.SUBJECT_PROPOSAL, proposalId,
            "vote=" + vote + ", for=" + forCount + ", against=" + againstCount + ", abstain=" + abstainCount);

        log.info("Council vote cast: proposal={}, voter={}, vote={}, tally={}/{}/{}",
            proposalId, caller, vote, forCount, againstCount, abstainCount);

        ProposalStatus newStatus = null;
        if (forCount + againstCount + abstainCount >= COUNCIL_MIN_VOTES) {
            ProposalStatus outcome = null;
            if (forCount > againstCount) {
                outcome = ProposalStatus.APPROVED;
            } else if (againstCount > forCount) {
                outcome = ProposalStatus.REJECTED;
            }
            if (outcome != null && proposal.decide(outcome)) {
                proposalRepository.save(proposal);
                newStatus = outcome;
                auditService.record(AuditEventType.PROPOSAL_STATUS_CHANGED, caller,
                    AuditService.SUBJECT_PROPOSAL, proposalId, "VOTABLE -> " + outcome + " by council tally");
                log.info("Proposal decided by council: id={}, status={}", proposalId, outcome);
            }
        }

        return CouncilTally.builder()
            .proposalId(proposalId)
            .vote(vote)
            .forCount(forCount)
            .againstCount(againstCount)
            .abstainCount(abstainCount)
            .newStatus(newStatus)
            .build();
    }

    @Transactional(readOnly = true)
    public CouncilTally getTally(String proposalId) {
        if (!proposalRepository.existsById(proposalId)) {
            throw new NotFoundException("Proposal", proposalId);
        }
        return CouncilTally.builder()
            .proposalId(proposalId)
            .forCount(voteRepository.countByProposalIdAndVote(proposalId, VoteType.FOR))
            .againstCount(voteRepository.countByProposalIdAndVote(proposalId, VoteType.AGAINST))
            .abstainCount(voteRepository.countByProposalIdAndVote(proposalId, VoteType.ABSTAIN))
            .build();
    }

    @Transactional(readOnly = true)
    public List<ProposalVote> getVotes(String proposalId) {
        return voteRepository.findByProposalIdOrderByCreatedAtAsc(proposalId);
    }

    /**
     * Admin status override, validated against the proposal state machine.
     */
    @Transactional
    public Proposal updateStatus(String caller, String proposalId, ProposalStatus newStatus) {
        accessControl.requireRole(caller, Role.DEFAULT_ADMIN, "update proposal status");

        Proposal proposal = lockProposal(proposalId);
        ProposalStatus previous = proposal.getStatus();
        stateMachine.validateTransition(proposalId, previous, newStatus);
        if (previous == newStatus) {
            log.debug("Proposal {} already {}, nothing to update", proposalId, newStatus);
            return proposal;
        }

        if (newStatus == ProposalStatus.WITHDRAWN) {
            proposal.withdraw(caller);
        } else {
            proposal.setStatus(newStatus);
            proposal.setUpdatedAt(Instant.now());
        }
        proposalRepository.save(proposal);

        auditService.record(AuditEventType.PROPOSAL_STATUS_CHANGED, caller,
            AuditService.SUBJECT_PROPOSAL, proposalId, previous + " -> " + newStatus);

        log.info("Proposal status updated: id={}, {} -> {}, by={}", proposalId, previous, newStatus, caller);
        return proposal;
    }

    @Transactional(readOnly = true)
    public Proposal getById(String proposalId) {
        return proposalRepository.findById(proposalId)
            .orElseThrow(() -> new NotFoundException("Proposal", proposalId));
    }

    @Transactional(readOnly = true)
    public Page<Proposal> list(ProposalStatus status, ProposalCategory category, String regionCode, Pageable pageable) {
        return proposalRepository.search(status, category, regionCode, pageable);
    }

    @Transactional(readOnly = true)
    public List<Proposal> getByProposer(String proposerWallet) {
        return proposalRepository.findByProposerWalletOrderByCreatedAtDesc(proposerWallet);
    }

    private void evaluate(Proposal proposal, CoopConfigSnapshot config, String actor) {
        Evaluation evaluation = scoringEngine.evaluate(proposal.toSubmission(), config);
        log.debug("Proposal {} scored by {}: decision={}, composite={}",
            proposal.getProposalId(), evaluation.getEngineVersion(), evaluation.getDecision(), evaluation.getComposite());

        proposal.applyEvaluation(evaluation);
        proposalRepository.save(proposal);

        auditService.record(AuditEventType.PROPOSAL_EVALUATED, actor,
            AuditService.SUBJECT_PROPOSAL, proposal.getProposalId(),
            "decision=" + proposal.getDecision() + ", composite=" + proposal.getComposite()
                + ", status=" + proposal.getStatus() + ", engine=" + proposal.getEngineVersion());

        log.info("Proposal evaluated: id={}, decision={}, status={}, councilRequired={}",
            proposal.getProposalId(), proposal.getDecision(), proposal.getStatus(), proposal.isCouncilRequired());
    }

    /**
     * Rebuild the config view a proposal was created under, with the current weights
     * and screens but the snapshotted thresholds.
     */
    private CoopConfigSnapshot snapshotOf(Proposal proposal) {
        CoopConfigSnapshot current = configService.activeSnapshot(proposal.getCoopId());
        return current.toBuilder()
            .version(proposal.getConfigVersion())
            .councilVoteThreshold(proposal.getCouncilThreshold())
            .quorumPercent(proposal.getQuorumPercent())
            .approvalThresholdPercent(proposal.getApprovalThresholdPercent())
            .votingWindowDays(proposal.getVotingWindowDays())
            .build();
    }

    private Proposal lockProposal(String proposalId) {
        return proposalRepository.findForUpdate(proposalId)
            .orElseThrow(() -> new NotFoundException("Proposal", proposalId));
    }

    private void requireBudget(BigDecimal budget) {
        if (budget == null || budget.signum() < 0) {
            throw new InvalidAmountException(ErrorKind.INVALID_AMOUNT,
                "Proposal budget must be a non-negative amount, got " + budget);
        }
    }
}
