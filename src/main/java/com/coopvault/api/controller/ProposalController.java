package com.coopvault.api.controller;

import com.coopvault.api.dto.CouncilVoteRequest;
import com.coopvault.api.dto.StatusUpdateRequest;
import com.coopvault.api.dto.SubmitProposalRequest;
import com.coopvault.governance.CouncilTally;
import com.coopvault.governance.Proposal;
import com.coopvault.governance.ProposalDraft;
import com.coopvault.governance.ProposalService;
import com.coopvault.governance.ProposalStatus;
import com.coopvault.governance.ProposalVote;
import com.coopvault.scoring.ProposalCategory;
import com.coopvault.scoring.ProposalSubmission;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for governance proposals and council votes.
 */
@RestController
@RequestMapping("/api/v1/proposals")
@RequiredArgsConstructor
@Tag(name = "Proposals", description = "Governance proposal API")
public class ProposalController {

    private static final int MAX_PAGE_SIZE = 100;

    private final ProposalService proposalService;

    @PostMapping
    @Operation(summary = "Submit a proposal for scoring and routing")
    public ResponseEntity<Proposal> submit(@RequestHeader("X-Caller") String caller,
                                           @Valid @RequestBody SubmitProposalRequest request) {
        ProposalSubmission submission = ProposalSubmission.builder()
            .title(request.getTitle())
            .summary(request.getSummary())
            .category(request.getCategory())
            .regionCode(request.getRegionCode())
            .budgetAmount(request.getBudgetAmount())
            .localPercent(request.getLocalPercent())
            .nationalPercent(request.getNationalPercent())
            .jobsCreated(request.getJobsCreated())
            .leakageReductionUsd(request.getLeakageReductionUsd())
            .timeHorizonMonths(request.getTimeHorizonMonths())
            .build();

        Proposal proposal = proposalService.submit(caller, ProposalDraft.builder()
            .proposerRole(request.getProposerRole())
            .proposerDisplayName(request.getProposerDisplayName())
            .regionName(request.getRegionName())
            .budgetCurrency(request.getBudgetCurrency())
            .submission(submission)
            .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(proposal);
    }

    @GetMapping("/{proposalId}")
    @Operation(summary = "Get proposal details")
    public ResponseEntity<Proposal> getProposal(@PathVariable String proposalId) {
        return ResponseEntity.ok(proposalService.getById(proposalId));
    }

    @GetMapping
    @Operation(summary = "List proposals, newest first")
    public ResponseEntity<Page<Proposal>> list(@RequestParam(required = false) ProposalStatus status,
                                               @RequestParam(required = false) ProposalCategory category,
                                               @RequestParam(required = false) String regionCode,
                                               @RequestParam(defaultValue = "0") int page,
                                               @RequestParam(defaultValue = "20") int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE),
            Sort.by(Sort.Direction.DESC, "createdAt"));
        return ResponseEntity.ok(proposalService.list(status, category, regionCode, pageable));
    }

    @GetMapping("/by-proposer/{wallet}")
    @Operation(summary = "List proposals submitted by a wallet")
    public ResponseEntity<List<Proposal>> getByProposer(@PathVariable String wallet) {
        return ResponseEntity.ok(proposalService.getByProposer(wallet));
    }

    @PostMapping("/{proposalId}/withdraw")
    @Operation(summary = "Withdraw a proposal (proposer only)")
    public ResponseEntity<Proposal> withdraw(@RequestHeader("X-Caller") String caller,
                                             @PathVariable String proposalId) {
        return ResponseEntity.ok(proposalService.withdraw(caller, proposalId));
    }

    @PostMapping("/{proposalId}/council-votes")
    @Operation(summary = "Cast or change a council vote")
    public ResponseEntity<CouncilTally> councilVote(@RequestHeader("X-Caller") String caller,
                                                    @PathVariable String proposalId,
                                                    @Valid @RequestBody CouncilVoteRequest request) {
        return ResponseEntity.ok(proposalService.councilVote(caller, proposalId, request.getVote()));
    }

    @GetMapping("/{proposalId}/council-votes")
    @Operation(summary = "Get the council tally")
    public ResponseEntity<CouncilTally> getTally(@PathVariable String proposalId) {
        return ResponseEntity.ok(proposalService.getTally(proposalId));
    }

    @GetMapping("/{proposalId}/council-votes/detail")
    @Operation(summary = "List individual council votes")
    public ResponseEntity<List<ProposalVote>> getVotes(@PathVariable String proposalId) {
        return ResponseEntity.ok(proposalService.getVotes(proposalId));
    }

    @PutMapping("/{proposalId}/status")
    @Operation(summary = "Admin status update")
    public ResponseEntity<Proposal> updateStatus(@RequestHeader("X-Caller") String caller,
                                                 @PathVariable String proposalId,
                                                 @Valid @RequestBody StatusUpdateRequest request) {
        return ResponseEntity.ok(proposalService.updateStatus(caller, proposalId, request.getStatus()));
    }

    @PostMapping("/{proposalId}/reevaluate")
    @Operation(summary = "Retry scoring for an unscored proposal")
    public ResponseEntity<Proposal> reevaluate(@RequestHeader("X-Caller") String caller,
                                               @PathVariable String proposalId) {
        return ResponseEntity.ok(proposalService.reevaluate(caller, proposalId));
    }
}
