package com.coopvault.governance;

import com.coopvault.scoring.ProposalSubmission;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a proposer hands in: the scored content plus who is proposing.
 */
@Value
@Builder
public class ProposalDraft {
    ProposerRole proposerRole;
    String proposerDisplayName;
    String regionName;
    BudgetCurrency budgetCurrency;
    ProposalSubmission submission;
}
