package com.coopvault.scoring;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Proposal fields handed to a scoring engine.
 */
@Value
@Builder
public class ProposalSubmission {
    String title;
    String summary;
    ProposalCategory category;
    String regionCode;
    BigDecimal budgetAmount;

    /**
     * Treasury plan split; null when the proposer did not provide one.
     */
    Integer localPercent;
    Integer nationalPercent;

    Integer jobsCreated;
    BigDecimal leakageReductionUsd;
    Integer timeHorizonMonths;
}
