package com.coopvault.api.dto;

import com.coopvault.governance.BudgetCurrency;
import com.coopvault.governance.ProposerRole;
import com.coopvault.scoring.ProposalCategory;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for submitting a governance proposal.
 */
@Data
public class SubmitProposalRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 255, message = "Title must be at most 255 characters")
    private String title;

    @Size(max = 4000, message = "Summary must be at most 4000 characters")
    private String summary;

    @NotNull(message = "Category is required")
    private ProposalCategory category;

    private String regionCode;

    private String regionName;

    private ProposerRole proposerRole = ProposerRole.MEMBER;

    private String proposerDisplayName;

    @NotNull(message = "Budget currency is required")
    private BudgetCurrency budgetCurrency;

    @NotNull(message = "Budget amount is required")
    @PositiveOrZero(message = "Budget amount must not be negative")
    private BigDecimal budgetAmount;

    @Min(value = 0, message = "Local percent must be between 0 and 100")
    @Max(value = 100, message = "Local percent must be between 0 and 100")
    private Integer localPercent;

    @Min(value = 0, message = "National percent must be between 0 and 100")
    @Max(value = 100, message = "National percent must be between 0 and 100")
    private Integer nationalPercent;

    @PositiveOrZero(message = "Jobs created must not be negative")
    private Integer jobsCreated;

    @PositiveOrZero(message = "Leakage reduction must not be negative")
    private BigDecimal leakageReductionUsd;

    @PositiveOrZero(message = "Time horizon must not be negative")
    private Integer timeHorizonMonths;
}
