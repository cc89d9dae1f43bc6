package com.coopvault.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for exchanging USDC into reserve units.
 */
@Data
public class OnboardingRequest {

    @NotNull(message = "USDC amount is required")
    @Positive(message = "USDC amount must be positive")
    private BigDecimal usdcAmount;
}
