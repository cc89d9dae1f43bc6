package com.coopvault.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for setting a redemption cap. Zero removes the cap.
 */
@Data
public class CapRequest {

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    private BigDecimal amount;
}
