package com.coopvault.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for treasury withdrawals. Destination and amount checks happen in the service
 * so that a blank destination reports ZERO_ADDRESS and zero reports ZERO_AMOUNT.
 */
@Data
public class WithdrawalRequest {

    @NotNull(message = "Amount is required")
    private BigDecimal amount;

    private String destination;
}
