package com.coopvault.api.controller;

import com.coopvault.api.dto.WithdrawalRequest;
import com.coopvault.common.Currency;
import com.coopvault.common.Money;
import com.coopvault.treasury.TreasuryService;
import com.coopvault.treasury.TreasuryWithdrawal;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for treasury withdrawals.
 */
@RestController
@RequestMapping("/api/v1/treasury")
@RequiredArgsConstructor
@Tag(name = "Treasury", description = "Treasury withdrawal API")
public class TreasuryController {

    private final TreasuryService treasuryService;

    @PostMapping("/withdrawals")
    @Operation(summary = "Move reserve units from vault custody to a treasury address")
    public ResponseEntity<TreasuryWithdrawal> withdrawToTreasury(@RequestHeader("X-Caller") String caller,
                                                                 @Valid @RequestBody WithdrawalRequest request) {
        return ResponseEntity.ok(treasuryService.withdrawToTreasury(caller,
            Money.of(request.getAmount(), Currency.UC), request.getDestination()));
    }

    @PostMapping("/emergency-withdrawals")
    @Operation(summary = "Incident-response withdrawal of reserve units")
    public ResponseEntity<TreasuryWithdrawal> emergencyWithdraw(@RequestHeader("X-Caller") String caller,
                                                                @Valid @RequestBody WithdrawalRequest request) {
        return ResponseEntity.ok(treasuryService.emergencyWithdraw(caller,
            Money.of(request.getAmount(), Currency.UC), request.getDestination()));
    }

    @PostMapping("/reserve-withdrawals")
    @Operation(summary = "Pay reserve currency out of custody")
    public ResponseEntity<TreasuryWithdrawal> withdrawReserveCurrency(@RequestHeader("X-Caller") String caller,
                                                                      @Valid @RequestBody WithdrawalRequest request) {
        return ResponseEntity.ok(treasuryService.withdrawReserveCurrency(caller,
            Money.of(request.getAmount(), Currency.USDC), request.getDestination()));
    }
}
