package com.coopvault.api.controller;

import com.coopvault.api.dto.CapRequest;
import com.coopvault.api.dto.ClearingAccountRequest;
import com.coopvault.api.dto.OnboardingRequest;
import com.coopvault.common.Currency;
import com.coopvault.common.Money;
import com.coopvault.vault.VaultOverview;
import com.coopvault.vault.VaultReserve;
import com.coopvault.vault.VaultService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for vault configuration and reserve bookkeeping.
 */
@RestController
@RequestMapping("/api/v1/vault")
@RequiredArgsConstructor
@Tag(name = "Vault", description = "Vault reserve and limits API")
public class VaultController {

    private final VaultService vaultService;

    @GetMapping
    @Operation(summary = "Get vault balances, caps and the current daily window")
    public ResponseEntity<VaultOverview> overview() {
        return ResponseEntity.ok(vaultService.overview());
    }

    @PutMapping("/limits/per-user")
    @Operation(summary = "Set the per-request redemption cap (0 = unlimited)")
    public ResponseEntity<VaultReserve> setMaxRedemptionPerUser(@RequestHeader("X-Caller") String caller,
                                                                @Valid @RequestBody CapRequest request) {
        return ResponseEntity.ok(vaultService.setMaxRedemptionPerUser(caller,
            Money.of(request.getAmount(), Currency.UC)));
    }

    @PutMapping("/limits/daily")
    @Operation(summary = "Set the daily aggregate redemption cap (0 = unlimited)")
    public ResponseEntity<VaultReserve> setMaxDailyRedemptions(@RequestHeader("X-Caller") String caller,
                                                               @Valid @RequestBody CapRequest request) {
        return ResponseEntity.ok(vaultService.setMaxDailyRedemptions(caller,
            Money.of(request.getAmount(), Currency.UC)));
    }

    @PostMapping("/onboarding")
    @Operation(summary = "Exchange USDC for reserve units")
    public ResponseEntity<Money> processOnboarding(@RequestHeader("X-Caller") String caller,
                                                   @Valid @RequestBody OnboardingRequest request) {
        return ResponseEntity.ok(vaultService.processOnboarding(caller,
            Money.of(request.getUsdcAmount(), Currency.USDC)));
    }

    @PostMapping("/reserve/resync")
    @Operation(summary = "Overwrite the cached reserve with the live custody balance")
    public ResponseEntity<VaultReserve> resyncReserve(@RequestHeader("X-Caller") String caller) {
        return ResponseEntity.ok(vaultService.resyncReserve(caller));
    }

    @PutMapping("/clearing-account")
    @Operation(summary = "Set the clearing account")
    public ResponseEntity<VaultReserve> setClearingAccount(@RequestHeader("X-Caller") String caller,
                                                           @RequestBody ClearingAccountRequest request) {
        return ResponseEntity.ok(vaultService.setClearingAccount(caller, request.getClearingAccount()));
    }
}
