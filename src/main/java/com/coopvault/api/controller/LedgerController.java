package com.coopvault.api.controller;

import com.coopvault.common.Money;
import com.coopvault.ledger.LedgerEntry;
import com.coopvault.ledger.LedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read-only REST API over the reserve unit ledger.
 */
@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
@Tag(name = "Ledger", description = "Reserve unit ledger API")
public class LedgerController {

    private final LedgerService ledgerService;

    @GetMapping("/accounts/{accountId}/balance")
    @Operation(summary = "Get an account balance")
    public ResponseEntity<Money> getBalance(@PathVariable String accountId) {
        return ResponseEntity.ok(ledgerService.balanceOf(accountId));
    }

    @GetMapping("/accounts/{accountId}/entries")
    @Operation(summary = "Get ledger entries touching an account")
    public ResponseEntity<List<LedgerEntry>> getEntries(@PathVariable String accountId) {
        return ResponseEntity.ok(ledgerService.getAccountLedger(accountId));
    }

    @GetMapping("/supply")
    @Operation(summary = "Get total reserve unit supply")
    public ResponseEntity<Money> getTotalSupply() {
        return ResponseEntity.ok(ledgerService.totalSupply());
    }
}
