package com.coopvault.api.controller;

import com.coopvault.api.dto.ReasonRequest;
import com.coopvault.api.dto.RedeemRequest;
import com.coopvault.common.Currency;
import com.coopvault.common.Money;
import com.coopvault.redemption.RedemptionRequest;
import com.coopvault.redemption.RedemptionService;
import com.coopvault.redemption.RedemptionStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for the redemption lifecycle.
 */
@RestController
@RequestMapping("/api/v1/redemptions")
@RequiredArgsConstructor
@Tag(name = "Redemptions", description = "Reserve unit redemption API")
public class RedemptionController {

    private final RedemptionService redemptionService;

    @PostMapping
    @Operation(summary = "Escrow reserve units and open a redemption request")
    public ResponseEntity<RedemptionRequest> redeem(@RequestHeader("X-Caller") String caller,
                                                    @Valid @RequestBody RedeemRequest request) {
        RedemptionRequest redemption = redemptionService.redeem(caller,
            Money.of(request.getAmount(), Currency.UC), request.getIdempotencyKey());
        return ResponseEntity.status(HttpStatus.CREATED).body(redemption);
    }

    @PostMapping("/{requestId}/fulfill")
    @Operation(summary = "Burn escrowed units and pay out reserve currency")
    public ResponseEntity<RedemptionRequest> fulfill(@RequestHeader("X-Caller") String caller,
                                                     @PathVariable String requestId) {
        return ResponseEntity.ok(redemptionService.fulfill(caller, requestId));
    }

    @PostMapping("/{requestId}/cancel")
    @Operation(summary = "Return escrowed units to the requester")
    public ResponseEntity<RedemptionRequest> cancel(@RequestHeader("X-Caller") String caller,
                                                    @PathVariable String requestId) {
        return ResponseEntity.ok(redemptionService.cancel(caller, requestId));
    }

    @PostMapping("/{requestId}/forfeit")
    @Operation(summary = "Burn escrowed units without payout")
    public ResponseEntity<RedemptionRequest> forfeit(@RequestHeader("X-Caller") String caller,
                                                     @PathVariable String requestId,
                                                     @RequestBody ReasonRequest request) {
        return ResponseEntity.ok(redemptionService.forfeit(caller, requestId, request.getReason()));
    }

    @PostMapping("/{requestId}/emergency-resolve")
    @Operation(summary = "Mark a request as resolved out of band")
    public ResponseEntity<RedemptionRequest> emergencyResolve(@RequestHeader("X-Caller") String caller,
                                                              @PathVariable String requestId,
                                                              @RequestBody(required = false) ReasonRequest request) {
        String note = request != null ? request.getReason() : null;
        return ResponseEntity.ok(redemptionService.markEmergencyResolved(caller, requestId, note));
    }

    @GetMapping("/{requestId}")
    @Operation(summary = "Get redemption details")
    public ResponseEntity<RedemptionRequest> getRedemption(@PathVariable String requestId) {
        return ResponseEntity.ok(redemptionService.getRedemption(requestId));
    }

    @GetMapping
    @Operation(summary = "List redemptions by status and/or requester")
    public ResponseEntity<List<RedemptionRequest>> findRedemptions(
            @RequestParam(required = false) RedemptionStatus status,
            @RequestParam(required = false) String requester) {
        return ResponseEntity.ok(redemptionService.findRedemptions(status, requester));
    }
}
