package com.coopvault.api.controller;

import com.coopvault.access.AccessControlService;
import com.coopvault.access.Role;
import com.coopvault.access.RoleGrant;
import com.coopvault.api.dto.AdminTransferRequest;
import com.coopvault.api.dto.RoleRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Set;

/**
 * REST API for role management and admin hand-over.
 */
@RestController
@RequestMapping("/api/v1/access")
@RequiredArgsConstructor
@Tag(name = "Access", description = "Role and capability API")
public class AccessController {

    private final AccessControlService accessControl;

    @PostMapping("/roles")
    @Operation(summary = "Grant a role")
    public ResponseEntity<RoleGrant> grantRole(@RequestHeader("X-Caller") String caller,
                                               @Valid @RequestBody RoleRequest request) {
        RoleGrant grant = accessControl.grantRole(caller, request.getPrincipal(), request.getRole());
        return ResponseEntity.status(HttpStatus.CREATED).body(grant);
    }

    @DeleteMapping("/roles")
    @Operation(summary = "Revoke a role")
    public ResponseEntity<Void> revokeRole(@RequestHeader("X-Caller") String caller,
                                           @Valid @RequestBody RoleRequest request) {
        accessControl.revokeRole(caller, request.getPrincipal(), request.getRole());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/admin-transfer")
    @Operation(summary = "Grant admin to a new principal (phase one)")
    public ResponseEntity<RoleGrant> initiateAdminTransfer(@RequestHeader("X-Caller") String caller,
                                                           @RequestBody AdminTransferRequest request) {
        return ResponseEntity.ok(accessControl.initiateAdminTransfer(caller, request.getNewAdmin()));
    }

    @PostMapping("/admin-transfer/complete")
    @Operation(summary = "Renounce the caller's admin role (phase two)")
    public ResponseEntity<Void> completeAdminTransfer(@RequestHeader("X-Caller") String caller) {
        accessControl.completeAdminTransfer(caller);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/roles/{principal}")
    @Operation(summary = "Get the roles held by a principal")
    public ResponseEntity<Set<Role>> getRoles(@PathVariable String principal) {
        return ResponseEntity.ok(accessControl.rolesOf(principal));
    }
}
