package com.coopvault.api.controller;

import com.coopvault.api.dto.AddMembersRequest;
import com.coopvault.membership.CoopMember;
import com.coopvault.membership.MembershipService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for the membership registry.
 */
@RestController
@RequestMapping("/api/v1/members")
@RequiredArgsConstructor
@Tag(name = "Members", description = "Membership registry API")
public class MembershipController {

    private final MembershipService membershipService;

    @PostMapping
    @Operation(summary = "Register a batch of members")
    public ResponseEntity<List<CoopMember>> addMembers(@RequestHeader("X-Caller") String caller,
                                                       @Valid @RequestBody AddMembersRequest request) {
        return ResponseEntity.ok(membershipService.addMembers(caller, request.getPrincipals()));
    }

    @GetMapping("/{principal}")
    @Operation(summary = "Get a member")
    public ResponseEntity<CoopMember> getMember(@PathVariable String principal) {
        return ResponseEntity.ok(membershipService.getMember(principal));
    }

    @PostMapping("/{principal}/suspend")
    @Operation(summary = "Suspend a member")
    public ResponseEntity<CoopMember> suspend(@RequestHeader("X-Caller") String caller,
                                              @PathVariable String principal) {
        return ResponseEntity.ok(membershipService.suspend(caller, principal));
    }

    @PostMapping("/{principal}/reactivate")
    @Operation(summary = "Reactivate a suspended member")
    public ResponseEntity<CoopMember> reactivate(@RequestHeader("X-Caller") String caller,
                                                 @PathVariable String principal) {
        return ResponseEntity.ok(membershipService.reactivate(caller, principal));
    }
}
