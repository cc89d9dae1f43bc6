package com.coopvault.api.controller;

import com.coopvault.audit.AuditEvent;
import com.coopvault.audit.AuditService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/audit")
@RequiredArgsConstructor
@Tag(name = "Audit", description = "Audit trail API")
public class AuditController {

    private final AuditService auditService;

    @GetMapping
    @Operation(summary = "Get the audit trail of a subject")
    public ResponseEntity<List<AuditEvent>> getTrail(@RequestParam String subjectType,
                                                     @RequestParam(required = false) String subjectId) {
        return ResponseEntity.ok(auditService.getTrail(subjectType, subjectId));
    }
}
