package com.example.cloudinvestigator.controller;

import com.example.cloudinvestigator.domain.AuditLog;
import com.example.cloudinvestigator.service.AuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Audit Trail REST API Controller.
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditService auditService;

    @GetMapping
    public ResponseEntity<List<AuditLog>> getAuditLogs(
            @RequestParam(required = false) String action,
            @RequestParam(required = false) String provider,
            @RequestParam(defaultValue = "100") int limit) {
        if (action == null && provider == null) {
            return ResponseEntity.ok(auditService.getRecent(limit));
        }
        return ResponseEntity.ok(auditService.filter(action, provider));
    }

    @GetMapping("/investigation/{investigationId}")
    public ResponseEntity<List<AuditLog>> getByInvestigation(@PathVariable String investigationId) {
        return ResponseEntity.ok(auditService.getByInvestigation(investigationId));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(Map.of(
                "investigations_completed", auditService.countByAction(AuditService.INVESTIGATION_COMPLETED),
                "investigations_failed", auditService.countByAction(AuditService.INVESTIGATION_FAILED),
                "investigations_cancelled", auditService.countByAction(AuditService.INVESTIGATION_CANCELLED),
                "investigations_rejected", auditService.countByAction(AuditService.INVESTIGATION_REJECTED),
                "tool_executions", auditService.countByAction(AuditService.TOOL_EXECUTED)
        ));
    }
}
