package com.example.cloudinvestigator.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit trail entry for investigations and direct tool calls.
 */
@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_action", columnList = "action"),
        @Index(name = "idx_audit_investigation", columnList = "investigation_id"),
        @Index(name = "idx_audit_timestamp", columnList = "timestamp")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    /** "api", "agent" or "system" */
    @Column(nullable = false)
    private String actor;

    /** INVESTIGATION_COMPLETED, INVESTIGATION_FAILED, INVESTIGATION_CANCELLED, INVESTIGATION_REJECTED, TOOL_EXECUTED */
    @Column(nullable = false)
    private String action;

    /** Tool name or investigation prompt */
    @Column(length = 1024)
    private String target;

    private String provider;

    /** JSON details */
    @Column(length = 8192)
    private String details;

    @Column(name = "investigation_id")
    private String investigationId;

    @Builder.Default
    private boolean success = true;

    @Column(nullable = false)
    private Instant timestamp;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) timestamp = Instant.now();
    }
}
