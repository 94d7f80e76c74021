package com.example.cloudinvestigator.service;

import com.example.cloudinvestigator.domain.AuditLog;
import com.example.cloudinvestigator.repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Records investigations and tool calls to the audit trail.
 * Writes are asynchronous; a failed write is logged and never reaches the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    public static final String INVESTIGATION_COMPLETED = "INVESTIGATION_COMPLETED";
    public static final String INVESTIGATION_FAILED = "INVESTIGATION_FAILED";
    public static final String INVESTIGATION_CANCELLED = "INVESTIGATION_CANCELLED";
    public static final String INVESTIGATION_REJECTED = "INVESTIGATION_REJECTED";
    public static final String TOOL_EXECUTED = "TOOL_EXECUTED";

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    @Async("auditExecutor")
    public void log(String actor, String action, String target, String provider,
                    Map<String, Object> details, String investigationId, boolean success) {
        try {
            AuditLog entry = AuditLog.builder()
                    .actor(actor)
                    .action(action)
                    .target(truncate(target, 1024))
                    .provider(provider)
                    .details(details != null ? truncate(objectMapper.writeValueAsString(details), 8192) : null)
                    .investigationId(investigationId)
                    .success(success)
                    .timestamp(Instant.now())
                    .build();
            auditLogRepository.save(entry);
            log.debug("Audit: [{}] {} -> {} ({})", actor, action, target, success ? "OK" : "FAIL");
        } catch (JsonProcessingException | DataAccessException e) {
            log.error("Failed to write audit log for {}: {}", action, e.getMessage());
        }
    }

    public List<AuditLog> getRecent(int limit) {
        return auditLogRepository.findAllPaged(PageRequest.of(0, Math.max(1, limit))).getContent();
    }

    public List<AuditLog> filter(String action, String provider) {
        return auditLogRepository.findFiltered(action, provider);
    }

    public List<AuditLog> getByInvestigation(String investigationId) {
        return auditLogRepository.findByInvestigationIdOrderByTimestampDesc(investigationId);
    }

    public long countByAction(String action) {
        return auditLogRepository.countByAction(action);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) return value;
        return value.substring(0, max);
    }
}
