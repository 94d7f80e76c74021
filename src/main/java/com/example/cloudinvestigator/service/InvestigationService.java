package com.example.cloudinvestigator.service;

import com.example.cloudinvestigator.agent.InvestigationAgent;
import com.example.cloudinvestigator.config.InvestigatorProperties;
import com.example.cloudinvestigator.domain.Deadline;
import com.example.cloudinvestigator.domain.InvestigationException;
import com.example.cloudinvestigator.domain.InvestigationRequest;
import com.example.cloudinvestigator.domain.InvestigationResult;
import com.example.cloudinvestigator.domain.InvestigationState;
import com.example.cloudinvestigator.domain.Provider;
import com.example.cloudinvestigator.memory.AgentMemoryStore;
import com.example.cloudinvestigator.query.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs investigations on behalf of API callers.
 * <p>
 * Assigns the investigation id and deadline, tracks running investigations
 * so they can be cancelled, and records the outcome to the audit trail and
 * metrics. Memory is saved after every investigation, whatever the outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InvestigationService {

    private final InvestigationAgent agent;
    private final AgentMemoryStore memoryStore;
    private final AuditService auditService;
    private final MeterRegistry meterRegistry;
    private final InvestigatorProperties properties;

    private final Map<String, Deadline> active = new ConcurrentHashMap<>();

    public InvestigationResult investigate(InvestigationRequest request) {
        return investigate(UUID.randomUUID().toString(), request);
    }

    /**
     * Run an investigation under a caller-chosen id, so it can be cancelled
     * through {@link #cancel(String)} while it runs.
     */
    public InvestigationResult investigate(String investigationId, InvestigationRequest request) {
        Deadline deadline = Deadline.after(Duration.ofSeconds(properties.getInvestigation().getTimeoutSeconds()));
        if (active.putIfAbsent(investigationId, deadline) != null) {
            throw new IllegalArgumentException("Investigation " + investigationId + " is already running");
        }
        String provider = request != null ? request.getProvider() : null;
        String prompt = request != null ? request.getPrompt() : null;
        try {
            InvestigationResult result = agent.investigate(investigationId, request, deadline);
            record(result.getState().name().toLowerCase(Locale.ROOT), provider);
            auditService.log("api", auditAction(result), prompt, provider, auditDetails(result),
                    investigationId, result.isSuccess());
            return result;
        } catch (InvestigationException e) {
            record("rejected", provider);
            auditService.log("api", AuditService.INVESTIGATION_REJECTED, prompt, provider,
                    Map.of("error", String.valueOf(e.getMessage()), "type", e.getClass().getSimpleName()),
                    investigationId, false);
            throw e;
        } finally {
            active.remove(investigationId);
            memoryStore.save();
        }
    }

    /**
     * @return true if a running investigation with this id was signalled
     */
    public boolean cancel(String investigationId) {
        Deadline deadline = active.get(investigationId);
        if (deadline == null) {
            return false;
        }
        deadline.cancel();
        log.info("Cancellation requested for investigation {}", investigationId);
        return true;
    }

    public Set<String> activeInvestigations() {
        return Set.copyOf(active.keySet());
    }

    private static String auditAction(InvestigationResult result) {
        if (result.getState() == InvestigationState.FAILED) {
            return ErrorType.CANCELLED.label().equals(result.getError())
                    ? AuditService.INVESTIGATION_CANCELLED : AuditService.INVESTIGATION_FAILED;
        }
        return result.isSuccess() ? AuditService.INVESTIGATION_COMPLETED : AuditService.INVESTIGATION_FAILED;
    }

    private static Map<String, Object> auditDetails(InvestigationResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("state", result.getState().name());
        details.put("query_count", result.getQueryCount());
        details.put("confidence", result.getConfidence());
        details.put("duration_ms", result.getDurationMs());
        if (result.getError() != null) {
            details.put("error", result.getError());
        }
        return details;
    }

    private void record(String outcome, String provider) {
        Counter.builder("cloud.investigation.total")
                .tag("outcome", outcome)
                .tag("provider", Provider.fromId(provider).map(Provider::getId).orElse("invalid"))
                .register(meterRegistry)
                .increment();
    }
}
