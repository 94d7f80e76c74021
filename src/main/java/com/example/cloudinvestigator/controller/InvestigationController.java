package com.example.cloudinvestigator.controller;

import com.example.cloudinvestigator.domain.InvestigationRequest;
import com.example.cloudinvestigator.domain.InvestigationResult;
import com.example.cloudinvestigator.memory.AgentMemory;
import com.example.cloudinvestigator.memory.QueryPattern;
import com.example.cloudinvestigator.service.InvestigationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Investigation REST API Controller.
 */
@RestController
@RequestMapping("/api/investigations")
@RequiredArgsConstructor
public class InvestigationController {

    private final InvestigationService investigationService;
    private final AgentMemory memory;

    /**
     * Run an investigation to completion. Pass {@code id} to be able to cancel it while it runs.
     */
    @PostMapping
    public ResponseEntity<InvestigationResult> investigate(@RequestBody InvestigationRequest request,
                                                           @RequestParam(required = false) String id) {
        String investigationId = id != null && !id.isBlank() ? id : UUID.randomUUID().toString();
        return ResponseEntity.ok(investigationService.investigate(investigationId, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String id) {
        if (!investigationService.cancel(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                    "investigation_id", id,
                    "cancelled", false,
                    "message", "No running investigation with this id"));
        }
        return ResponseEntity.accepted().body(Map.of("investigation_id", id, "cancelled", true));
    }

    @GetMapping("/active")
    public ResponseEntity<Map<String, Object>> active() {
        return ResponseEntity.ok(Map.of("active", investigationService.activeInvestigations()));
    }

    @GetMapping("/memory")
    public ResponseEntity<Map<String, Object>> memoryStats(@RequestParam(defaultValue = "10") int lessons) {
        List<QueryPattern> patterns = memory.getPatterns();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("successes", memory.getSuccesses().size());
        stats.put("failures", memory.getFailures().size());
        stats.put("patterns", patterns.size());
        stats.put("recent_lessons", memory.recentLessons(lessons));
        stats.put("top_patterns", patterns.stream()
                .sorted(Comparator.comparingInt(QueryPattern::usageCount).reversed())
                .limit(10)
                .map(p -> Map.of(
                        "intent", p.intent(),
                        "usage_count", p.usageCount(),
                        "success_rate", p.successRate()))
                .collect(Collectors.toList()));
        return ResponseEntity.ok(stats);
    }
}
