package com.example.cloudinvestigator.controller;

import com.example.cloudinvestigator.agent.AgentTool;
import com.example.cloudinvestigator.agent.ToolContext;
import com.example.cloudinvestigator.agent.ToolRegistry;
import com.example.cloudinvestigator.agent.ToolResult;
import com.example.cloudinvestigator.config.InvestigatorProperties;
import com.example.cloudinvestigator.domain.Deadline;
import com.example.cloudinvestigator.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Direct tool invocation API.
 */
@Slf4j
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
public class ToolController {

    private final ToolRegistry toolRegistry;
    private final AuditService auditService;
    private final InvestigatorProperties properties;

    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> listTools() {
        return ResponseEntity.ok(toolRegistry.listToolsDetailed());
    }

    @PostMapping("/{toolName}")
    public ResponseEntity<Map<String, Object>> execute(@PathVariable String toolName,
                                                       @RequestBody Map<String, Object> parameters) {
        Optional<AgentTool> tool = toolRegistry.getTool(toolName);
        if (tool.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("success", false, "error", "Unknown tool: " + toolName));
        }

        ToolContext context = ToolContext.builder()
                .sessionId(UUID.randomUUID().toString())
                .actor("api")
                .deadline(Deadline.after(Duration.ofSeconds(properties.getSteampipe().getTimeoutSeconds())))
                .build();
        ToolResult result = tool.get().execute(parameters, context);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("query", String.valueOf(parameters.get("query")));
        if (result.getError() != null) {
            details.put("error", result.getError());
        }
        auditService.log(context.getActor(), AuditService.TOOL_EXECUTED, toolName,
                parameters.get("provider") != null ? parameters.get("provider").toString() : null,
                details, context.getSessionId(), result.isSuccess());

        if (result.isInvalidInput()) {
            return ResponseEntity.badRequest().body(result.getPayload());
        }
        return ResponseEntity.ok(result.getPayload());
    }
}
