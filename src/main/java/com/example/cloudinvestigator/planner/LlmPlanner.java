package com.example.cloudinvestigator.planner;

import com.example.cloudinvestigator.domain.Deadline;
import com.example.cloudinvestigator.domain.InvestigationStep;
import com.example.cloudinvestigator.domain.Provider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Planner backed by a chat completion model.
 * The model is asked for a JSON array of {description, query} steps.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmPlanner implements Planner {

    private static final Duration MAX_CALL = Duration.ofMinutes(10);

    static final String PLAN_SYSTEM_PROMPT = """
            You are a cloud infrastructure investigator that writes Steampipe SQL.
            Create a step-by-step investigation plan for the user's objective.

            Return ONLY a JSON array. Each element must have:
            - "description": what this step investigates
            - "query": one Steampipe SQL statement, no trailing semicolon

            Use only tables for the target provider. Prefer the candidate tables listed.
            Focus on security, compliance, cost, and performance aspects.
            """;

    static final String SUMMARY_SYSTEM_PROMPT = """
            You are a cloud infrastructure investigator. Summarize the findings of the
            investigation below in a few sentences. Call out public exposure, missing
            encryption, idle or stopped resources, and compliance concerns when present.
            """;

    private static final int MAX_ROWS_IN_SUMMARY = 20;

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;

    @Override
    public List<PlannedStep> generatePlan(String enhancedPrompt, Provider provider,
                                          Set<String> candidateTables, Deadline deadline) {
        String user = enhancedPrompt + "\n\nAvailable tables: " + String.join(", ", candidateTables);
        String content = llmClient.complete(
                List.of(ChatMessage.system(PLAN_SYSTEM_PROMPT), ChatMessage.user(user)),
                deadline.remainingOr(MAX_CALL));

        List<PlannedStep> steps = parsePlan(content);
        if (steps.isEmpty()) {
            throw new PlannerException("Planner returned an empty plan");
        }
        log.info("Planner produced {} step(s) for {}", steps.size(), provider.getId());
        return steps;
    }

    @Override
    public Optional<String> summarize(String prompt, Provider provider,
                                      List<InvestigationStep> steps, Deadline deadline) {
        StringBuilder sb = new StringBuilder();
        sb.append("Objective: ").append(prompt).append("\n");
        sb.append("Provider: ").append(provider.getId()).append("\n\n");
        for (InvestigationStep step : steps) {
            sb.append("Step ").append(step.getStepNumber()).append(": ").append(step.getDescription()).append("\n");
            sb.append("Query: ").append(step.getQuery()).append("\n");
            if (step.isSuccess()) {
                List<?> rows = step.getResults();
                sb.append("Rows: ").append(rows.size()).append("\n");
                try {
                    sb.append(objectMapper.writeValueAsString(
                            rows.subList(0, Math.min(rows.size(), MAX_ROWS_IN_SUMMARY)))).append("\n");
                } catch (JsonProcessingException e) {
                    sb.append("(rows not serializable)\n");
                }
            } else {
                sb.append("Failed: ").append(step.getError()).append("\n");
            }
            sb.append("\n");
        }
        String summary = llmClient.complete(
                List.of(ChatMessage.system(SUMMARY_SYSTEM_PROMPT), ChatMessage.user(sb.toString())),
                deadline.remainingOr(MAX_CALL));
        return Optional.of(summary.trim());
    }

    /**
     * Accepts a bare array, an object with a {@code steps} array, and
     * content wrapped in markdown code fences.
     */
    List<PlannedStep> parsePlan(String content) {
        String json = stripFences(content);
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PlannerException("Failed to parse investigation plan: " + e.getOriginalMessage(), e);
        }
        if (root != null && root.isObject() && root.has("steps")) {
            root = root.get("steps");
        }
        if (root == null || !root.isArray()) {
            throw new PlannerException("Investigation plan is not a JSON array");
        }

        List<PlannedStep> steps = new ArrayList<>();
        for (JsonNode node : root) {
            String query = node.path("query").asText("").trim();
            if (query.isEmpty()) {
                log.warn("Skipping planned step without a query: {}", node);
                continue;
            }
            String description = node.path("description").asText("").trim();
            steps.add(new PlannedStep(description.isEmpty() ? query : description, query));
        }
        return steps;
    }

    private static String stripFences(String content) {
        String text = content.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline >= 0 ? text.substring(firstNewline + 1) : "";
            int closing = text.lastIndexOf("```");
            if (closing >= 0) {
                text = text.substring(0, closing);
            }
        }
        return text.trim();
    }
}
