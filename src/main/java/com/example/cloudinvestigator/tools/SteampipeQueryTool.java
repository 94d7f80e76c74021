package com.example.cloudinvestigator.tools;

import com.example.cloudinvestigator.agent.AgentTool;
import com.example.cloudinvestigator.agent.ToolContext;
import com.example.cloudinvestigator.agent.ToolResult;
import com.example.cloudinvestigator.credentials.CredentialProvider;
import com.example.cloudinvestigator.domain.Provider;
import com.example.cloudinvestigator.domain.ValidationException;
import com.example.cloudinvestigator.insight.Insight;
import com.example.cloudinvestigator.query.QueryOutcome;
import com.example.cloudinvestigator.query.QueryTool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Steampipe Query Tool - run a single SQL query against a cloud provider.
 * <p>
 * Response envelope: success, results, row_count, execution_time, query,
 * error (failures only) and insights.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SteampipeQueryTool implements AgentTool {

    private final QueryTool queryTool;
    private final CredentialProvider credentialProvider;

    @Override
    public String getName() { return "steampipe_query"; }

    @Override
    public String getDescription() {
        return "Execute a Steampipe SQL query against AWS, Azure or GCP inventory. " +
               "Returns the rows as JSON along with quick observations about the result. " +
               "Only the first statement of the query is executed.";
    }

    @Override
    public String getCategory() { return "cloud"; }

    @Override
    public Map<String, Object> getParameterSchema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "provider", Map.of("type", "string", "enum", List.of("aws", "azure", "gcp"),
                    "description", "Cloud provider to query"),
                "query", Map.of("type", "string", "description",
                    "Steampipe SQL query (e.g., 'SELECT instance_id, instance_state FROM aws_ec2_instance')"),
                "credentials", Map.of("type", "object", "description",
                    "Optional credential variables; defaults to the server environment")
            ),
            "required", List.of("provider", "query")
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        Object rawProvider = parameters.get("provider");
        Provider provider = rawProvider instanceof String id ? Provider.fromId(id).orElse(null) : null;
        if (provider == null) {
            return ToolResult.error("provider must be one of aws, azure, gcp");
        }
        Object rawQuery = parameters.get("query");
        if (!(rawQuery instanceof String query) || query.isBlank()) {
            return ToolResult.error("query is required");
        }

        Map<String, String> credentials = credentials(parameters.get("credentials"));
        if (credentials.isEmpty()) {
            credentials = credentialProvider.credentialsFor(provider);
        }

        QueryOutcome outcome;
        try {
            outcome = queryTool.execute(provider, query, credentials, query, context.getDeadline());
        } catch (ValidationException e) {
            return ToolResult.error(e.getMessage());
        }

        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("success", outcome.isSuccess());
        envelope.put("results", outcome.getRows());
        envelope.put("row_count", outcome.getRowCount());
        envelope.put("execution_time", outcome.getExecutionTimeMs() + "ms");
        envelope.put("query", outcome.getQuery());
        if (!outcome.isSuccess()) {
            envelope.put("error", outcome.getError());
            envelope.put("error_type", outcome.getErrorType().label());
        }
        envelope.put("insights", outcome.getInsights().stream()
                .map(Insight::getTitle)
                .collect(Collectors.toList()));

        return outcome.isSuccess() ? ToolResult.json(envelope) : ToolResult.failed(envelope, outcome.getError());
    }

    private static Map<String, String> credentials(Object raw) {
        Map<String, String> credentials = new LinkedHashMap<>();
        if (raw instanceof Map<?, ?> map) {
            map.forEach((k, v) -> {
                if (k != null && v != null) credentials.put(k.toString(), v.toString());
            });
        }
        return credentials;
    }
}
