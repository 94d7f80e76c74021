package com.example.cloudinvestigator.query;

import com.example.cloudinvestigator.config.InvestigatorProperties;
import com.example.cloudinvestigator.domain.Deadline;
import com.example.cloudinvestigator.domain.Provider;
import com.example.cloudinvestigator.insight.Insight;
import com.example.cloudinvestigator.insight.InsightExtractor;
import com.example.cloudinvestigator.memory.AgentMemory;
import com.example.cloudinvestigator.memory.QueryFailure;
import com.example.cloudinvestigator.memory.QueryPattern;
import com.example.cloudinvestigator.memory.QuerySuccess;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Query Tool - runs one planned query end to end.
 * <p>
 * rewrite -> execute -> (success: memory + result insights)
 *                    -> (failure: classify + lesson + memory)
 * <p>
 * Executor failures are returned as a failed {@link QueryOutcome} and
 * recorded in memory; they are never rethrown. A blank query raises
 * {@link com.example.cloudinvestigator.domain.ValidationException}, and a
 * cancellation from the executor propagates without touching memory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryTool {

    private final QueryRewriter rewriter;
    private final QueryExecutor executor;
    private final ErrorClassifier classifier;
    private final LessonGenerator lessonGenerator;
    private final InsightExtractor insightExtractor;
    private final AgentMemory memory;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final InvestigatorProperties properties;

    /**
     * Execute a query for the given intent.
     *
     * @param intent what the query is meant to answer; falls back to the query text when blank
     */
    public QueryOutcome execute(Provider provider, String query, Map<String, String> credentials,
                                String intent, Deadline deadline) {
        String improved = rewriter.rewrite(query, provider);
        String effectiveIntent = intent != null && !intent.isBlank() ? intent : improved;
        Map<String, String> creds = credentials != null ? credentials : Map.of();

        Timer.Sample sample = Timer.start(meterRegistry);
        long start = System.currentTimeMillis();
        String payload;
        try {
            payload = executor.execute(provider, improved, creds,
                    properties.getSteampipe().getOutputFormat(), deadline);
        } catch (QueryExecutionException e) {
            long elapsed = System.currentTimeMillis() - start;
            record(sample, provider, "failure");
            return onFailure(provider, improved, effectiveIntent, e.getMessage(), elapsed);
        }
        long elapsed = System.currentTimeMillis() - start;
        record(sample, provider, "success");

        List<Map<String, Object>> rows = parseRows(payload);
        memory.recordSuccess(new QuerySuccess(effectiveIntent, improved, rows.size(), elapsed,
                provider, Instant.now(), memory.findPattern(effectiveIntent).map(QueryPattern::id).orElse(null)));
        memory.recordPatternOutcome(effectiveIntent, improved, provider, true);

        List<Insight> insights = insightExtractor.fromResults(rows, provider, improved);
        log.info("Query succeeded on {} with {} row(s) in {}ms", provider.getId(), rows.size(), elapsed);
        return QueryOutcome.success(improved, rows, insights, elapsed);
    }

    private QueryOutcome onFailure(Provider provider, String query, String intent, String error, long elapsed) {
        String message = error != null ? error : "Query execution failed";
        ErrorType errorType = classifier.classify(message);
        String lesson = lessonGenerator.lessonFor(message);

        memory.recordFailure(new QueryFailure(intent, query, message, errorType, provider, Instant.now(), lesson));
        memory.recordPatternOutcome(intent, query, provider, false);

        log.warn("Query failed on {} ({}): {} | lesson: {}", provider.getId(), errorType.label(), message, lesson);
        return QueryOutcome.failure(query, message, errorType, elapsed);
    }

    /**
     * Parse an executor payload into rows.
     * JSON array -> one row per element, JSON object -> one row,
     * anything else -> a single {@code result} row, blank -> no rows.
     */
    List<Map<String, Object>> parseRows(String payload) {
        if (payload == null || payload.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("Payload is not JSON, treating it as a single result row");
            return List.of(rawRow(payload));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode element : root) {
                rows.add(toRow(element));
            }
        } else if (root.isObject() && root.has("rows") && root.get("rows").isArray()) {
            // newer engine versions wrap rows in an envelope
            for (JsonNode element : root.get("rows")) {
                rows.add(toRow(element));
            }
        } else if (root.isObject()) {
            rows.add(toRow(root));
        } else {
            rows.add(rawRow(payload));
        }
        return rows;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toRow(JsonNode node) {
        if (node.isObject()) {
            return objectMapper.convertValue(node, LinkedHashMap.class);
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("value", objectMapper.convertValue(node, Object.class));
        return row;
    }

    private Map<String, Object> rawRow(String payload) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("result", payload.trim());
        return row;
    }

    private void record(Timer.Sample sample, Provider provider, String outcome) {
        sample.stop(Timer.builder("cloud.query.duration")
                .tag("provider", provider.getId())
                .tag("outcome", outcome)
                .register(meterRegistry));
        Counter.builder("cloud.query.executions")
                .tag("provider", provider.getId())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
