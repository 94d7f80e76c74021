package com.example.cloudinvestigator.query;

import com.example.cloudinvestigator.insight.Insight;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Structured result of a single query execution. Failures are data, not exceptions.
 */
@Value
@Builder
public class QueryOutcome {

    boolean success;
    /** The query actually executed, after rewriting */
    String query;
    List<Map<String, Object>> rows;
    int rowCount;
    String error;
    ErrorType errorType;
    List<Insight> insights;
    long executionTimeMs;

    public static QueryOutcome success(String query, List<Map<String, Object>> rows,
                                       List<Insight> insights, long executionTimeMs) {
        return QueryOutcome.builder()
                .success(true)
                .query(query)
                .rows(List.copyOf(rows))
                .rowCount(rows.size())
                .insights(List.copyOf(insights))
                .executionTimeMs(executionTimeMs)
                .build();
    }

    public static QueryOutcome failure(String query, String error, ErrorType errorType, long executionTimeMs) {
        return QueryOutcome.builder()
                .success(false)
                .query(query)
                .rows(List.of())
                .rowCount(0)
                .error(error)
                .errorType(errorType)
                .insights(List.of())
                .executionTimeMs(executionTimeMs)
                .build();
    }
}
