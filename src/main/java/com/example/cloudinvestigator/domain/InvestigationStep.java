package com.example.cloudinvestigator.domain;

import com.example.cloudinvestigator.insight.Insight;
import com.example.cloudinvestigator.query.ErrorType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One executed step of an investigation. Recorded whether the query worked or not.
 */
@Value
@Builder
public class InvestigationStep {

    int stepNumber;
    String description;
    String query;
    List<Map<String, Object>> results;
    boolean success;
    String error;
    ErrorType errorType;
    long executionTimeMs;
    List<Insight> insights;
}
