package com.example.cloudinvestigator.domain;

import com.example.cloudinvestigator.insight.Insight;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Final outcome of an investigation, built once when the step loop ends.
 */
@Value
@Builder
public class InvestigationResult {

    String investigationId;
    InvestigationState state;
    boolean success;
    List<InvestigationStep> steps;
    String summary;
    List<Insight> insights;
    int queryCount;
    long durationMs;
    /** Fraction of attempted steps that succeeded */
    double confidence;
    /** Set when the loop stopped early (cancelled or timeout) */
    String error;
}
