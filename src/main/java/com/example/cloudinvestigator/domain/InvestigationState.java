package com.example.cloudinvestigator.domain;

/**
 * Lifecycle of a single investigation.
 */
public enum InvestigationState {
    RECEIVED,
    PLAN_REQUESTED,
    STEP_LOOP,
    AGGREGATING,
    COMPLETED,
    FAILED
}
