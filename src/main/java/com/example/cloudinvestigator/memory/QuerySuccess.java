package com.example.cloudinvestigator.memory;

import com.example.cloudinvestigator.domain.Provider;

import java.time.Instant;

/**
 * A query that executed successfully, kept so later plans can reuse it.
 */
public record QuerySuccess(
        String originalIntent,
        String generatedQuery,
        int resultCount,
        long executionTimeMs,
        Provider provider,
        Instant timestamp,
        String patternUsed) {
}
