package com.example.cloudinvestigator.memory;

import com.example.cloudinvestigator.domain.Provider;

import java.time.Instant;

/**
 * Usage statistics for the last query generated for an intent.
 */
public record QueryPattern(
        String id,
        String intent,
        String template,
        Provider provider,
        double successRate,
        int usageCount,
        int successCount,
        Instant createdAt,
        Instant lastUsed) {

    QueryPattern recordUse(String query, boolean success, Instant now) {
        int uses = usageCount + 1;
        int successes = successCount + (success ? 1 : 0);
        return new QueryPattern(id, intent, success ? query : template, provider,
                (double) successes / uses, uses, successes, createdAt, now);
    }
}
