package com.example.cloudinvestigator.memory;

import com.example.cloudinvestigator.domain.Provider;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Agent Memory - bounded history of query successes and failures.
 *
 * Successes and failures are kept in insertion order. When a cap is exceeded
 * the oldest entries are discarded. Append and trim happen under one lock so
 * concurrent query executions never observe an over-cap history.
 * Readers always get immutable copies.
 */
@Slf4j
public class AgentMemory {

    public static final int DEFAULT_MAX_SUCCESSES = 100;
    public static final int DEFAULT_MAX_FAILURES = 50;
    public static final int DEFAULT_MAX_PATTERNS = 200;

    private final int maxSuccesses;
    private final int maxFailures;
    private final int maxPatterns;

    private final Deque<QuerySuccess> successes = new ArrayDeque<>();
    private final Deque<QueryFailure> failures = new ArrayDeque<>();
    private final Map<String, QueryPattern> patterns = new LinkedHashMap<>();

    public AgentMemory() {
        this(DEFAULT_MAX_SUCCESSES, DEFAULT_MAX_FAILURES, DEFAULT_MAX_PATTERNS);
    }

    public AgentMemory(int maxSuccesses, int maxFailures, int maxPatterns) {
        if (maxSuccesses < 1 || maxFailures < 1 || maxPatterns < 1) {
            throw new IllegalArgumentException("Memory caps must be positive");
        }
        this.maxSuccesses = maxSuccesses;
        this.maxFailures = maxFailures;
        this.maxPatterns = maxPatterns;
    }

    public synchronized void recordSuccess(QuerySuccess success) {
        successes.addLast(success);
        while (successes.size() > maxSuccesses) {
            successes.removeFirst();
        }
    }

    public synchronized void recordFailure(QueryFailure failure) {
        failures.addLast(failure);
        while (failures.size() > maxFailures) {
            failures.removeFirst();
        }
    }

    /**
     * Update the usage statistics of the pattern for an intent, creating it on first use.
     */
    public synchronized void recordPatternOutcome(String intent, String query, Provider provider, boolean success) {
        if (intent == null || intent.isBlank()) return;
        Instant now = Instant.now();
        QueryPattern current = patterns.remove(intent);
        if (current == null) {
            current = new QueryPattern(UUID.randomUUID().toString(), intent, query, provider,
                    0.0, 0, 0, now, now);
        }
        // Re-inserted so iteration order tracks recency
        patterns.put(intent, current.recordUse(query, success, now));
        Iterator<String> oldest = patterns.keySet().iterator();
        while (patterns.size() > maxPatterns && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }

    public synchronized Optional<QueryPattern> findPattern(String intent) {
        return Optional.ofNullable(patterns.get(intent));
    }

    public synchronized List<QuerySuccess> getSuccesses() {
        return List.copyOf(successes);
    }

    public synchronized List<QueryFailure> getFailures() {
        return List.copyOf(failures);
    }

    public synchronized List<QueryPattern> getPatterns() {
        return List.copyOf(patterns.values());
    }

    /**
     * Distinct lessons from recorded failures, most recent first.
     */
    public synchronized List<String> recentLessons(int limit) {
        Set<String> lessons = new LinkedHashSet<>();
        Iterator<QueryFailure> it = failures.descendingIterator();
        while (it.hasNext() && lessons.size() < limit) {
            String lesson = it.next().lessonLearned();
            if (lesson != null && !lesson.isBlank()) {
                lessons.add(lesson);
            }
        }
        return new ArrayList<>(lessons);
    }

    public synchronized MemorySnapshot snapshot() {
        return new MemorySnapshot(List.copyOf(successes), List.copyOf(failures), List.copyOf(patterns.values()));
    }

    /**
     * Replace the current history with a stored snapshot, keeping only the
     * most recent entries that fit the caps.
     */
    public synchronized void restore(MemorySnapshot snapshot) {
        successes.clear();
        failures.clear();
        patterns.clear();
        snapshot.successes().forEach(this::recordSuccess);
        snapshot.failures().forEach(this::recordFailure);
        for (QueryPattern pattern : snapshot.patterns()) {
            patterns.put(pattern.intent(), pattern);
            if (patterns.size() > maxPatterns) {
                patterns.remove(patterns.keySet().iterator().next());
            }
        }
        log.info("Restored agent memory: {} successes, {} failures, {} patterns",
                successes.size(), failures.size(), patterns.size());
    }
}
