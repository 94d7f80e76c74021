package com.example.cloudinvestigator.query;

import com.example.cloudinvestigator.config.InvestigatorProperties;
import com.example.cloudinvestigator.domain.Provider;
import com.example.cloudinvestigator.domain.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Query Rewriter - normalizes a planned query before it reaches the executor.
 * <p>
 * Only the first statement of a multi-statement string is kept, then the
 * provider's substring rules are applied. Rule keys never overlap and no
 * replacement contains a key, so the rules commute and a rewritten query
 * is left unchanged by a second pass.
 */
@Slf4j
@Component
public class QueryRewriter {

    private final Map<Provider, Map<String, String>> rules = new EnumMap<>(Provider.class);

    public QueryRewriter() {
        addRule(Provider.AWS, " state =", " instance_state =");
        addRule(Provider.AWS, " state_name =", " instance_state =");
        addRule(Provider.AWS, "WHERE running", "WHERE instance_state = 'running'");
        addRule(Provider.AWS, "WHERE stopped", "WHERE instance_state = 'stopped'");
        addRule(Provider.AWS, "sg.group_id", "sg->>'GroupId'");
        addRule(Provider.AWS, "sg.group_name", "sg->>'GroupName'");
    }

    @Autowired
    public QueryRewriter(InvestigatorProperties properties) {
        this();
        properties.getRewriter().getRules().forEach((providerId, extra) -> {
            Provider provider = Provider.fromId(providerId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown provider in rewriter rules: " + providerId));
            extra.forEach((from, to) -> addRule(provider, from, to));
        });
    }

    /**
     * Register a substitution rule.
     *
     * @throws IllegalArgumentException if the rule could interact with an existing one
     */
    public synchronized void addRule(Provider provider, String from, String to) {
        if (from == null || from.isEmpty() || to == null) {
            throw new IllegalArgumentException("Rewrite rule needs a non-empty key and a replacement");
        }
        Map<String, String> table = rules.computeIfAbsent(provider, p -> new LinkedHashMap<>());
        if (table.containsKey(from)) {
            throw new IllegalArgumentException("Duplicate rewrite rule for " + provider.getId() + ": '" + from + "'");
        }
        if (to.contains(from)) {
            throw new IllegalArgumentException("Replacement '" + to + "' contains its own key '" + from + "'");
        }
        for (Map.Entry<String, String> existing : table.entrySet()) {
            String key = existing.getKey();
            if (overlaps(key, from)) {
                throw new IllegalArgumentException(
                        "Rewrite rule '" + from + "' overlaps existing rule '" + key + "' for " + provider.getId());
            }
            if (to.contains(key) || existing.getValue().contains(from)) {
                throw new IllegalArgumentException(
                        "Rewrite rules '" + from + "' and '" + key + "' would feed into each other for " + provider.getId());
            }
        }
        table.put(from, to);
        log.debug("Added rewrite rule for {}: '{}' -> '{}'", provider.getId(), from, to);
    }

    /**
     * Rewrite a planned query into the single statement that will be executed.
     *
     * @throws ValidationException if the query is blank
     */
    public String rewrite(String query, Provider provider) {
        if (query == null || query.trim().isEmpty()) {
            throw new ValidationException("Query must not be empty");
        }
        String improved = firstStatement(query.trim());

        Map<String, String> table;
        synchronized (this) {
            table = Map.copyOf(rules.getOrDefault(provider, Map.of()));
        }
        for (Map.Entry<String, String> rule : table.entrySet()) {
            if (improved.contains(rule.getKey())) {
                improved = improved.replace(rule.getKey(), rule.getValue());
                log.debug("Applied rewrite rule '{}' -> '{}'", rule.getKey(), rule.getValue());
            }
        }
        return improved;
    }

    public synchronized Map<String, String> rulesFor(Provider provider) {
        return Map.copyOf(rules.getOrDefault(provider, Map.of()));
    }

    private String firstStatement(String query) {
        String[] parts = query.split(";");
        long nonBlank = 0;
        String first = null;
        for (String part : parts) {
            if (!part.isBlank()) {
                nonBlank++;
                if (first == null) first = part.trim();
            }
        }
        if (nonBlank > 1) {
            log.warn("Query contains {} statements, executing only the first", nonBlank);
        }
        if (first == null) {
            throw new ValidationException("Query contains no statement");
        }
        return first;
    }

    /**
     * True if one key contains the other, or a suffix of one is a prefix of the other.
     */
    static boolean overlaps(String a, String b) {
        if (a.contains(b) || b.contains(a)) return true;
        return suffixPrefixOverlap(a, b) || suffixPrefixOverlap(b, a);
    }

    private static boolean suffixPrefixOverlap(String a, String b) {
        int max = Math.min(a.length(), b.length()) - 1;
        for (int len = 1; len <= max; len++) {
            if (a.regionMatches(a.length() - len, b, 0, len)) {
                return true;
            }
        }
        return false;
    }
}
