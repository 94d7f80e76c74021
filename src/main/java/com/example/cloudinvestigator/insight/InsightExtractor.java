package com.example.cloudinvestigator.insight;

import com.example.cloudinvestigator.domain.Provider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Insight Extractor - scans query results or narrative text for known
 * risk and cost patterns.
 *
 * Two modes, both free of side effects:
 * - Result mode: a row count plus provider/keyword triggered follow-up suggestions
 * - Text mode: phrase groups over an LLM narrative (open exposure, encryption, idle cost, compliance)
 */
@Slf4j
@Component
public class InsightExtractor {

    static final String NO_RESULTS = "No results found - consider broadening the query scope";

    private static final List<Suggestion> SUGGESTIONS = List.of(
            new Suggestion(Provider.AWS, "ec2", "Consider checking instance security groups and tags"),
            new Suggestion(Provider.AWS, "s3", "Consider checking bucket encryption and public access settings"),
            new Suggestion(Provider.AZURE, "virtual_machine", "Consider checking network security groups and disk encryption"),
            new Suggestion(Provider.AZURE, "storage_account", "Consider checking storage account encryption and public blob access"),
            new Suggestion(Provider.GCP, "compute_instance", "Consider checking instance service accounts and firewall rules"),
            new Suggestion(Provider.GCP, "storage_bucket", "Consider checking bucket IAM bindings and uniform access settings"));

    // Checked in this order; each group yields at most one insight
    private static final List<PhraseGroup> PHRASE_GROUPS = List.of(
            new PhraseGroup(List.of("0.0.0.0/0", "public"),
                    Insight.builder()
                            .type(Insight.Type.SECURITY)
                            .severity(Insight.Severity.HIGH)
                            .title("Public Access Detected")
                            .description("Found resources with public access that may pose security risks")
                            .impact("Resources reachable from the internet widen the attack surface")
                            .recommendation("Review and restrict public access to essential services only")
                            .confidence(0.8)
                            .build()),
            new PhraseGroup(List.of("unencrypted", "no encryption", "not encrypted"),
                    Insight.builder()
                            .type(Insight.Type.SECURITY)
                            .severity(Insight.Severity.HIGH)
                            .title("Encryption Issue")
                            .description("Found resources without proper encryption")
                            .impact("Data at rest may be readable if storage is compromised")
                            .recommendation("Enable encryption for sensitive data and storage")
                            .confidence(0.8)
                            .build()),
            new PhraseGroup(List.of("unused", "idle", "stopped", "cost"),
                    Insight.builder()
                            .type(Insight.Type.COST)
                            .severity(Insight.Severity.MEDIUM)
                            .title("Cost Optimization Opportunity")
                            .description("Found unused or idle resources that may be costing money")
                            .impact("Idle resources keep accruing storage and reservation charges")
                            .recommendation("Consider terminating or rightsizing unused resources")
                            .confidence(0.7)
                            .build()),
            new PhraseGroup(List.of("compliance", "regulation"),
                    Insight.builder()
                            .type(Insight.Type.COMPLIANCE)
                            .severity(Insight.Severity.HIGH)
                            .title("Compliance Issue")
                            .description("Found potential compliance concerns")
                            .impact("Controls required by regulation may be missing")
                            .recommendation("Review compliance requirements and implement necessary controls")
                            .confidence(0.6)
                            .build()));

    /**
     * Result mode: summarize rows returned by a single query.
     */
    public List<Insight> fromResults(List<Map<String, Object>> rows, Provider provider, String query) {
        List<Insight> insights = new ArrayList<>();

        if (rows == null || rows.isEmpty()) {
            insights.add(resultInsight(NO_RESULTS, Insight.Severity.INFO));
            return insights;
        }

        int count = rows.size();
        insights.add(resultInsight(count == 1 ? "Found 1 result" : String.format("Found %d results", count),
                Insight.Severity.INFO));

        String queryLower = query != null ? query.toLowerCase(Locale.ROOT) : "";
        for (Suggestion suggestion : SUGGESTIONS) {
            if (suggestion.provider() == provider && queryLower.contains(suggestion.keyword())) {
                insights.add(Insight.builder()
                        .type(Insight.Type.RECOMMENDATION)
                        .severity(Insight.Severity.LOW)
                        .title(suggestion.message())
                        .description(suggestion.message())
                        .recommendation(suggestion.message())
                        .confidence(0.5)
                        .build());
            }
        }
        return insights;
    }

    /**
     * Text mode: scan a narrative (typically the LLM summary) for risk phrases.
     */
    public List<Insight> fromText(String narrative, Provider provider) {
        List<Insight> insights = new ArrayList<>();
        if (narrative == null || narrative.isBlank()) return insights;

        String lower = narrative.toLowerCase(Locale.ROOT);
        for (PhraseGroup group : PHRASE_GROUPS) {
            if (group.phrases().stream().anyMatch(lower::contains)) {
                insights.add(group.insight());
            }
        }
        log.debug("Extracted {} insight(s) from {} narrative", insights.size(), provider);
        return insights;
    }

    private Insight resultInsight(String message, Insight.Severity severity) {
        return Insight.builder()
                .type(Insight.Type.RESULT)
                .severity(severity)
                .title(message)
                .description(message)
                .confidence(1.0)
                .build();
    }

    private record Suggestion(Provider provider, String keyword, String message) {}

    private record PhraseGroup(List<String> phrases, Insight insight) {}
}
