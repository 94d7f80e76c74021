package com.example.cloudinvestigator.insight;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * A structured finding derived from query results or narrative text.
 */
@Value
@Builder
public class Insight {

    Type type;
    Severity severity;
    String title;
    String description;
    String impact;
    String recommendation;
    /** 0.0 - 1.0 */
    double confidence;

    public enum Type {
        SECURITY, COST, COMPLIANCE, RESULT, RECOMMENDATION;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Severity {
        INFO, LOW, MEDIUM, HIGH, CRITICAL;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
