package com.example.cloudinvestigator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Central configuration for the Cloud Investigator.
 * Maps to the 'cloud-investigator' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "cloud-investigator")
public class InvestigatorProperties {

    private LlmConfig llm = new LlmConfig();
    private SteampipeConfig steampipe = new SteampipeConfig();
    private MemoryConfig memory = new MemoryConfig();
    private InvestigationConfig investigation = new InvestigationConfig();
    private SchemaConfig schema = new SchemaConfig();
    private RewriterConfig rewriter = new RewriterConfig();

    @Data
    public static class LlmConfig {
        private String provider = "openai";
        private String model = "gpt-4o";
        private String apiKey = "";
        /** Overrides the provider's default chat completions endpoint when set */
        private String baseUrl = "";
        private double temperature = 0.1;
        private int maxTokens = 4096;
        private int timeoutSeconds = 120;
    }

    @Data
    public static class SteampipeConfig {
        private String binary = "steampipe";
        /** Run each query inside a throwaway container instead of a local binary */
        private boolean useDocker = false;
        private String dockerImage = "turbot/steampipe:latest";
        private String outputFormat = "json";
        private int timeoutSeconds = 300;
        private String defaultAwsRegion = "us-east-1";
    }

    @Data
    public static class MemoryConfig {
        private int maxSuccesses = 100;
        private int maxFailures = 50;
        private int maxPatterns = 200;
        /** Number of distinct lessons folded into the planner prompt */
        private int maxLessons = 10;
        /** JSON snapshot file; blank keeps memory in-process only */
        private String path = "";
    }

    @Data
    public static class InvestigationConfig {
        private int timeoutSeconds = 600;
        private int maxSteps = 10;
        private boolean parallelSteps = false;
        /** Ask the planner for a narrative summary instead of composing one locally */
        private boolean llmSummary = true;
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 100;
    }

    @Data
    public static class SchemaConfig {
        private boolean enabled = false;
        private int cacheSize = 500;
        private int ttlMinutes = 60;
    }

    @Data
    public static class RewriterConfig {
        /** Extra substitution rules per provider id: provider -> (substring -> replacement) */
        private Map<String, LinkedHashMap<String, String>> rules = new HashMap<>();
    }
}
