package com.example.cloudinvestigator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Cloud Investigator - natural-language investigation of cloud infrastructure.
 *
 * Architecture:
 * - Investigation Agent → plans queries through an LLM planner and runs them step by step
 * - Query Tool → rewrites, executes and learns from Steampipe queries
 * - Agent Memory → bounded history of successes and failures fed back into planning
 * - Insight Extractor → turns rows and narratives into security/cost findings
 * - Tool System → capability registry exposing the query tool over HTTP
 */
@SpringBootApplication
@EnableAsync
public class CloudInvestigatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CloudInvestigatorApplication.class, args);
    }
}
