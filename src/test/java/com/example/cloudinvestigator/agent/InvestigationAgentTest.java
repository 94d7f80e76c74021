package com.example.cloudinvestigator.agent;

import com.example.cloudinvestigator.config.InvestigatorProperties;
import com.example.cloudinvestigator.domain.Deadline;
import com.example.cloudinvestigator.domain.InvestigationRequest;
import com.example.cloudinvestigator.domain.InvestigationResult;
import com.example.cloudinvestigator.domain.InvestigationState;
import com.example.cloudinvestigator.domain.InvestigationStep;
import com.example.cloudinvestigator.domain.Provider;
import com.example.cloudinvestigator.domain.ValidationException;
import com.example.cloudinvestigator.insight.Insight;
import com.example.cloudinvestigator.insight.InsightExtractor;
import com.example.cloudinvestigator.memory.AgentMemory;
import com.example.cloudinvestigator.planner.PlannedStep;
import com.example.cloudinvestigator.planner.Planner;
import com.example.cloudinvestigator.planner.PlannerException;
import com.example.cloudinvestigator.query.ErrorClassifier;
import com.example.cloudinvestigator.query.ErrorType;
import com.example.cloudinvestigator.query.LessonGenerator;
import com.example.cloudinvestigator.query.QueryExecutionException;
import com.example.cloudinvestigator.query.QueryExecutor;
import com.example.cloudinvestigator.query.QueryRewriter;
import com.example.cloudinvestigator.query.QueryTool;
import com.example.cloudinvestigator.schema.SchemaLearner;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ConcurrentTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InvestigationAgentTest {

    private static final String TWO_BUCKETS = "[{\"name\":\"logs\"},{\"name\":\"assets\"}]";

    private final ExecutorService pool = Executors.newFixedThreadPool(4);
    private final InvestigatorProperties properties = new InvestigatorProperties();
    private final AgentMemory memory = new AgentMemory();
    private final AtomicReference<Map<String, String>> lastCredentials = new AtomicReference<>();

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    private InvestigationAgent agent(Planner planner, QueryExecutor executor) {
        QueryExecutor recording = (provider, query, credentials, format, deadline) -> {
            lastCredentials.set(credentials);
            return executor.execute(provider, query, credentials, format, deadline);
        };
        ObjectMapper objectMapper = new ObjectMapper();
        QueryTool queryTool = new QueryTool(new QueryRewriter(), recording, new ErrorClassifier(),
                new LessonGenerator(), new InsightExtractor(), memory, objectMapper, new SimpleMeterRegistry(),
                properties);
        return new InvestigationAgent(new ConcurrentTaskExecutor(pool), planner, queryTool,
                new TableRelevanceResolver(), new PromptEnhancer(properties),
                new SchemaLearner(recording, objectMapper, properties), new InsightExtractor(), memory,
                provider -> Map.of("AWS_PROFILE", "default"), properties);
    }

    private static Planner planOf(PlannedStep... steps) {
        return (prompt, provider, tables, deadline) -> List.of(steps);
    }

    private static InvestigationRequest bucketsRequest() {
        return InvestigationRequest.builder().prompt("List S3 buckets").provider("aws").build();
    }

    @Test
    void happyPathSingleStep() {
        InvestigationAgent agent = agent(
                planOf(new PlannedStep("list buckets", "SELECT name FROM aws_s3_bucket")),
                (p, q, c, f, d) -> TWO_BUCKETS);

        InvestigationResult result = agent.investigate(bucketsRequest());

        assertTrue(result.isSuccess());
        assertEquals(InvestigationState.COMPLETED, result.getState());
        assertEquals(1, result.getQueryCount());
        assertEquals(1, result.getSteps().size());
        assertTrue(result.getSteps().get(0).isSuccess());
        assertEquals(1, result.getSteps().get(0).getStepNumber());
        assertEquals(2, result.getSteps().get(0).getResults().size());
        assertEquals(1.0, result.getConfidence());
        assertNotNull(result.getSummary());
        assertNull(result.getError());
    }

    @Test
    void singleFailingStepIsRecordedInMemory() {
        InvestigationAgent agent = agent(
                planOf(new PlannedStep("list buckets", "SELECT name FROM aws_s3_bucket")),
                (p, q, c, f, d) -> {
                    throw new QueryExecutionException("column \"state\" does not exist");
                });

        InvestigationResult result = agent.investigate(bucketsRequest());

        assertFalse(result.isSuccess());
        assertEquals(InvestigationState.COMPLETED, result.getState());
        assertFalse(result.getSteps().get(0).isSuccess());
        assertEquals(ErrorType.SCHEMA, result.getSteps().get(0).getErrorType());
        assertEquals(1, memory.getFailures().size());
        assertEquals(ErrorType.SCHEMA, memory.getFailures().get(0).errorType());
        assertEquals(0.0, result.getConfidence());
    }

    @Test
    void mixedOutcomesContinueThroughThePlan() {
        InvestigationAgent agent = agent(
                planOf(new PlannedStep("broken", "SELECT bogus FROM aws_s3_bucket"),
                        new PlannedStep("list buckets", "SELECT name FROM aws_s3_bucket")),
                (p, q, c, f, d) -> {
                    if (q.contains("bogus")) throw new QueryExecutionException("column \"bogus\" does not exist");
                    return TWO_BUCKETS;
                });

        InvestigationResult result = agent.investigate(bucketsRequest());

        assertEquals(List.of(1, 2), result.getSteps().stream()
                .map(InvestigationStep::getStepNumber).collect(Collectors.toList()));
        assertFalse(result.getSteps().get(0).isSuccess());
        assertTrue(result.getSteps().get(1).isSuccess());
        assertTrue(result.isSuccess());
        assertEquals(0.5, result.getConfidence());
        assertEquals(2, result.getQueryCount());
    }

    @Test
    void invalidRequestsAreRejectedWithoutSideEffects() {
        AtomicBoolean planned = new AtomicBoolean();
        InvestigationAgent agent = agent((prompt, provider, tables, deadline) -> {
            planned.set(true);
            return List.of();
        }, (p, q, c, f, d) -> TWO_BUCKETS);

        assertThrows(ValidationException.class, () -> agent.investigate(
                InvestigationRequest.builder().prompt("  ").provider("aws").build()));
        assertThrows(ValidationException.class, () -> agent.investigate(
                InvestigationRequest.builder().prompt("List VMs").provider("oracle").build()));
        assertThrows(ValidationException.class, () -> agent.investigate(
                InvestigationRequest.builder().prompt("List VMs").provider(" AWS ").build()));
        assertThrows(ValidationException.class, () -> agent.investigate(
                InvestigationRequest.builder().prompt("List VMs").build()));
        assertThrows(ValidationException.class, () -> agent.investigate(null));

        assertFalse(planned.get());
        assertTrue(memory.getFailures().isEmpty());
        assertTrue(memory.getSuccesses().isEmpty());
    }

    @Test
    void plannerFailurePropagates() {
        AtomicBoolean executed = new AtomicBoolean();
        InvestigationAgent agent = agent((prompt, provider, tables, deadline) -> {
            throw new PlannerException("401 Unauthorized");
        }, (p, q, c, f, d) -> {
            executed.set(true);
            return TWO_BUCKETS;
        });

        PlannerException e = assertThrows(PlannerException.class, () -> agent.investigate(bucketsRequest()));
        assertEquals("401 Unauthorized", e.getMessage());
        assertFalse(executed.get());
    }

    @Test
    void unexpectedPlannerErrorsBecomePlannerExceptions() {
        InvestigationAgent agent = agent((prompt, provider, tables, deadline) -> {
            throw new IllegalStateException("socket closed");
        }, (p, q, c, f, d) -> TWO_BUCKETS);

        assertThrows(PlannerException.class, () -> agent.investigate(bucketsRequest()));
    }

    @Test
    void emptyPlanIsAPlannerError() {
        InvestigationAgent agent = agent(planOf(), (p, q, c, f, d) -> TWO_BUCKETS);

        assertThrows(PlannerException.class, () -> agent.investigate(bucketsRequest()));
    }

    @Test
    void cancellationBeforeStartYieldsFailedResultWithNoSteps() {
        AtomicBoolean planned = new AtomicBoolean();
        InvestigationAgent agent = agent((prompt, provider, tables, deadline) -> {
            planned.set(true);
            return List.of(new PlannedStep("list", "SELECT 1"));
        }, (p, q, c, f, d) -> TWO_BUCKETS);
        Deadline deadline = Deadline.none();
        deadline.cancel();

        InvestigationResult result = agent.investigate("inv-1", bucketsRequest(), deadline);

        assertEquals(InvestigationState.FAILED, result.getState());
        assertFalse(result.isSuccess());
        assertTrue(result.getSteps().isEmpty());
        assertEquals(0, result.getQueryCount());
        assertEquals(0.0, result.getConfidence());
        assertEquals("cancelled", result.getError());
        assertFalse(planned.get());
    }

    @Test
    void deadlineDuringAStepStopsTheLoop() {
        InvestigationAgent agent = agent(
                planOf(new PlannedStep("fast", "SELECT name FROM aws_s3_bucket"),
                        new PlannedStep("slow", "SELECT slow FROM aws_s3_bucket"),
                        new PlannedStep("never", "SELECT name FROM aws_iam_user")),
                (p, q, c, f, d) -> {
                    if (q.contains("slow")) return blockUntilDone(d);
                    return TWO_BUCKETS;
                });

        InvestigationResult result = agent.investigate("inv-2", bucketsRequest(),
                Deadline.after(Duration.ofMillis(500)));

        assertEquals(InvestigationState.COMPLETED, result.getState());
        assertEquals(2, result.getSteps().size());
        assertTrue(result.getSteps().get(0).isSuccess());
        InvestigationStep halted = result.getSteps().get(1);
        assertFalse(halted.isSuccess());
        assertEquals(ErrorType.TIMEOUT, halted.getErrorType());
        assertTrue(result.isSuccess());
        assertEquals(0.5, result.getConfidence());
        assertNotNull(result.getError());
        assertTrue(memory.getFailures().isEmpty());
    }

    @Test
    void cancellationDuringAStepIsRecordedAsCancelled() {
        Deadline deadline = Deadline.none();
        InvestigationAgent agent = agent(
                planOf(new PlannedStep("slow", "SELECT slow FROM aws_s3_bucket"),
                        new PlannedStep("never", "SELECT name FROM aws_s3_bucket")),
                (p, q, c, f, d) -> {
                    deadline.cancel();
                    return blockUntilDone(d);
                });

        InvestigationResult result = agent.investigate("inv-3", bucketsRequest(), deadline);

        assertEquals(1, result.getSteps().size());
        assertEquals(ErrorType.CANCELLED, result.getSteps().get(0).getErrorType());
        assertFalse(result.isSuccess());
        assertEquals(0.0, result.getConfidence());
    }

    @Test
    void parallelStepsKeepPlannedOrder() {
        properties.getInvestigation().setParallelSteps(true);
        InvestigationAgent agent = agent(
                planOf(new PlannedStep("slow", "SELECT slow FROM aws_s3_bucket"),
                        new PlannedStep("fast", "SELECT fast FROM aws_s3_bucket"),
                        new PlannedStep("failing", "SELECT broken FROM aws_s3_bucket")),
                (p, q, c, f, d) -> {
                    if (q.contains("broken")) throw new QueryExecutionException("syntax error at or near");
                    if (q.contains("slow")) sleep(300);
                    return TWO_BUCKETS;
                });

        InvestigationResult result = agent.investigate(bucketsRequest());

        assertEquals(List.of("slow", "fast", "failing"), result.getSteps().stream()
                .map(InvestigationStep::getDescription).collect(Collectors.toList()));
        assertEquals(List.of(1, 2, 3), result.getSteps().stream()
                .map(InvestigationStep::getStepNumber).collect(Collectors.toList()));
        assertEquals(ErrorType.SYNTAX, result.getSteps().get(2).getErrorType());
        assertEquals(2.0 / 3.0, result.getConfidence(), 1e-9);
    }

    @Test
    void rejectedStepDoesNotAbortTheLoop() {
        InvestigationAgent agent = agent(
                planOf(new PlannedStep("empty", " ; "),
                        new PlannedStep("list buckets", "SELECT name FROM aws_s3_bucket")),
                (p, q, c, f, d) -> TWO_BUCKETS);

        InvestigationResult result = agent.investigate(bucketsRequest());

        assertEquals(ErrorType.VALIDATION, result.getSteps().get(0).getErrorType());
        assertTrue(result.getSteps().get(1).isSuccess());
        assertEquals(0.5, result.getConfidence());
    }

    @Test
    void planIsTruncatedToMaxSteps() {
        properties.getInvestigation().setMaxSteps(2);
        InvestigationAgent agent = agent(
                planOf(new PlannedStep("a", "SELECT 1"), new PlannedStep("b", "SELECT 2"),
                        new PlannedStep("c", "SELECT 3")),
                (p, q, c, f, d) -> "[]");

        assertEquals(2, agent.investigate(bucketsRequest()).getQueryCount());
    }

    @Test
    void requestCredentialsAndRegionReachTheExecutor() {
        InvestigationAgent agent = agent(planOf(new PlannedStep("list", "SELECT 1")), (p, q, c, f, d) -> "[]");

        agent.investigate(InvestigationRequest.builder()
                .prompt("List S3 buckets").provider("aws").region("eu-west-1")
                .credentials(Map.of("AWS_ACCESS_KEY_ID", "AKIA123")).build());

        assertEquals(Map.of("AWS_ACCESS_KEY_ID", "AKIA123", "AWS_REGION", "eu-west-1"), lastCredentials.get());
    }

    @Test
    void fallsBackToCredentialProvider() {
        InvestigationAgent agent = agent(planOf(new PlannedStep("list", "SELECT 1")), (p, q, c, f, d) -> "[]");

        agent.investigate(bucketsRequest());

        assertEquals(Map.of("AWS_PROFILE", "default"), lastCredentials.get());
    }

    @Test
    void lessonsFromEarlierFailuresReachThePlanner() {
        AtomicReference<String> seenPrompt = new AtomicReference<>();
        AtomicReference<Set<String>> seenTables = new AtomicReference<>();
        InvestigationAgent agent = agent((prompt, provider, tables, deadline) -> {
            seenPrompt.set(prompt);
            seenTables.set(tables);
            return List.of(new PlannedStep("states", "SELECT state FROM aws_ec2_instance"));
        }, (p, q, c, f, d) -> {
            throw new QueryExecutionException("column \"state\" does not exist");
        });

        agent.investigate(InvestigationRequest.builder().prompt("Find all running EC2 instances").provider("aws").build());
        agent.investigate(InvestigationRequest.builder().prompt("Find all running EC2 instances").provider("aws").build());

        assertTrue(seenPrompt.get().contains("KNOWN ISSUES TO AVOID:"));
        assertTrue(seenPrompt.get().contains("Use 'instance_state' instead of 'state' for EC2 instance queries"));
        assertTrue(seenTables.get().containsAll(Set.of("aws_ec2_instance", "aws_account")));
    }

    @Test
    void plannerNarrativeBecomesSummaryAndFeedsTextInsights() {
        Planner planner = new Planner() {
            @Override
            public List<PlannedStep> generatePlan(String prompt, Provider provider, Set<String> tables, Deadline deadline) {
                return List.of(new PlannedStep("list buckets", "SELECT name FROM aws_s3_bucket"));
            }

            @Override
            public Optional<String> summarize(String prompt, Provider provider, List<InvestigationStep> steps,
                                              Deadline deadline) {
                return Optional.of("Bucket logs is unencrypted.");
            }
        };
        InvestigationResult result = agent(planner, (p, q, c, f, d) -> TWO_BUCKETS).investigate(bucketsRequest());

        assertEquals("Bucket logs is unencrypted.", result.getSummary());
        assertTrue(result.getInsights().stream().anyMatch(i -> "Encryption Issue".equals(i.getTitle())));
        assertTrue(result.getInsights().stream().anyMatch(i -> i.getType() == Insight.Type.RESULT));
    }

    @Test
    void failingSummaryFallsBackToLocalSummary() {
        Planner planner = new Planner() {
            @Override
            public List<PlannedStep> generatePlan(String prompt, Provider provider, Set<String> tables, Deadline deadline) {
                return List.of(new PlannedStep("list buckets", "SELECT name FROM aws_s3_bucket"));
            }

            @Override
            public Optional<String> summarize(String prompt, Provider provider, List<InvestigationStep> steps,
                                              Deadline deadline) {
                throw new PlannerException("rate limited");
            }
        };
        InvestigationResult result = agent(planner, (p, q, c, f, d) -> TWO_BUCKETS).investigate(bucketsRequest());

        assertTrue(result.isSuccess());
        assertTrue(result.getSummary().contains("1 of 1 step(s) succeeded, 2 row(s) returned"));
    }

    private static String blockUntilDone(Deadline deadline) {
        while (!deadline.isDone()) {
            sleep(10);
        }
        throw new CancellationException("Query cancelled");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted");
        }
    }
}
