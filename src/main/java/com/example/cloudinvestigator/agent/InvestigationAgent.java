package com.example.cloudinvestigator.agent;

import com.example.cloudinvestigator.config.InvestigatorProperties;
import com.example.cloudinvestigator.credentials.CredentialProvider;
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
import com.example.cloudinvestigator.query.ErrorType;
import com.example.cloudinvestigator.query.QueryOutcome;
import com.example.cloudinvestigator.query.QueryTool;
import com.example.cloudinvestigator.schema.SchemaLearner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Investigation Agent - drives one natural-language investigation.
 * <p>
 * RECEIVED -> PLAN_REQUESTED -> STEP_LOOP -> AGGREGATING -> COMPLETED, or FAILED.
 * <ul>
 *   <li>A malformed request throws {@link ValidationException} before anything runs.</li>
 *   <li>A planner failure throws {@link PlannerException}; no step is attempted.</li>
 *   <li>A failed step is recorded and the loop moves on.</li>
 *   <li>Cancellation or deadline expiry stops the loop; the in-flight step is
 *       recorded as cancelled or timed out and the finished steps are aggregated.</li>
 * </ul>
 * Blocking calls run on the investigation executor so every wait can be cut
 * short by the caller's {@link Deadline}.
 */
@Slf4j
@Service
public class InvestigationAgent {

    private static final long POLL_MILLIS = 100;

    private final AsyncTaskExecutor executor;
    private final Planner planner;
    private final QueryTool queryTool;
    private final TableRelevanceResolver tableResolver;
    private final PromptEnhancer promptEnhancer;
    private final SchemaLearner schemaLearner;
    private final InsightExtractor insightExtractor;
    private final AgentMemory memory;
    private final CredentialProvider credentialProvider;
    private final InvestigatorProperties properties;

    public InvestigationAgent(@Qualifier("investigationExecutor") AsyncTaskExecutor executor,
                              Planner planner,
                              QueryTool queryTool,
                              TableRelevanceResolver tableResolver,
                              PromptEnhancer promptEnhancer,
                              SchemaLearner schemaLearner,
                              InsightExtractor insightExtractor,
                              AgentMemory memory,
                              CredentialProvider credentialProvider,
                              InvestigatorProperties properties) {
        this.executor = executor;
        this.planner = planner;
        this.queryTool = queryTool;
        this.tableResolver = tableResolver;
        this.promptEnhancer = promptEnhancer;
        this.schemaLearner = schemaLearner;
        this.insightExtractor = insightExtractor;
        this.memory = memory;
        this.credentialProvider = credentialProvider;
        this.properties = properties;
    }

    public InvestigationResult investigate(InvestigationRequest request) {
        return investigate(UUID.randomUUID().toString(), request, Deadline.none());
    }

    public InvestigationResult investigate(String investigationId, InvestigationRequest request, Deadline deadline) {
        long start = System.currentTimeMillis();

        // RECEIVED
        Provider provider = validate(request);
        log.info("[{}] {} investigation received: {}", investigationId, provider.getId(), request.getPrompt());
        Map<String, String> credentials = resolveCredentials(request, provider);

        if (deadline.isDone()) {
            return halted(investigationId, start, haltType(deadline), "before planning");
        }

        // PLAN_REQUESTED
        transition(investigationId, InvestigationState.PLAN_REQUESTED);
        Set<String> tables = tableResolver.resolve(request.getPrompt(), provider);
        String schemaContext = "";
        if (schemaLearner.isEnabled()) {
            try {
                schemaLearner.learn(provider, tables, credentials, deadline);
            } catch (CancellationException e) {
                return halted(investigationId, start, ErrorType.CANCELLED, "during schema discovery");
            }
            schemaContext = schemaLearner.describe(provider, tables);
        }
        String enhancedPrompt = promptEnhancer.enhance(request, memory, tables, schemaContext);
        log.debug("[{}] Enhanced prompt:\n{}", investigationId, enhancedPrompt);

        List<PlannedStep> plan;
        try {
            plan = await(executor.submit(() -> planner.generatePlan(enhancedPrompt, provider, tables, deadline)),
                    deadline);
        } catch (Halt halt) {
            return halted(investigationId, start, halt.type, "during planning");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CancellationException) {
                return halted(investigationId, start, ErrorType.CANCELLED, "during planning");
            }
            throw asPlannerException(e.getCause());
        }
        if (plan == null || plan.isEmpty()) {
            throw new PlannerException("Planner returned an empty plan");
        }
        int maxSteps = properties.getInvestigation().getMaxSteps();
        if (plan.size() > maxSteps) {
            log.warn("[{}] Plan has {} steps, keeping the first {}", investigationId, plan.size(), maxSteps);
            plan = plan.subList(0, maxSteps);
        }

        // STEP_LOOP
        transition(investigationId, InvestigationState.STEP_LOOP);
        StepLoop loop = properties.getInvestigation().isParallelSteps()
                ? runParallel(investigationId, plan, provider, credentials, deadline)
                : runSequential(investigationId, plan, provider, credentials, deadline);

        if (loop.steps.isEmpty() && loop.haltType != null) {
            return halted(investigationId, start, loop.haltType, "before the first step");
        }

        // AGGREGATING
        transition(investigationId, InvestigationState.AGGREGATING);
        InvestigationResult result = aggregate(investigationId, request, provider, loop, deadline, start);
        log.info("[{}] Investigation {}: {}/{} step(s) succeeded in {}ms (confidence {})",
                investigationId, result.getState(), countSucceeded(loop.steps), loop.steps.size(),
                result.getDurationMs(), String.format("%.2f", result.getConfidence()));
        return result;
    }

    private Provider validate(InvestigationRequest request) {
        if (request == null) {
            throw new ValidationException("Request must not be null");
        }
        if (request.getPrompt() == null || request.getPrompt().isBlank()) {
            throw new ValidationException("Prompt must not be empty");
        }
        if (request.getProvider() == null || request.getProvider().isBlank()) {
            throw new ValidationException("Provider is required (aws, azure or gcp)");
        }
        return Provider.fromId(request.getProvider())
                .orElseThrow(() -> new ValidationException(
                        "Unsupported provider '" + request.getProvider() + "', expected aws, azure or gcp"));
    }

    private Map<String, String> resolveCredentials(InvestigationRequest request, Provider provider) {
        Map<String, String> credentials = new LinkedHashMap<>();
        if (request.getCredentials() != null && !request.getCredentials().isEmpty()) {
            credentials.putAll(request.getCredentials());
        } else {
            credentials.putAll(credentialProvider.credentialsFor(provider));
        }
        if (provider == Provider.AWS && request.getRegion() != null && !request.getRegion().isBlank()) {
            credentials.put("AWS_REGION", request.getRegion().trim());
        }
        return Map.copyOf(credentials);
    }

    // ── Step loop ──

    private StepLoop runSequential(String id, List<PlannedStep> plan, Provider provider,
                                   Map<String, String> credentials, Deadline deadline) {
        List<InvestigationStep> steps = new ArrayList<>();
        for (int i = 0; i < plan.size(); i++) {
            if (deadline.isDone()) {
                return new StepLoop(steps, haltType(deadline));
            }
            PlannedStep planned = plan.get(i);
            Future<QueryOutcome> future = submitStep(planned, provider, credentials, deadline);
            Collected collected = collect(id, i + 1, planned, future, deadline);
            steps.add(collected.step());
            if (collected.halted()) {
                return new StepLoop(steps, collected.step().getErrorType());
            }
        }
        return new StepLoop(steps, null);
    }

    private StepLoop runParallel(String id, List<PlannedStep> plan, Provider provider,
                                 Map<String, String> credentials, Deadline deadline) {
        if (deadline.isDone()) {
            return new StepLoop(List.of(), haltType(deadline));
        }
        List<Future<QueryOutcome>> futures = new ArrayList<>();
        for (PlannedStep planned : plan) {
            futures.add(submitStep(planned, provider, credentials, deadline));
        }
        List<InvestigationStep> steps = new ArrayList<>();
        for (int i = 0; i < plan.size(); i++) {
            Collected collected = collect(id, i + 1, plan.get(i), futures.get(i), deadline);
            steps.add(collected.step());
            if (collected.halted()) {
                futures.subList(i + 1, futures.size()).forEach(f -> f.cancel(true));
                return new StepLoop(steps, collected.step().getErrorType());
            }
        }
        return new StepLoop(steps, null);
    }

    private Future<QueryOutcome> submitStep(PlannedStep planned, Provider provider,
                                            Map<String, String> credentials, Deadline deadline) {
        Callable<QueryOutcome> task = () ->
                queryTool.execute(provider, planned.query(), credentials, planned.description(), deadline);
        return executor.submit(task);
    }

    private Collected collect(String id, int stepNumber, PlannedStep planned,
                                      Future<QueryOutcome> future, Deadline deadline) {
        long start = System.currentTimeMillis();
        InvestigationStep.InvestigationStepBuilder step = InvestigationStep.builder()
                .stepNumber(stepNumber)
                .description(planned.description())
                .query(planned.query())
                .results(List.of())
                .insights(List.of());
        try {
            QueryOutcome outcome = await(future, deadline);
            log.info("[{}] Step {} {}: {}", id, stepNumber, outcome.isSuccess() ? "succeeded" : "failed",
                    planned.description());
            return new Collected(step.query(outcome.getQuery())
                    .results(outcome.getRows())
                    .success(outcome.isSuccess())
                    .error(outcome.getError())
                    .errorType(outcome.getErrorType())
                    .executionTimeMs(outcome.getExecutionTimeMs())
                    .insights(outcome.getInsights())
                    .build(), false);
        } catch (Halt halt) {
            log.warn("[{}] Step {} {}, stopping the step loop", id, stepNumber, halt.type.label());
            return new Collected(step.success(false)
                    .error(halt.type == ErrorType.CANCELLED ? "Investigation cancelled" : "Investigation deadline exceeded")
                    .errorType(halt.type)
                    .executionTimeMs(System.currentTimeMillis() - start)
                    .build(), true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CancellationException) {
                return new Collected(step.success(false).error("Investigation cancelled").errorType(ErrorType.CANCELLED)
                        .executionTimeMs(System.currentTimeMillis() - start).build(), true);
            }
            ErrorType type = cause instanceof ValidationException ? ErrorType.VALIDATION : ErrorType.UNKNOWN;
            if (type == ErrorType.UNKNOWN) {
                log.error("[{}] Step {} failed unexpectedly", id, stepNumber, cause);
            } else {
                log.warn("[{}] Step {} rejected: {}", id, stepNumber, cause.getMessage());
            }
            return new Collected(step.success(false)
                    .error(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName())
                    .errorType(type)
                    .executionTimeMs(System.currentTimeMillis() - start)
                    .build(), false);
        }
    }

    // ── Aggregation ──

    private InvestigationResult aggregate(String id, InvestigationRequest request, Provider provider,
                                          StepLoop loop, Deadline deadline, long start) {
        List<InvestigationStep> steps = List.copyOf(loop.steps);
        int attempted = steps.size();
        int succeeded = countSucceeded(steps);
        double confidence = attempted == 0 ? 0.0 : Math.min(1.0, Math.max(0.0, (double) succeeded / attempted));

        List<Insight> insights = new ArrayList<>();
        steps.forEach(s -> insights.addAll(s.getInsights()));

        String summary = null;
        if (properties.getInvestigation().isLlmSummary() && succeeded > 0 && !deadline.isDone()) {
            summary = narrativeSummary(id, request.getPrompt(), provider, steps, deadline).orElse(null);
            if (summary != null) {
                insights.addAll(insightExtractor.fromText(summary, provider));
            }
        }
        if (summary == null) {
            summary = localSummary(request.getPrompt(), provider, steps, insights, loop.haltType);
        }

        transition(id, InvestigationState.COMPLETED);
        return InvestigationResult.builder()
                .investigationId(id)
                .state(InvestigationState.COMPLETED)
                .success(succeeded > 0)
                .steps(steps)
                .summary(summary)
                .insights(List.copyOf(insights))
                .queryCount(attempted)
                .durationMs(System.currentTimeMillis() - start)
                .confidence(confidence)
                .error(loop.haltType != null ? "Stopped early: " + loop.haltType.label() : null)
                .build();
    }

    private Optional<String> narrativeSummary(String id, String prompt, Provider provider,
                                              List<InvestigationStep> steps, Deadline deadline) {
        try {
            return await(executor.submit(() -> planner.summarize(prompt, provider, steps, deadline)), deadline)
                    .filter(s -> !s.isBlank());
        } catch (Halt halt) {
            log.warn("[{}] Summary skipped: {}", id, halt.type.label());
        } catch (ExecutionException e) {
            log.warn("[{}] Planner summary failed, composing locally: {}", id,
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
        return Optional.empty();
    }

    static String localSummary(String prompt, Provider provider, List<InvestigationStep> steps,
                               List<Insight> insights, ErrorType haltType) {
        int succeeded = countSucceeded(steps);
        int rows = steps.stream().filter(InvestigationStep::isSuccess).mapToInt(s -> s.getResults().size()).sum();

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Investigated \"%s\" on %s: %d of %d step(s) succeeded, %d row(s) returned.",
                prompt.trim(), provider.getId(), succeeded, steps.size(), rows));
        if (haltType != null) {
            sb.append(haltType == ErrorType.CANCELLED ? " Stopped early: cancelled." : " Stopped early: deadline exceeded.");
        }
        for (InvestigationStep step : steps) {
            if (!step.isSuccess()) {
                sb.append(String.format(" Step %d failed (%s).", step.getStepNumber(),
                        step.getErrorType() != null ? step.getErrorType().label() : "unknown"));
            }
        }
        Set<String> suggestions = new LinkedHashSet<>();
        for (Insight insight : insights) {
            if (insight.getType() == Insight.Type.RECOMMENDATION) {
                suggestions.add(insight.getTitle());
            }
        }
        if (!suggestions.isEmpty()) {
            sb.append(" Suggestions: ").append(String.join("; ", suggestions)).append(".");
        }
        return sb.toString();
    }

    // ── Helpers ──

    private InvestigationResult halted(String id, long start, ErrorType type, String when) {
        log.warn("[{}] Investigation {} {}", id, type == ErrorType.CANCELLED ? "cancelled" : "timed out", when);
        transition(id, InvestigationState.FAILED);
        return InvestigationResult.builder()
                .investigationId(id)
                .state(InvestigationState.FAILED)
                .success(false)
                .steps(List.of())
                .summary("Investigation " + (type == ErrorType.CANCELLED ? "cancelled " : "timed out ") + when + ".")
                .insights(List.of())
                .queryCount(0)
                .durationMs(System.currentTimeMillis() - start)
                .confidence(0.0)
                .error(type.label())
                .build();
    }

    /**
     * Wait for a task in short slices so cancellation and expiry are noticed promptly.
     */
    private <T> T await(Future<T> future, Deadline deadline) throws ExecutionException, Halt {
        while (true) {
            if (deadline.isDone()) {
                future.cancel(true);
                throw new Halt(haltType(deadline));
            }
            try {
                return future.get(Math.min(POLL_MILLIS, Math.max(1, deadline.remainingMillis())), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.trace("Task still running, {}ms left", deadline.remainingMillis());
            } catch (CancellationException e) {
                throw new Halt(ErrorType.CANCELLED);
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new Halt(ErrorType.CANCELLED);
            }
        }
    }

    private static PlannerException asPlannerException(Throwable cause) {
        if (cause instanceof PlannerException planner) {
            return planner;
        }
        return new PlannerException("Planner failed: " + (cause != null ? cause.getMessage() : "unknown error"), cause);
    }

    private static ErrorType haltType(Deadline deadline) {
        return deadline.isCancelled() ? ErrorType.CANCELLED : ErrorType.TIMEOUT;
    }

    private static int countSucceeded(List<InvestigationStep> steps) {
        return (int) steps.stream().filter(InvestigationStep::isSuccess).count();
    }

    private static void transition(String id, InvestigationState state) {
        log.info("[{}] -> {}", id, state);
    }

    private record StepLoop(List<InvestigationStep> steps, ErrorType haltType) {}

    private record Collected(InvestigationStep step, boolean halted) {}

    /** The deadline was cancelled or expired while waiting. */
    private static final class Halt extends Exception {
        private final ErrorType type;

        Halt(ErrorType type) {
            super(type.label(), null, false, false);
            this.type = type;
        }
    }
}
