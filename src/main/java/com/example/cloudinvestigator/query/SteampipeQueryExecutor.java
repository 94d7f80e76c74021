package com.example.cloudinvestigator.query;

import com.example.cloudinvestigator.config.InvestigatorProperties;
import com.example.cloudinvestigator.domain.Deadline;
import com.example.cloudinvestigator.domain.Provider;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Steampipe Query Executor - runs SQL through the steampipe CLI.
 * <p>
 * Either invokes the local binary or a throwaway {@code turbot/steampipe}
 * container. Credentials are passed as environment variables. The wait is
 * bounded by the smaller of the configured timeout and the caller's deadline.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SteampipeQueryExecutor implements QueryExecutor {

    private static final long POLL_MILLIS = 100;

    private final InvestigatorProperties properties;

    /** Drains process output off the polling thread */
    private final ExecutorService outputReaders = Executors.newCachedThreadPool(outputThreadFactory());

    @Override
    public String execute(Provider provider, String query, Map<String, String> credentials,
                          String outputFormat, Deadline deadline) throws QueryExecutionException {
        InvestigatorProperties.SteampipeConfig cfg = properties.getSteampipe();
        Map<String, String> env = environmentFor(provider, credentials);
        List<String> command = buildCommand(query, outputFormat, env);

        log.info("Executing steampipe query for {}: {}", provider.getId(), query);
        log.debug("Running with {} credential variable(s), docker={}", env.size(), cfg.isUseDocker());

        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            pb.environment().putAll(env);
            process = pb.start();
        } catch (IOException e) {
            throw new QueryExecutionException("Failed to start steampipe: " + e.getMessage(), e);
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process), outputReaders);
        long budget = deadline.remainingOr(Duration.ofSeconds(cfg.getTimeoutSeconds())).toMillis();
        long waitUntil = System.currentTimeMillis() + budget;

        try {
            while (!process.waitFor(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (deadline.isCancelled()) {
                    process.destroyForcibly();
                    throw new CancellationException("Query cancelled");
                }
                if (System.currentTimeMillis() >= waitUntil) {
                    process.destroyForcibly();
                    throw new QueryExecutionException("Query timeout after " + budget + "ms");
                }
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CancellationException("Query interrupted");
        }

        String result;
        try {
            result = output.get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Query interrupted");
        } catch (ExecutionException | TimeoutException e) {
            throw new QueryExecutionException("Failed to read steampipe output: " + e.getMessage(), e);
        }

        int exitCode = process.exitValue();
        if (exitCode != 0 || result.startsWith("Error:")) {
            throw new QueryExecutionException(result.isBlank() ? "steampipe exited with code " + exitCode : result);
        }
        return result;
    }

    @PreDestroy
    public void shutdown() {
        outputReaders.shutdownNow();
    }

    List<String> buildCommand(String query, String outputFormat, Map<String, String> env) {
        InvestigatorProperties.SteampipeConfig cfg = properties.getSteampipe();
        List<String> command = new ArrayList<>();
        if (cfg.isUseDocker()) {
            command.add("docker");
            command.add("run");
            command.add("--rm");
            // -e KEY copies the value from this process's environment
            for (String key : env.keySet()) {
                command.add("-e");
                command.add(key);
            }
            command.add(cfg.getDockerImage());
        }
        command.add(cfg.isUseDocker() ? "steampipe" : cfg.getBinary());
        command.add("query");
        command.add(query);
        command.add("--output");
        command.add(outputFormat != null && !outputFormat.isBlank() ? outputFormat : cfg.getOutputFormat());
        return command;
    }

    Map<String, String> environmentFor(Provider provider, Map<String, String> credentials) {
        Map<String, String> env = new LinkedHashMap<>();
        if (credentials != null) {
            credentials.forEach((k, v) -> {
                if (v != null && !v.isEmpty()) env.put(k, v);
            });
        }
        if (provider == Provider.AWS) {
            env.putIfAbsent("AWS_REGION", properties.getSteampipe().getDefaultAwsRegion());
        }
        return env;
    }

    private static CustomizableThreadFactory outputThreadFactory() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("steampipe-output-");
        factory.setDaemon(true);
        return factory;
    }

    private static String readAll(Process process) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n")).trim();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
