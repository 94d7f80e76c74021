package com.example.cloudinvestigator.query;

import com.example.cloudinvestigator.domain.Deadline;
import com.example.cloudinvestigator.domain.Provider;

import java.util.Map;

/**
 * Runs a SQL query against the cloud inventory engine and returns its raw payload.
 */
public interface QueryExecutor {

    /**
     * @param provider     target cloud provider
     * @param query        a single SQL statement
     * @param credentials  environment-style credential entries for the provider
     * @param outputFormat requested payload format (e.g. "json")
     * @param deadline     cancellation and deadline signal
     * @return the raw payload
     * @throws QueryExecutionException          when the engine reports an error or the deadline passes
     * @throws java.util.concurrent.CancellationException when the deadline is cancelled while running
     */
    String execute(Provider provider, String query, Map<String, String> credentials,
                   String outputFormat, Deadline deadline) throws QueryExecutionException;
}
