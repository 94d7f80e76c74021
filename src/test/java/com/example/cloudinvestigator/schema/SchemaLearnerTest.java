package com.example.cloudinvestigator.schema;

import com.example.cloudinvestigator.config.InvestigatorProperties;
import com.example.cloudinvestigator.domain.Deadline;
import com.example.cloudinvestigator.domain.Provider;
import com.example.cloudinvestigator.query.QueryExecutionException;
import com.example.cloudinvestigator.query.QueryExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchemaLearnerTest {

    private static final String EC2_COLUMNS = "[" +
            "{\"column_name\":\"instance_id\",\"data_type\":\"text\",\"is_nullable\":\"NO\"}," +
            "{\"column_name\":\"instance_state\",\"data_type\":\"text\",\"is_nullable\":\"YES\"}," +
            "{\"column_name\":\"launch_time\",\"data_type\":\"timestamp with time zone\",\"is_nullable\":\"YES\"}]";

    private final List<String> queries = new ArrayList<>();

    private SchemaLearner learner(boolean enabled, QueryExecutor executor) {
        InvestigatorProperties properties = new InvestigatorProperties();
        properties.getSchema().setEnabled(enabled);
        QueryExecutor recording = (provider, query, credentials, format, deadline) -> {
            queries.add(query);
            return executor.execute(provider, query, credentials, format, deadline);
        };
        return new SchemaLearner(recording, new ObjectMapper(), properties);
    }

    @Test
    void learnsAndDescribesColumns() {
        SchemaLearner learner = learner(true, (p, q, c, f, d) -> EC2_COLUMNS);

        learner.learn(Provider.AWS, List.of("aws_ec2_instance"), Map.of(), Deadline.none());

        TableSchema schema = learner.getSchema(Provider.AWS, "aws_ec2_instance").orElseThrow();
        assertEquals("EC2 virtual machine instances", schema.description());
        assertEquals(3, schema.columns().size());
        ColumnInfo state = schema.columns().get(1);
        assertTrue(state.nullable());
        assertEquals(List.of("running", "stopped", "pending", "terminated"), state.examples());
        assertTrue(queries.get(0).contains("table_name = 'aws_ec2_instance'"));

        String described = learner.describe(Provider.AWS, List.of("aws_ec2_instance", "aws_s3_bucket"));
        assertTrue(described.startsWith("KNOWN TABLE SCHEMAS (aws):"));
        assertTrue(described.contains("Table: aws_ec2_instance"));
        assertTrue(described.contains("  - instance_state (text): Current state of the EC2 instance"));
        assertTrue(described.contains("    Examples: running, stopped, pending, terminated"));
        assertTrue(described.contains("  - launch_time (timestamp with time zone)\n"));
        assertFalse(described.contains("aws_s3_bucket"));
    }

    @Test
    void cachedTablesAreNotQueriedAgain() {
        SchemaLearner learner = learner(true, (p, q, c, f, d) -> EC2_COLUMNS);

        learner.learn(Provider.AWS, List.of("aws_ec2_instance"), Map.of(), Deadline.none());
        learner.learn(Provider.AWS, List.of("aws_ec2_instance"), Map.of(), Deadline.none());

        assertEquals(1, queries.size());
    }

    @Test
    void failedDiscoveryIsSkippedAndNotCached() {
        SchemaLearner learner = learner(true, (p, q, c, f, d) -> {
            if (q.contains("aws_iam_user")) throw new QueryExecutionException("access denied");
            return EC2_COLUMNS;
        });

        learner.learn(Provider.AWS, List.of("aws_iam_user", "aws_ec2_instance"), Map.of(), Deadline.none());

        assertTrue(learner.getSchema(Provider.AWS, "aws_iam_user").isEmpty());
        assertTrue(learner.getSchema(Provider.AWS, "aws_ec2_instance").isPresent());
    }

    @Test
    void invalidTableNamesNeverReachTheExecutor() {
        SchemaLearner learner = learner(true, (p, q, c, f, d) -> EC2_COLUMNS);

        learner.learn(Provider.AWS, List.of("x'; DROP TABLE y; --"), Map.of(), Deadline.none());

        assertTrue(queries.isEmpty());
    }

    @Test
    void rowsEnvelopeIsAccepted() {
        SchemaLearner learner = learner(true, (p, q, c, f, d) -> "{\"rows\":" + EC2_COLUMNS + "}");

        learner.learn(Provider.GCP, List.of("gcp_compute_instance"), Map.of(), Deadline.none());

        TableSchema schema = learner.getSchema(Provider.GCP, "gcp_compute_instance").orElseThrow();
        assertEquals("Compute Engine instances", schema.description());
        assertEquals(3, schema.columns().size());
    }

    @Test
    void disabledLearnerDoesNothing() {
        SchemaLearner learner = learner(false, (p, q, c, f, d) -> EC2_COLUMNS);

        learner.learn(Provider.AWS, List.of("aws_ec2_instance"), Map.of(), Deadline.none());

        assertFalse(learner.isEnabled());
        assertTrue(queries.isEmpty());
        assertEquals("", learner.describe(Provider.AWS, List.of("aws_ec2_instance")));
    }

    @Test
    void stopsOnceTheDeadlineIsDone() {
        SchemaLearner learner = learner(true, (p, q, c, f, d) -> EC2_COLUMNS);
        Deadline deadline = Deadline.none();
        deadline.cancel();

        learner.learn(Provider.AWS, List.of("aws_ec2_instance"), Map.of(), deadline);

        assertTrue(queries.isEmpty());
    }
}
