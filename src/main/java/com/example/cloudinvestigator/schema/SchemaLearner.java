package com.example.cloudinvestigator.schema;

import com.example.cloudinvestigator.config.InvestigatorProperties;
import com.example.cloudinvestigator.domain.Deadline;
import com.example.cloudinvestigator.domain.Provider;
import com.example.cloudinvestigator.query.QueryExecutionException;
import com.example.cloudinvestigator.query.QueryExecutor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Discovers table columns through {@code information_schema} and keeps them
 * in a Caffeine cache keyed by {@code "<provider>.<table>"}.
 * <p>
 * Discovery goes straight to the {@link QueryExecutor}, so schema lookups
 * never show up in agent memory. Known columns get a description and sample
 * values so the planner picks the right names.
 */
@Slf4j
@Component
public class SchemaLearner {

    private static final Pattern TABLE_NAME = Pattern.compile("[a-z0-9_]+");

    private static final String COLUMNS_QUERY =
            "SELECT column_name, data_type, is_nullable FROM information_schema.columns " +
            "WHERE table_name = '%s' ORDER BY ordinal_position";

    private static final Map<String, String> TABLE_DESCRIPTIONS = Map.ofEntries(
            Map.entry("aws.aws_ec2_instance", "EC2 virtual machine instances"),
            Map.entry("aws.aws_s3_bucket", "S3 storage buckets"),
            Map.entry("aws.aws_rds_db_instance", "RDS database instances"),
            Map.entry("aws.aws_vpc_security_group", "VPC security groups and rules"),
            Map.entry("aws.aws_iam_user", "IAM users and their configurations"),
            Map.entry("aws.aws_iam_role", "IAM roles and their policies"),
            Map.entry("aws.aws_vpc", "Virtual Private Clouds (VPCs)"),
            Map.entry("aws.aws_lambda_function", "Lambda serverless functions"),
            Map.entry("azure.azure_compute_virtual_machine", "Azure virtual machines"),
            Map.entry("azure.azure_storage_account", "Azure storage accounts"),
            Map.entry("gcp.gcp_compute_instance", "Compute Engine instances"),
            Map.entry("gcp.gcp_storage_bucket", "Cloud Storage buckets"));

    private static final Map<String, KnownColumn> KNOWN_COLUMNS = Map.of(
            "instance_id", new KnownColumn("EC2 instance identifier", List.of("i-1234567890abcdef0")),
            "instance_state", new KnownColumn("Current state of the EC2 instance",
                    List.of("running", "stopped", "pending", "terminated")),
            "instance_type", new KnownColumn("EC2 instance type/size", List.of("t3.micro", "m5.large", "c5.xlarge")),
            "vpc_id", new KnownColumn("VPC identifier where resource is located", List.of("vpc-12345678")),
            "region", new KnownColumn("Region where resource is located", List.of("us-east-1", "us-west-2", "eu-west-1")),
            "name", new KnownColumn("Resource name or identifier", List.of()),
            "tags", new KnownColumn("Resource tags as JSON object", List.of("{\"Environment\": \"prod\", \"Team\": \"platform\"}")));

    private final QueryExecutor executor;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final Cache<String, TableSchema> cache;

    public SchemaLearner(QueryExecutor executor, ObjectMapper objectMapper, InvestigatorProperties properties) {
        this.executor = executor;
        this.objectMapper = objectMapper;
        InvestigatorProperties.SchemaConfig cfg = properties.getSchema();
        this.enabled = cfg.isEnabled();
        this.cache = Caffeine.newBuilder()
                .maximumSize(cfg.getCacheSize())
                .expireAfterWrite(cfg.getTtlMinutes(), TimeUnit.MINUTES)
                .build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    static String key(Provider provider, String tableName) {
        return provider.getId() + "." + tableName;
    }

    public Optional<TableSchema> getSchema(Provider provider, String tableName) {
        return Optional.ofNullable(cache.getIfPresent(key(provider, tableName)));
    }

    public void put(TableSchema schema) {
        cache.put(schema.key(), schema);
    }

    /**
     * Discover and cache every table not already cached. A table that cannot
     * be described is skipped with a warning; planning goes on without it.
     */
    public void learn(Provider provider, Collection<String> tables, Map<String, String> credentials, Deadline deadline) {
        if (!enabled) return;
        for (String table : tables) {
            if (deadline.isDone()) return;
            if (cache.getIfPresent(key(provider, table)) != null) continue;
            try {
                TableSchema schema = discover(provider, table, credentials, deadline);
                cache.put(schema.key(), schema);
                log.info("Learned schema for {}.{} ({} columns)", provider.getId(), table, schema.columns().size());
            } catch (QueryExecutionException e) {
                log.warn("Schema discovery failed for {}.{}: {}", provider.getId(), table, e.getMessage());
            }
        }
    }

    TableSchema discover(Provider provider, String table, Map<String, String> credentials, Deadline deadline)
            throws QueryExecutionException {
        if (!TABLE_NAME.matcher(table).matches()) {
            throw new QueryExecutionException("Invalid table name: " + table);
        }
        String payload = executor.execute(provider, String.format(COLUMNS_QUERY, table), credentials, "json", deadline);

        List<ColumnInfo> columns = new ArrayList<>();
        for (ColumnInfo column : parseColumns(payload)) {
            KnownColumn known = KNOWN_COLUMNS.get(column.name());
            columns.add(known != null ? column.describedAs(known.description(), known.examples()) : column);
        }
        String description = TABLE_DESCRIPTIONS.getOrDefault(key(provider, table),
                table + " table for " + provider.getId() + " provider");
        return new TableSchema(provider, table, description, columns, Instant.now());
    }

    private List<ColumnInfo> parseColumns(String payload) throws QueryExecutionException {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload == null ? "" : payload);
        } catch (JsonProcessingException e) {
            throw new QueryExecutionException("Unreadable schema payload: " + e.getOriginalMessage(), e);
        }
        JsonNode rows = root != null && root.isObject() && root.has("rows") ? root.get("rows") : root;
        if (rows == null || !rows.isArray()) {
            throw new QueryExecutionException("Schema payload is not a row list");
        }
        List<ColumnInfo> columns = new ArrayList<>();
        for (JsonNode row : rows) {
            String name = row.path("column_name").asText("");
            if (name.isEmpty()) continue;
            columns.add(new ColumnInfo(name,
                    row.path("data_type").asText("unknown"),
                    "YES".equalsIgnoreCase(row.path("is_nullable").asText()),
                    "", List.of()));
        }
        return columns;
    }

    /**
     * Render cached schemas for the given tables as a prompt section, or an
     * empty string when none of them are cached.
     */
    public String describe(Provider provider, Collection<String> tables) {
        StringBuilder sb = new StringBuilder();
        for (String table : tables) {
            TableSchema schema = cache.getIfPresent(key(provider, table));
            if (schema == null) continue;
            sb.append("\nTable: ").append(table).append("\n");
            sb.append("Description: ").append(schema.description()).append("\n");
            sb.append("Columns:\n");
            for (ColumnInfo col : schema.columns()) {
                sb.append("  - ").append(col.name()).append(" (").append(col.type()).append(")");
                if (!col.description().isEmpty()) sb.append(": ").append(col.description());
                sb.append("\n");
                if (!col.examples().isEmpty()) {
                    sb.append("    Examples: ").append(String.join(", ", col.examples())).append("\n");
                }
            }
        }
        if (sb.length() == 0) return "";
        return "KNOWN TABLE SCHEMAS (" + provider.getId() + "):" + sb;
    }

    private record KnownColumn(String description, List<String> examples) {}
}
