package com.example.cloudinvestigator.schema;

import com.example.cloudinvestigator.domain.Provider;

import java.time.Instant;
import java.util.List;

/**
 * Columns discovered for one table, cached under {@code "<provider>.<table>"}.
 */
public record TableSchema(Provider provider, String tableName, String description,
                          List<ColumnInfo> columns, Instant lastUpdated) {

    public TableSchema {
        columns = columns != null ? List.copyOf(columns) : List.of();
    }

    public String key() {
        return SchemaLearner.key(provider, tableName);
    }
}
