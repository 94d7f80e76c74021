package com.example.cloudinvestigator.schema;

import java.util.List;

public record ColumnInfo(String name, String type, boolean nullable, String description, List<String> examples) {

    public ColumnInfo {
        examples = examples != null ? List.copyOf(examples) : List.of();
    }

    ColumnInfo describedAs(String newDescription, List<String> newExamples) {
        return new ColumnInfo(name, type, nullable, newDescription, newExamples);
    }
}
