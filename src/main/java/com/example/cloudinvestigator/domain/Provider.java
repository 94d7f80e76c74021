package com.example.cloudinvestigator.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Cloud providers the query engine has plugins for.
 * Each provider has a root table that anchors every investigation.
 */
public enum Provider {

    AWS("aws", "aws_account"),
    AZURE("azure", "azure_subscription"),
    GCP("gcp", "gcp_project");

    private final String id;
    private final String rootTable;

    Provider(String id, String rootTable) {
        this.id = id;
        this.rootTable = rootTable;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getRootTable() {
        return rootTable;
    }

    /**
     * Look up a provider by its exact lowercase id.
     */
    public static Optional<Provider> fromId(String id) {
        if (id == null) return Optional.empty();
        for (Provider provider : values()) {
            if (provider.id.equals(id)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Provider fromJson(String id) {
        return fromId(id).orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + id));
    }
}
