package com.example.cloudinvestigator.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Map;

/**
 * A user's natural-language investigation request.
 * Provider stays a raw string here so that an unknown value surfaces as a
 * validation error rather than a deserialization failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvestigationRequest {

    private String prompt;

    /** aws, azure or gcp */
    private String provider;

    private String region;

    @ToString.Exclude
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private Map<String, String> credentials;
}
