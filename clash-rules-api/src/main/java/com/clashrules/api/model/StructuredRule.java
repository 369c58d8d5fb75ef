/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.api.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Key/value representation of a rule, as found in YAML or JSON rule documents.
 *
 * <p>Simple kinds use {@code payload} and {@code extra_params}; logic kinds use
 * {@code conditions}. MATCH only needs {@code action}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record StructuredRule(
        @JsonProperty("type") String type,
        @JsonProperty("action") String action,
        @JsonProperty("payload") String payload,
        @JsonProperty("extra_params") @JsonAlias("additional_params") List<String> extraParams,
        @JsonProperty("conditions") List<StructuredCondition> conditions
) {

    public StructuredRule {
        extraParams = extraParams == null ? List.of() : List.copyOf(extraParams);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static StructuredRule simple(String type, String payload, String action, List<String> extraParams) {
        return new StructuredRule(type, action, payload, extraParams, null);
    }

    public static StructuredRule logic(String type, List<StructuredCondition> conditions, String action) {
        return new StructuredRule(type, action, null, null, conditions);
    }

    public static StructuredRule match(String action) {
        return new StructuredRule(RuleKind.MATCH.token(), action, null, null, null);
    }
}
