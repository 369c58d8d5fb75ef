/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.api.model;

import com.clashrules.api.exceptions.RuleParseException;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of parsing one input: either a rule or an error, plus any diagnostics raised
 * along the way. Diagnostics may be present on success, e.g. when a logic rule dropped
 * one of its conditions.
 *
 * @param source      the input as text
 * @param rule        the parsed rule, null on failure
 * @param error       the error, null on success
 * @param diagnostics non-fatal problems, in the order they were found
 */
public record ParseResult(
        String source,
        Rule rule,
        ParseError error,
        List<Diagnostic> diagnostics
) {

    public ParseResult {
        if ((rule == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of rule or error must be set");
        }
        source = source == null ? "" : source;
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static ParseResult success(String source, Rule rule, List<Diagnostic> diagnostics) {
        return new ParseResult(source, Objects.requireNonNull(rule, "Rule cannot be null"), null, diagnostics);
    }

    public static ParseResult failure(String source, ParseError error, List<Diagnostic> diagnostics) {
        return new ParseResult(source, null, Objects.requireNonNull(error, "Error cannot be null"), diagnostics);
    }

    public boolean isSuccess() {
        return rule != null;
    }

    /**
     * Checks if the input was blank and should be skipped rather than reported.
     */
    public boolean isSkipped() {
        return error != null && error.kind() == ParseError.ErrorKind.EMPTY;
    }

    public boolean isFailure() {
        return error != null && !isSkipped();
    }

    /**
     * Returns the rule, or throws the error as a {@link RuleParseException}.
     */
    public Rule orElseThrow() {
        if (rule == null) {
            throw new RuleParseException(error, source);
        }
        return rule;
    }

    public ParseResult withPriority(int priority) {
        return rule == null ? this : new ParseResult(source, rule.withPriority(priority), null, diagnostics);
    }
}
