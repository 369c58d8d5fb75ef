/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.api.model;

import java.util.List;

/**
 * Result of parsing an ordered list of rule inputs.
 *
 * @param results one result per input, in input order
 * @param rules   accepted rules in order, with priorities assigned by position
 * @param stats   counters over the batch
 */
public record BatchParseResult(
        List<ParseResult> results,
        List<Rule> rules,
        BatchStats stats
) {

    public BatchParseResult {
        results = List.copyOf(results);
        rules = List.copyOf(rules);
    }

    public List<ParseResult> failures() {
        return results.stream().filter(ParseResult::isFailure).toList();
    }

    public List<Diagnostic> diagnostics() {
        return results.stream().flatMap(r -> r.diagnostics().stream()).toList();
    }

    /**
     * @param total      number of inputs
     * @param parsed     inputs that produced a rule, duplicates included
     * @param skipped    blank lines and comments
     * @param failed     inputs that produced an error
     * @param duplicates parsed rules dropped because an earlier rule had the same condition
     */
    public record BatchStats(
            int total,
            int parsed,
            int skipped,
            int failed,
            int duplicates
    ) {
        public int accepted() {
            return parsed - duplicates;
        }
    }
}
