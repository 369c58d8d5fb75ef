/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.parser.logic;

import com.clashrules.api.model.Diagnostic;
import com.clashrules.api.model.RuleKind;
import com.clashrules.api.model.SimpleRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the body of a logic rule into its top-level parenthesized conditions.
 *
 * <p>Single left-to-right scan with a depth counter and a buffer:
 * <ul>
 *   <li>{@code (} opens a group; when already inside one it is kept in the buffer</li>
 *   <li>{@code )} closes a group; when depth returns to 0 the buffer is one condition</li>
 *   <li>anything else is buffered only while inside a group, so separators are dropped</li>
 * </ul>
 *
 * <p>A group that is not a valid {@code kind,payload} pair is dropped with a
 * {@link Diagnostic} instead of failing the whole rule, so a partially corrupt
 * subscription still yields its usable conditions. Groups are never re-entered as logic
 * rules: a nested {@code AND,(...)} group is reported and dropped.
 *
 * <p>Example: {@code (DOMAIN,ad.com),(NETWORK,UDP)} yields two conditions.
 */
public class LogicDecomposer {

    private static final Logger logger = LoggerFactory.getLogger(LogicDecomposer.class);

    /**
     * Decomposes a logic rule body.
     *
     * @param body the text between the outer parentheses of a logic rule
     * @return the valid conditions in order, and a diagnostic per dropped group
     */
    public Decomposition decompose(String body) {
        List<SimpleRule> conditions = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (body == null || body.isEmpty()) {
            return new Decomposition(conditions, diagnostics);
        }

        StringBuilder current = new StringBuilder();
        int depth = 0;

        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '(') {
                if (depth > 0) {
                    current.append(c);
                }
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    report(diagnostics, new Diagnostic(Diagnostic.Kind.UNMATCHED_CLOSING_PARENTHESIS, body,
                            "Unmatched closing parenthesis at offset " + i));
                    continue;
                }
                depth--;
                if (depth == 0) {
                    SimpleRule condition = parseCondition(current.toString(), diagnostics);
                    if (condition != null) {
                        conditions.add(condition);
                    }
                    current.setLength(0);
                } else {
                    current.append(c);
                }
            } else if (depth > 0) {
                current.append(c);
            }
        }

        if (depth > 0) {
            report(diagnostics, new Diagnostic(Diagnostic.Kind.UNCLOSED_GROUP, current.toString(),
                    "Condition group is never closed"));
        }
        return new Decomposition(conditions, diagnostics);
    }

    /**
     * Parses one group as a {@code kind,payload} pair, splitting on the first comma only.
     * Returns null and records a diagnostic if the group is unusable.
     */
    SimpleRule parseCondition(String group, List<Diagnostic> diagnostics) {
        String[] split = group.split(",", 2);
        if (split.length != 2 || split[0].isBlank() || split[1].isBlank()) {
            report(diagnostics, new Diagnostic(Diagnostic.Kind.INVALID_CONDITION_FORMAT, group,
                    "Invalid condition format: " + group));
            return null;
        }

        String token = split[0].trim();
        String payload = split[1].trim();
        RuleKind kind = RuleKind.fromToken(token);
        if (kind == null) {
            report(diagnostics, new Diagnostic(Diagnostic.Kind.UNKNOWN_CONDITION_KIND, group,
                    "Invalid rule type in condition: " + token));
            return null;
        }
        if (!kind.isCondition()) {
            report(diagnostics, new Diagnostic(Diagnostic.Kind.UNSUPPORTED_CONDITION_KIND, group,
                    kind + " cannot be used as a condition"));
            return null;
        }
        return SimpleRule.condition(kind, payload, group);
    }

    private void report(List<Diagnostic> diagnostics, Diagnostic diagnostic) {
        logger.debug("Skipping condition '{}': {}", diagnostic.text(), diagnostic.message());
        diagnostics.add(diagnostic);
    }
}
