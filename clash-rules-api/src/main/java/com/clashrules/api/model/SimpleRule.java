/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.api.model;

import java.util.List;
import java.util.Objects;

/**
 * A single condition plus its action, e.g. {@code IP-CIDR,10.0.0.0/8,DIRECT,no-resolve}.
 *
 * @param kind        condition kind, never a combinator or MATCH
 * @param payload     the value matched by the condition
 * @param action      the action, or null when this rule is a condition inside a logic rule
 * @param extraParams trailing qualifiers such as {@code no-resolve}, in input order
 * @param rawText     the text this rule was parsed from
 * @param priority    position in the owning rule list
 */
public record SimpleRule(
        RuleKind kind,
        String payload,
        Action action,
        List<String> extraParams,
        String rawText,
        int priority
) implements Rule {

    public SimpleRule {
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(payload, "Payload cannot be null");
        if (!kind.isCondition()) {
            throw new IllegalArgumentException("Kind " + kind + " cannot be used in a simple rule");
        }
        extraParams = extraParams == null ? List.of() : List.copyOf(extraParams);
        rawText = rawText == null ? "" : rawText;
    }

    public SimpleRule(RuleKind kind, String payload, Action action) {
        this(kind, payload, action, List.of(), "", 0);
    }

    /**
     * Creates an action-less condition as found inside a logic rule body.
     */
    public static SimpleRule condition(RuleKind kind, String payload, String rawText) {
        return new SimpleRule(kind, payload, null, List.of(), rawText, 0);
    }

    /**
     * Checks if this rule is a nested condition rather than a standalone rule.
     */
    public boolean isCondition() {
        return action == null;
    }

    @Override
    public String conditionString() {
        return kind.token() + "," + payload;
    }

    @Override
    public SimpleRule withPriority(int priority) {
        return new SimpleRule(kind, payload, action, extraParams, rawText, priority);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SimpleRule that = (SimpleRule) o;
        return kind == that.kind &&
                payload.equals(that.payload) &&
                Objects.equals(action, that.action) &&
                extraParams.equals(that.extraParams);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, payload, action, extraParams);
    }
}
