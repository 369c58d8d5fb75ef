/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.api.model;

import java.util.Objects;

/**
 * The terminal catch-all rule, e.g. {@code MATCH,DIRECT}. Carries no payload.
 */
public record MatchRule(
        Action action,
        String rawText,
        int priority
) implements Rule {

    public MatchRule {
        Objects.requireNonNull(action, "Action cannot be null");
        rawText = rawText == null ? "" : rawText;
    }

    public MatchRule(Action action) {
        this(action, "", 0);
    }

    @Override
    public RuleKind kind() {
        return RuleKind.MATCH;
    }

    @Override
    public String conditionString() {
        return RuleKind.MATCH.token();
    }

    @Override
    public MatchRule withPriority(int priority) {
        return new MatchRule(action, rawText, priority);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return action.equals(((MatchRule) o).action);
    }

    @Override
    public int hashCode() {
        return Objects.hash(RuleKind.MATCH, action);
    }
}
