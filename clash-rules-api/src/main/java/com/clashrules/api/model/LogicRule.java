/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.api.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An AND/OR/NOT combinator, e.g. {@code AND,((DOMAIN,ad.com),(NETWORK,UDP)),REJECT}.
 *
 * <p>{@code conditions} is typed as a list of {@link Rule} so that combinators may nest,
 * but the current logic decomposition only ever yields leaf {@link SimpleRule}
 * conditions. NOT conventionally holds one condition; that is not enforced here.
 *
 * @param kind       AND, OR or NOT
 * @param conditions the ordered, non-empty conditions
 * @param action     the action applied when the combinator matches
 * @param rawText    the text this rule was parsed from
 * @param priority   position in the owning rule list
 */
public record LogicRule(
        RuleKind kind,
        List<Rule> conditions,
        Action action,
        String rawText,
        int priority
) implements Rule {

    public LogicRule {
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(action, "Action cannot be null");
        if (!kind.isLogic()) {
            throw new IllegalArgumentException("Kind " + kind + " is not a logic combinator");
        }
        if (conditions == null || conditions.isEmpty()) {
            throw new IllegalArgumentException("Logic rule requires at least one condition");
        }
        conditions = List.copyOf(conditions);
        rawText = rawText == null ? "" : rawText;
    }

    public LogicRule(RuleKind kind, List<Rule> conditions, Action action) {
        this(kind, conditions, action, "", 0);
    }

    @Override
    public String conditionString() {
        String body = conditions.stream()
                .map(Rule::conditionString)
                .collect(Collectors.joining("),("));
        return kind.token() + ",((" + body + "))";
    }

    @Override
    public LogicRule withPriority(int priority) {
        return new LogicRule(kind, conditions, action, rawText, priority);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LogicRule that = (LogicRule) o;
        return kind == that.kind &&
                conditions.equals(that.conditions) &&
                action.equals(that.action);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, conditions, action);
    }
}
