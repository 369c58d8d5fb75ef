/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.api.model;

/**
 * One parsed routing directive.
 *
 * <p>A rule is one of three shapes:
 * <ul>
 *   <li>{@link SimpleRule} - a single condition, e.g. {@code DOMAIN-SUFFIX,google.com,Proxy}</li>
 *   <li>{@link LogicRule} - an AND/OR/NOT combinator over conditions</li>
 *   <li>{@link MatchRule} - the terminal catch-all</li>
 * </ul>
 *
 * <p>Rules are immutable and own their conditions outright, so a rule is always a tree.
 * Equality covers the logical identity of a rule only; {@link #rawText()} and
 * {@link #priority()} are metadata and never take part in {@code equals}.
 */
public sealed interface Rule permits SimpleRule, LogicRule, MatchRule {

    RuleKind kind();

    /**
     * The disposition of this rule. Null only for conditions nested in a {@link LogicRule}.
     */
    Action action();

    /**
     * The text this rule was parsed from.
     */
    String rawText();

    /**
     * Position of the rule in its rule list; 0 when parsed in isolation.
     */
    int priority();

    /**
     * Canonical condition text, without the action. Used for deduplication and display.
     */
    String conditionString();

    /**
     * Returns a copy of this rule with the given priority.
     */
    Rule withPriority(int priority);
}
