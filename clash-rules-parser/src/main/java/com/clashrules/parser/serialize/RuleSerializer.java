/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.parser.serialize;

import com.clashrules.api.model.LogicRule;
import com.clashrules.api.model.MatchRule;
import com.clashrules.api.model.Rule;
import com.clashrules.api.model.SimpleRule;
import com.clashrules.api.model.StructuredCondition;
import com.clashrules.api.model.StructuredRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders rules back to canonical text or to the structured key/value form.
 *
 * <p>For every well-formed line, {@code render(parse(line))} equals the line with
 * whitespace normalized, and parsing the rendered text yields an equal rule.
 */
public final class RuleSerializer {

    private RuleSerializer() {
    }

    /**
     * Canonical condition text without the action, e.g. {@code DOMAIN,ad.com}.
     */
    public static String conditionString(Rule rule) {
        return rule.conditionString();
    }

    /**
     * Renders the full rule line, e.g. {@code IP-CIDR,10.0.0.0/8,DIRECT,no-resolve}.
     * A nested condition (no action) renders as its condition text.
     */
    public static String render(Rule rule) {
        if (rule instanceof SimpleRule simple) {
            if (simple.isCondition()) {
                return simple.conditionString();
            }
            StringBuilder line = new StringBuilder(simple.conditionString())
                    .append(',').append(simple.action().token());
            for (String param : simple.extraParams()) {
                line.append(',').append(param);
            }
            return line.toString();
        }
        if (rule instanceof LogicRule logic) {
            return logic.conditionString() + "," + logic.action().token();
        }
        if (rule instanceof MatchRule match) {
            return match.conditionString() + "," + match.action().token();
        }
        throw new IllegalStateException("Unsupported rule type: " + rule.getClass().getName());
    }

    public static List<String> renderAll(List<? extends Rule> rules) {
        return rules.stream().map(RuleSerializer::render).toList();
    }

    /**
     * Converts a rule to the structured form accepted by the structured rule adapter.
     */
    public static StructuredRule toStructured(Rule rule) {
        if (rule instanceof SimpleRule simple) {
            String action = simple.isCondition() ? null : simple.action().token();
            return StructuredRule.simple(simple.kind().token(), simple.payload(), action, simple.extraParams());
        }
        if (rule instanceof LogicRule logic) {
            List<StructuredCondition> conditions = new ArrayList<>(logic.conditions().size());
            for (Rule condition : logic.conditions()) {
                if (condition instanceof SimpleRule simple) {
                    conditions.add(StructuredCondition.of(simple.kind().token(), simple.payload()));
                } else {
                    conditions.add(StructuredCondition.ofText("(" + condition.conditionString() + ")"));
                }
            }
            return StructuredRule.logic(logic.kind().token(), conditions, logic.action().token());
        }
        if (rule instanceof MatchRule match) {
            return StructuredRule.match(match.action().token());
        }
        throw new IllegalStateException("Unsupported rule type: " + rule.getClass().getName());
    }
}
