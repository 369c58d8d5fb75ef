/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.parser.structured;

import com.clashrules.api.exceptions.RuleParseException;
import com.clashrules.api.model.Diagnostic;
import com.clashrules.api.model.ParseError;
import com.clashrules.api.model.ParseResult;
import com.clashrules.api.model.Rule;
import com.clashrules.api.model.RuleKind;
import com.clashrules.api.model.StructuredCondition;
import com.clashrules.api.model.StructuredRule;
import com.clashrules.parser.LineParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses key/value rules by rewriting them into canonical rule text and handing that text
 * to the {@link LineParser}. Structured and textual input therefore share one parser and
 * cannot diverge in interpretation.
 *
 * <p>Example: {@code {"type": "DOMAIN", "payload": "x.com", "action": "DIRECT"}} becomes
 * {@code DOMAIN,x.com,DIRECT}.
 */
public class StructuredRuleAdapter {

    private final LineParser lineParser;
    private final ObjectMapper objectMapper;

    public StructuredRuleAdapter(LineParser lineParser) {
        this(lineParser, new ObjectMapper()
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true));
    }

    public StructuredRuleAdapter(LineParser lineParser, ObjectMapper objectMapper) {
        this.lineParser = lineParser;
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a structured rule without throwing for malformed input.
     */
    public ParseResult tryParse(StructuredRule rule) {
        String text;
        try {
            text = toRuleText(rule);
        } catch (RuleParseException e) {
            return ParseResult.failure(String.valueOf(rule), e.getError(), List.of());
        }
        return lineParser.tryParse(text);
    }

    /**
     * Parses a structured rule, failing fast.
     *
     * @throws RuleParseException if a required field is missing or the rule text is malformed
     */
    public Rule parse(StructuredRule rule, List<Diagnostic> diagnostics) {
        return lineParser.parse(toRuleText(rule), diagnostics);
    }

    /**
     * Parses an entry as produced by a YAML or JSON loader.
     * Strings are rule lines; maps and {@link StructuredRule}s are structured rules.
     */
    public ParseResult tryParseEntry(Object entry) {
        if (entry instanceof String line) {
            return lineParser.tryParse(line);
        }
        if (entry instanceof StructuredRule rule) {
            return tryParse(rule);
        }
        if (entry instanceof Map<?, ?> map) {
            try {
                return tryParse(fromMap(map));
            } catch (RuleParseException e) {
                return ParseResult.failure(String.valueOf(map), e.getError(), List.of());
            }
        }
        String description = entry == null ? "null" : entry.getClass().getSimpleName() + ": " + entry;
        return ParseResult.failure(String.valueOf(entry), ParseError.invalidInput(description), List.of());
    }

    /**
     * Converts a loosely typed map (e.g. a YAML mapping) into a {@link StructuredRule}.
     *
     * @throws RuleParseException with {@code INVALID_INPUT} if the map has the wrong shape
     */
    public StructuredRule fromMap(Map<?, ?> map) {
        try {
            return objectMapper.convertValue(map, StructuredRule.class);
        } catch (IllegalArgumentException e) {
            throw new RuleParseException(ParseError.invalidInput(String.valueOf(map)), String.valueOf(map), e);
        }
    }

    /**
     * Builds the canonical rule text for a structured rule.
     *
     * @throws RuleParseException if {@code type}, {@code payload} or {@code action} is
     *                            missing, or a logic rule has no usable conditions
     */
    public String toRuleText(StructuredRule rule) {
        if (rule == null) {
            throw new RuleParseException(ParseError.invalidInput("null"), "null");
        }
        if (isBlank(rule.type())) {
            throw new RuleParseException(ParseError.missingField("type"), String.valueOf(rule));
        }

        String type = rule.type().strip().toUpperCase(Locale.ROOT);
        RuleKind kind = RuleKind.fromToken(type);

        if (kind != null && kind.isLogic()) {
            String body = buildConditionBody(rule.conditions());
            if (body.isEmpty()) {
                throw new RuleParseException(ParseError.emptyConditions(type), String.valueOf(rule));
            }
            return type + ",(" + body + ")," + requireAction(rule);
        }

        if (kind != null && kind.isMatch()) {
            return type + "," + requireAction(rule);
        }

        if (isBlank(rule.payload())) {
            throw new RuleParseException(ParseError.missingField("payload"), String.valueOf(rule));
        }
        StringBuilder text = new StringBuilder()
                .append(type).append(',')
                .append(rule.payload().strip()).append(',')
                .append(requireAction(rule));
        for (String param : rule.extraParams()) {
            if (!isBlank(param)) {
                text.append(',').append(param.strip());
            }
        }
        return text.toString();
    }

    /**
     * Joins the usable conditions as {@code (kind,payload),(kind,payload)}. Object entries
     * missing type or payload are skipped; bare string entries are parenthesized.
     */
    private String buildConditionBody(List<StructuredCondition> conditions) {
        List<String> groups = new ArrayList<>();
        for (StructuredCondition condition : conditions) {
            if (condition == null) continue;
            if (condition.isText()) {
                String text = condition.text().strip();
                if (text.isEmpty()) continue;
                groups.add(text.startsWith("(") ? text : "(" + text + ")");
            } else if (!isBlank(condition.type()) && !isBlank(condition.payload())) {
                groups.add("(" + condition.type().strip() + "," + condition.payload().strip() + ")");
            }
        }
        return String.join(",", groups);
    }

    private static String requireAction(StructuredRule rule) {
        if (isBlank(rule.action())) {
            throw new RuleParseException(ParseError.missingField("action"), String.valueOf(rule));
        }
        return rule.action().strip();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
