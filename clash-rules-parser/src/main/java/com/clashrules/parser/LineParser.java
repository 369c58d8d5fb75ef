/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.parser;

import com.clashrules.api.exceptions.RuleParseException;
import com.clashrules.api.model.Action;
import com.clashrules.api.model.Diagnostic;
import com.clashrules.api.model.LogicRule;
import com.clashrules.api.model.MatchRule;
import com.clashrules.api.model.ParseError;
import com.clashrules.api.model.ParseResult;
import com.clashrules.api.model.Rule;
import com.clashrules.api.model.RuleKind;
import com.clashrules.api.model.SimpleRule;
import com.clashrules.parser.logic.Decomposition;
import com.clashrules.parser.logic.LogicDecomposer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Converts one textual rule line into a {@link Rule}.
 *
 * <p>Dispatch is by prefix:
 * <ul>
 *   <li>{@code AND,} / {@code OR,} / {@code NOT,} (case-sensitive) - logic rule</li>
 *   <li>{@code MATCH,} (any case) - catch-all rule</li>
 *   <li>anything else - simple rule {@code kind,payload,action[,qualifier...]}</li>
 * </ul>
 *
 * <p>Stateless and thread-safe.
 */
public class LineParser {

    private static final String[] LOGIC_PREFIXES = {"AND,", "OR,", "NOT,"};
    private static final String MATCH_PREFIX = "MATCH,";

    private final LogicDecomposer decomposer;

    public LineParser() {
        this(new LogicDecomposer());
    }

    public LineParser(LogicDecomposer decomposer) {
        this.decomposer = decomposer;
    }

    /**
     * Parses a line without throwing for malformed input.
     */
    public ParseResult tryParse(String line) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        try {
            return ParseResult.success(line, parse(line, diagnostics), diagnostics);
        } catch (RuleParseException e) {
            return ParseResult.failure(line, e.getError(), diagnostics);
        }
    }

    /**
     * Parses a line, collecting non-fatal diagnostics into the given list.
     *
     * @param line        the rule text
     * @param diagnostics receives diagnostics for dropped logic conditions
     * @return the parsed rule
     * @throws RuleParseException if the line is blank or malformed
     */
    public Rule parse(String line, List<Diagnostic> diagnostics) {
        String text = line == null ? "" : line.strip();
        if (text.isEmpty()) {
            throw new RuleParseException(ParseError.empty(), line);
        }

        if (isLogicLine(text)) {
            return parseLogicRule(text, diagnostics);
        }
        if (text.toUpperCase(Locale.ROOT).startsWith(MATCH_PREFIX)) {
            return parseMatchRule(text);
        }
        return parseSimpleRule(text);
    }

    private boolean isLogicLine(String text) {
        for (String prefix : LOGIC_PREFIXES) {
            if (text.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private MatchRule parseMatchRule(String text) {
        List<String> parts = splitFields(text);
        if (parts.size() != 2) {
            throw new RuleParseException(ParseError.invalidMatchFormat(text), text);
        }
        return new MatchRule(Action.of(parts.get(1)), text, 0);
    }

    private SimpleRule parseSimpleRule(String text) {
        List<String> parts = splitFields(text);
        if (parts.isEmpty()) {
            throw new RuleParseException(ParseError.invalidRuleFormat(text), text);
        }

        String token = parts.get(0).toUpperCase(Locale.ROOT);
        RuleKind kind = RuleKind.fromToken(token);
        // Combinators and MATCH only get here when their prefix was malformed, e.g. "and," or "MATCH ,".
        if (kind != null && kind.isLogic()) {
            throw new RuleParseException(ParseError.invalidLogicFormat(text), text);
        }
        if (kind != null && kind.isMatch()) {
            throw new RuleParseException(ParseError.invalidMatchFormat(text), text);
        }
        if (parts.size() < 3) {
            throw new RuleParseException(ParseError.invalidRuleFormat(text), text);
        }
        if (kind == null) {
            throw new RuleParseException(ParseError.unknownRuleKind(token), text);
        }

        return new SimpleRule(
                kind,
                parts.get(1),
                Action.of(parts.get(2)),
                parts.subList(3, parts.size()),
                text,
                0
        );
    }

    /**
     * Parses {@code KIND,(BODY),ACTION}. BODY runs from the first parenthesis after KIND to
     * its matching parenthesis; ACTION is the rest after a comma and holds no comma itself.
     */
    private LogicRule parseLogicRule(String text, List<Diagnostic> diagnostics) {
        int comma = text.indexOf(',');
        RuleKind kind = RuleKind.fromToken(text.substring(0, comma));

        int open = skipWhitespace(text, comma + 1);
        if (open >= text.length() || text.charAt(open) != '(') {
            throw new RuleParseException(ParseError.invalidLogicFormat(text), text);
        }
        int close = findMatchingParenthesis(text, open);
        if (close < 0) {
            throw new RuleParseException(ParseError.invalidLogicFormat(text), text);
        }

        String suffix = text.substring(close + 1).strip();
        if (!suffix.startsWith(",")) {
            throw new RuleParseException(ParseError.invalidLogicFormat(text), text);
        }
        String actionToken = suffix.substring(1).strip();
        if (actionToken.isEmpty() || actionToken.indexOf(',') >= 0) {
            throw new RuleParseException(ParseError.invalidLogicFormat(text), text);
        }

        Decomposition decomposition = decomposer.decompose(text.substring(open + 1, close).strip());
        diagnostics.addAll(decomposition.diagnostics());
        if (decomposition.isEmpty()) {
            throw new RuleParseException(ParseError.emptyConditions(text), text);
        }

        return new LogicRule(kind, List.<Rule>copyOf(decomposition.conditions()), Action.of(actionToken), text, 0);
    }

    private static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Returns the index of the parenthesis closing the one at {@code open}, or -1.
     */
    private static int findMatchingParenthesis(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static List<String> splitFields(String text) {
        return Arrays.stream(text.split(","))
                .map(String::strip)
                .filter(part -> !part.isEmpty())
                .toList();
    }
}
