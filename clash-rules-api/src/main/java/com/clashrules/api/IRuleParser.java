/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.api;

import com.clashrules.api.exceptions.RuleParseException;
import com.clashrules.api.model.ParseResult;
import com.clashrules.api.model.Rule;
import com.clashrules.api.model.StructuredRule;

/**
 * Contract for turning rule text or structured rule entries into {@link Rule} values.
 *
 * <p>Every method is a pure function of its input and safe to call from many threads.
 * The {@code parse*} methods fail fast with {@link RuleParseException}; the
 * {@code tryParse*} methods never throw for bad input and report errors in the result.
 */
public interface IRuleParser {

    /**
     * Parses one textual rule line.
     *
     * @param line the rule line, e.g. {@code DOMAIN-SUFFIX,google.com,Proxy}
     * @return the parsed rule
     * @throws RuleParseException if the line is blank or malformed
     */
    Rule parseLine(String line);

    ParseResult tryParseLine(String line);

    /**
     * Parses a structured rule by normalizing it to rule text first.
     *
     * @throws RuleParseException if a required field is missing or the text is malformed
     */
    Rule parseStructured(StructuredRule rule);

    ParseResult tryParseStructured(StructuredRule rule);

    /**
     * Parses a loosely typed entry as produced by a YAML or JSON loader: a string is
     * parsed as a line, a map as a structured rule.
     */
    ParseResult tryParseEntry(Object entry);

    /**
     * Fail-fast variant of {@link #tryParseEntry(Object)}.
     *
     * @throws RuleParseException if the entry is blank, malformed or of an unsupported shape
     */
    Rule parseEntry(Object entry);

    /**
     * Sets a listener for parse events.
     *
     * @param listener the listener (null to disable)
     */
    default void setParseListener(ParseListener listener) {
    }
}
