/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.api;

import com.clashrules.api.model.Diagnostic;
import com.clashrules.api.model.ParseError;
import com.clashrules.api.model.Rule;

/**
 * Callback interface for parse events.
 * Lets callers count, surface or ignore problems without parsing the results twice.
 *
 * <h2>Usage</h2>
 * <pre>
 * IRuleParser parser = new RuleParser();
 * parser.setParseListener(new ParseListener() {
 *     {@literal @}Override
 *     public void onDiagnostic(String source, Diagnostic diagnostic) {
 *         System.err.printf("%s: dropped %s%n", source, diagnostic.text());
 *     }
 * });
 * </pre>
 */
public interface ParseListener {

    /**
     * Called after a rule was parsed successfully.
     */
    default void onRuleParsed(String source, Rule rule) {
    }

    /**
     * Called for every non-fatal problem, e.g. a dropped logic condition.
     */
    default void onDiagnostic(String source, Diagnostic diagnostic) {
    }

    /**
     * Called when an input could not be parsed. Not called for blank input.
     */
    default void onError(String source, ParseError error) {
    }
}
