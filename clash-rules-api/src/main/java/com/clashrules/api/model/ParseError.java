/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.api.model;

import java.util.Objects;

/**
 * Why a rule could not be parsed.
 *
 * @param kind   the error category
 * @param detail the offending token, field name or input text
 */
public record ParseError(ErrorKind kind, String detail) {

    public enum ErrorKind {
        /** Blank input. Callers treat this as "skip", not as a failure. */
        EMPTY,
        UNKNOWN_RULE_KIND,
        /** A simple rule with fewer than three fields. */
        INVALID_RULE_FORMAT,
        INVALID_MATCH_FORMAT,
        INVALID_LOGIC_FORMAT,
        MISSING_FIELD,
        EMPTY_CONDITIONS,
        /** A structured entry that is neither a string nor a key/value object. */
        INVALID_INPUT
    }

    public ParseError {
        Objects.requireNonNull(kind, "Error kind cannot be null");
        detail = detail == null ? "" : detail;
    }

    public static ParseError empty() {
        return new ParseError(ErrorKind.EMPTY, "");
    }

    public static ParseError unknownRuleKind(String token) {
        return new ParseError(ErrorKind.UNKNOWN_RULE_KIND, token);
    }

    public static ParseError invalidRuleFormat(String line) {
        return new ParseError(ErrorKind.INVALID_RULE_FORMAT, line);
    }

    public static ParseError invalidMatchFormat(String line) {
        return new ParseError(ErrorKind.INVALID_MATCH_FORMAT, line);
    }

    public static ParseError invalidLogicFormat(String line) {
        return new ParseError(ErrorKind.INVALID_LOGIC_FORMAT, line);
    }

    public static ParseError missingField(String field) {
        return new ParseError(ErrorKind.MISSING_FIELD, field);
    }

    public static ParseError emptyConditions(String source) {
        return new ParseError(ErrorKind.EMPTY_CONDITIONS, source);
    }

    public static ParseError invalidInput(String description) {
        return new ParseError(ErrorKind.INVALID_INPUT, description);
    }

    public String describe() {
        return switch (kind) {
            case EMPTY -> "Empty rule";
            case UNKNOWN_RULE_KIND -> "Unknown rule type '" + detail + "'";
            case INVALID_RULE_FORMAT -> "Invalid rule format (needs at least 3 parts): " + detail;
            case INVALID_MATCH_FORMAT -> "Invalid MATCH rule format: " + detail;
            case INVALID_LOGIC_FORMAT -> "Invalid logic rule format: " + detail;
            case MISSING_FIELD -> "Missing required field: " + detail;
            case EMPTY_CONDITIONS -> "No valid conditions found: " + detail;
            case INVALID_INPUT -> "Unsupported rule entry: " + detail;
        };
    }
}
