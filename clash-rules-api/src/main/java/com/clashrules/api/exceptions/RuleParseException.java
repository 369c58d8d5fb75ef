/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.api.exceptions;

import com.clashrules.api.model.ParseError;

/**
 * Exception thrown when a rule cannot be parsed.
 *
 * This is a RuntimeException so that fail-fast callers are not forced into checked
 * exception handling; lenient callers use the {@code tryParse} variants instead.
 */
public class RuleParseException extends RuntimeException {

    private final ParseError error;
    private final String input;

    public RuleParseException(ParseError error, String input) {
        super(error.describe());
        this.error = error;
        this.input = input;
    }

    public RuleParseException(ParseError error, String input, Throwable cause) {
        super(error.describe(), cause);
        this.error = error;
        this.input = input;
    }

    public ParseError getError() {
        return error;
    }

    public ParseError.ErrorKind getKind() {
        return error.kind();
    }

    /**
     * The rule text or entry description that failed to parse.
     */
    public String getInput() {
        return input;
    }
}
