/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.api.model;

import java.util.Objects;

/**
 * A non-fatal problem found while parsing, such as a logic rule condition that was dropped.
 *
 * @param kind    the problem category
 * @param text    the offending text
 * @param message human readable description
 */
public record Diagnostic(Kind kind, String text, String message) {

    public enum Kind {
        /** A condition group that is not exactly {@code kind,payload}. */
        INVALID_CONDITION_FORMAT,
        UNKNOWN_CONDITION_KIND,
        /** A combinator or MATCH used as a condition; nested logic is not decomposed. */
        UNSUPPORTED_CONDITION_KIND,
        UNMATCHED_CLOSING_PARENTHESIS,
        /** Input ended while a condition group was still open. */
        UNCLOSED_GROUP
    }

    public Diagnostic {
        Objects.requireNonNull(kind, "Diagnostic kind cannot be null");
        text = text == null ? "" : text;
        message = message == null ? "" : message;
    }
}
