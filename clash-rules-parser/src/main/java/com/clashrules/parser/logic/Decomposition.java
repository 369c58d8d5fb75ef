/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.parser.logic;

import com.clashrules.api.model.Diagnostic;
import com.clashrules.api.model.SimpleRule;

import java.util.List;

/**
 * Conditions recovered from a logic rule body, plus the groups that were dropped.
 */
public record Decomposition(List<SimpleRule> conditions, List<Diagnostic> diagnostics) {

    public Decomposition {
        conditions = List.copyOf(conditions);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }
}
