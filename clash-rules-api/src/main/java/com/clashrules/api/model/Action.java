/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.api.model;

import java.util.Objects;

/**
 * What happens to traffic once a rule matches: either a {@link BuiltInAction}
 * or the name of a user-defined proxy group.
 */
public sealed interface Action permits Action.BuiltIn, Action.Named {

    /**
     * Resolves an action token. Built-in dispositions are recognized case-insensitively;
     * any other text is kept verbatim as a proxy group name.
     *
     * @param token the trimmed action text
     * @return the resolved action
     * @throws IllegalArgumentException if the token is null or blank
     */
    static Action of(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Action token cannot be blank");
        }
        BuiltInAction builtIn = BuiltInAction.fromToken(token);
        return builtIn != null ? new BuiltIn(builtIn) : new Named(token.trim());
    }

    static Action of(BuiltInAction action) {
        return new BuiltIn(action);
    }

    /**
     * The canonical text of this action as it appears in a rule line.
     */
    String token();

    record BuiltIn(BuiltInAction value) implements Action {
        public BuiltIn {
            Objects.requireNonNull(value, "Built-in action cannot be null");
        }

        @Override
        public String token() {
            return value.token();
        }
    }

    record Named(String group) implements Action {
        public Named {
            Objects.requireNonNull(group, "Group name cannot be null");
            if (group.isBlank()) {
                throw new IllegalArgumentException("Group name cannot be blank");
            }
        }

        @Override
        public String token() {
            return group;
        }
    }
}
