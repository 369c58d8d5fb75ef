/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.api.model;

import java.util.Locale;

/**
 * Dispositions the proxy core implements itself, as opposed to user-defined proxy groups.
 */
public enum BuiltInAction {
    DIRECT("DIRECT"),
    REJECT("REJECT"),
    REJECT_DROP("REJECT-DROP"),
    PASS("PASS"),
    COMPATIBLE("COMPATIBLE");

    private final String token;

    BuiltInAction(String token) {
        this.token = token;
    }

    /**
     * Safely converts a token to a built-in action.
     *
     * @param text the action token, matched case-insensitively
     * @return the built-in action, or null if the text names something else
     */
    public static BuiltInAction fromToken(String text) {
        if (text == null) return null;
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        for (BuiltInAction action : values()) {
            if (action.token.equals(normalized)) {
                return action;
            }
        }
        return null;
    }

    public String token() {
        return token;
    }
}
