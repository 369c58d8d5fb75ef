/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Closed set of condition kinds understood by the rule language.
 *
 * <p>The token of each constant is the exact text used in a rule line. The static
 * {@link #fromToken(String)} table built from these tokens is the only place that maps
 * text to a kind; adding a kind means adding a constant here.
 */
public enum RuleKind {
    DOMAIN("DOMAIN"),
    DOMAIN_SUFFIX("DOMAIN-SUFFIX"),
    DOMAIN_KEYWORD("DOMAIN-KEYWORD"),
    DOMAIN_REGEX("DOMAIN-REGEX"),
    GEOSITE("GEOSITE"),

    IP_CIDR("IP-CIDR"),
    IP_CIDR6("IP-CIDR6"),
    IP_SUFFIX("IP-SUFFIX"),
    IP_ASN("IP-ASN"),
    GEOIP("GEOIP"),

    SRC_GEOIP("SRC-GEOIP"),
    SRC_IP_ASN("SRC-IP-ASN"),
    SRC_IP_CIDR("SRC-IP-CIDR"),
    SRC_IP_SUFFIX("SRC-IP-SUFFIX"),

    DST_PORT("DST-PORT"),
    SRC_PORT("SRC-PORT"),

    IN_PORT("IN-PORT"),
    IN_TYPE("IN-TYPE"),
    IN_USER("IN-USER"),
    IN_NAME("IN-NAME"),

    PROCESS_PATH("PROCESS-PATH"),
    PROCESS_PATH_REGEX("PROCESS-PATH-REGEX"),
    PROCESS_NAME("PROCESS-NAME"),
    PROCESS_NAME_REGEX("PROCESS-NAME-REGEX"),

    UID("UID"),
    NETWORK("NETWORK"),
    DSCP("DSCP"),

    RULE_SET("RULE-SET"),
    AND("AND"),
    OR("OR"),
    NOT("NOT"),
    SUB_RULE("SUB-RULE"),

    MATCH("MATCH");

    private static final Map<String, RuleKind> BY_TOKEN;

    static {
        Map<String, RuleKind> byToken = new HashMap<>();
        for (RuleKind kind : values()) {
            byToken.put(kind.token, kind);
        }
        BY_TOKEN = Collections.unmodifiableMap(byToken);
    }

    private final String token;

    RuleKind(String token) {
        this.token = token;
    }

    /**
     * Resolves a textual token to a kind, ignoring case and surrounding whitespace.
     *
     * @param token the token, e.g. "DOMAIN-SUFFIX"
     * @return the matching kind, or null if the token is unknown
     */
    public static RuleKind fromToken(String token) {
        if (token == null) return null;
        return BY_TOKEN.get(token.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String token() {
        return token;
    }

    /**
     * Checks if this kind is one of the AND/OR/NOT combinators.
     */
    public boolean isLogic() {
        return this == AND || this == OR || this == NOT;
    }

    public boolean isMatch() {
        return this == MATCH;
    }

    /**
     * Checks if this kind can stand as a leaf condition (neither a combinator nor MATCH).
     */
    public boolean isCondition() {
        return !isLogic() && !isMatch();
    }

    @Override
    public String toString() {
        return token;
    }
}
