/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a structured logic rule's {@code conditions} list.
 *
 * <p>Deserializes from either a plain string such as {@code "(DOMAIN,ad.com)"} or an
 * object {@code {"type": "DOMAIN", "payload": "ad.com"}}. Exactly one of {@code text} or
 * the type/payload pair is meaningful.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StructuredCondition(String type, String payload, String text) {

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public StructuredCondition(
            @JsonProperty("type") String type,
            @JsonProperty("payload") String payload,
            @JsonProperty("text") String text) {
        this.type = type;
        this.payload = payload;
        this.text = text;
    }

    /**
     * Single-string creator, used for bare string entries only; objects go through the
     * properties creator.
     */
    @JsonCreator
    public static StructuredCondition ofText(String text) {
        return new StructuredCondition(null, null, text);
    }

    public static StructuredCondition of(String type, String payload) {
        return new StructuredCondition(type, payload, null);
    }

    public boolean isText() {
        return text != null;
    }

    /**
     * Text conditions serialize back to a bare string, typed ones to a two-field object.
     */
    @JsonValue
    public Object jsonValue() {
        if (isText()) {
            return text;
        }
        Map<String, String> map = new LinkedHashMap<>();
        map.put("type", type);
        map.put("payload", payload);
        return map;
    }
}
