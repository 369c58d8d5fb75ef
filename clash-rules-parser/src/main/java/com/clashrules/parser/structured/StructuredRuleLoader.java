/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.parser.structured;

import com.clashrules.api.model.StructuredRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a JSON array of rule entries from disk. Each element is either a rule line
 * string or a structured rule object; anything else is passed through as-is so the
 * batch parser can report it per entry.
 */
public class StructuredRuleLoader {

    private static final Logger logger = LoggerFactory.getLogger(StructuredRuleLoader.class);

    private final ObjectMapper objectMapper;

    public StructuredRuleLoader() {
        this(new ObjectMapper());
    }

    public StructuredRuleLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads rule entries from a JSON file.
     *
     * @param rulesPath path to a JSON array
     * @return entries in file order: {@link String} or {@link StructuredRule}, or the raw
     *         {@link JsonNode} for elements of any other shape
     * @throws IOException if the file cannot be read or is not a JSON array
     */
    public List<Object> load(Path rulesPath) throws IOException {
        List<Object> entries = parse(Files.readString(rulesPath));
        logger.debug("Loaded {} rule entries from {}", entries.size(), rulesPath);
        return entries;
    }

    public List<Object> parse(String json) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        if (root == null || !root.isArray()) {
            throw new IOException("Rule document must be a JSON array");
        }

        List<Object> entries = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            if (node.isTextual()) {
                entries.add(node.asText());
            } else if (node.isObject()) {
                entries.add(toStructuredRule(node));
            } else {
                entries.add(node);
            }
        }
        return entries;
    }

    private Object toStructuredRule(JsonNode node) {
        try {
            return objectMapper.treeToValue(node, StructuredRule.class);
        } catch (JsonProcessingException e) {
            logger.warn("Rule entry {} does not match the structured rule shape: {}", node, e.getOriginalMessage());
            // kept as a node so the batch reports it as invalid input
            return node;
        }
    }
}
