/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.parser.batch;

import com.clashrules.api.IRuleParser;
import com.clashrules.api.exceptions.RuleParseException;
import com.clashrules.api.model.BatchParseResult;
import com.clashrules.api.model.ParseError;
import com.clashrules.api.model.ParseResult;
import com.clashrules.api.model.Rule;
import com.clashrules.parser.RuleParser;
import com.clashrules.parser.config.ParserConfig;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses an ordered list of rule inputs into an ordered rule list.
 *
 * <p>Each input is parsed independently, so one malformed line never aborts the batch
 * unless fail-fast is configured. The result keeps one {@link ParseResult} per input in
 * input order; accepted rules get their position as priority.
 *
 * <p>With deduplication enabled, a rule whose condition text was already seen is dropped
 * (first occurrence wins).
 */
public class RuleBatchParser {

    private static final Logger logger = LoggerFactory.getLogger(RuleBatchParser.class);

    private final IRuleParser parser;
    private final ParserConfig config;
    private final Tracer tracer;

    public RuleBatchParser(ParserConfig config, Tracer tracer) {
        this(new RuleParser(config), config, tracer);
    }

    public RuleBatchParser(IRuleParser parser, ParserConfig config, Tracer tracer) {
        this.parser = parser;
        this.config = config;
        this.tracer = tracer;
    }

    /**
     * Parses rule lines, e.g. the {@code rules:} list of a Clash configuration.
     *
     * @throws RuleParseException on the first failing line if fail-fast is enabled
     */
    public BatchParseResult parseLines(List<String> lines) {
        return parseEntries(lines);
    }

    /**
     * Parses loosely typed entries: rule line strings, structured rules, or maps.
     *
     * @throws RuleParseException on the first failing entry if fail-fast is enabled
     */
    public BatchParseResult parseEntries(List<?> entries) {
        Span span = tracer.spanBuilder("parse-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("inputCount", entries.size());

            List<ParseResult> results = new ArrayList<>(entries.size());
            List<Rule> rules = new ArrayList<>();
            Set<String> seenConditions = new HashSet<>();
            int parsed = 0, skipped = 0, failed = 0, duplicates = 0;

            for (Object entry : entries) {
                ParseResult result = isComment(entry)
                        ? ParseResult.failure((String) entry, ParseError.empty(), List.of())
                        : parser.tryParseEntry(entry);

                if (result.isSuccess()) {
                    parsed++;
                    if (config.isDedupeEnabled() && !seenConditions.add(result.rule().conditionString())) {
                        logger.debug("Dropping duplicate rule '{}'", result.source());
                        duplicates++;
                    } else {
                        result = result.withPriority(rules.size());
                        rules.add(result.rule());
                    }
                } else if (result.isSkipped()) {
                    skipped++;
                } else {
                    failed++;
                    if (config.isFailFast()) {
                        throw new RuleParseException(result.error(), result.source());
                    }
                    logger.debug("Skipping invalid rule '{}': {}", result.source(), result.error().describe());
                }
                results.add(result);
            }

            BatchParseResult.BatchStats stats =
                    new BatchParseResult.BatchStats(entries.size(), parsed, skipped, failed, duplicates);
            span.setAttribute("acceptedCount", stats.accepted());
            span.setAttribute("failedCount", failed);

            logger.info("Parsed {} rule entries: {} accepted, {} skipped, {} failed, {} duplicates",
                    stats.total(), stats.accepted(), skipped, failed, duplicates);

            return new BatchParseResult(results, rules, stats);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private boolean isComment(Object entry) {
        return config.isCommentsEnabled()
                && entry instanceof String line
                && line.strip().startsWith("#");
    }
}
