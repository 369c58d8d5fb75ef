/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.parser;

import com.clashrules.api.IRuleParser;
import com.clashrules.api.ParseListener;
import com.clashrules.api.model.Diagnostic;
import com.clashrules.api.model.ParseResult;
import com.clashrules.api.model.Rule;
import com.clashrules.api.model.StructuredRule;
import com.clashrules.parser.cache.ParseResultCache;
import com.clashrules.parser.config.ParserConfig;
import com.clashrules.parser.logic.LogicDecomposer;
import com.clashrules.parser.structured.StructuredRuleAdapter;

/**
 * Default {@link IRuleParser}: textual lines go through the {@link LineParser}, structured
 * rules through the {@link StructuredRuleAdapter} and then the same line parser.
 *
 * <h2>Usage</h2>
 * <pre>
 * IRuleParser parser = new RuleParser();
 * Rule rule = parser.parseLine("DOMAIN-SUFFIX,google.com,Proxy");
 *
 * ParseResult result = parser.tryParseLine("AND,((DOMAIN,a.com),(BAD,x)),DIRECT");
 * result.rule();         // AND with one condition
 * result.diagnostics();  // UNKNOWN_CONDITION_KIND for "BAD,x"
 * </pre>
 */
public class RuleParser implements IRuleParser {

    private final LineParser lineParser;
    private final StructuredRuleAdapter structuredAdapter;
    private final ParseResultCache cache;
    private volatile ParseListener listener;

    public RuleParser() {
        this(ParserConfig.defaults());
    }

    public RuleParser(ParserConfig config) {
        this(new LineParser(new LogicDecomposer()),
                config.isCacheEnabled() ? new ParseResultCache(config.getCacheMaxSize()) : null);
    }

    RuleParser(LineParser lineParser, ParseResultCache cache) {
        this.lineParser = lineParser;
        this.structuredAdapter = new StructuredRuleAdapter(lineParser);
        this.cache = cache;
    }

    @Override
    public Rule parseLine(String line) {
        return tryParseLine(line).orElseThrow();
    }

    @Override
    public ParseResult tryParseLine(String line) {
        ParseResult result = (cache != null && line != null)
                ? cache.get(line, lineParser::tryParse)
                : lineParser.tryParse(line);
        return publish(result);
    }

    @Override
    public Rule parseStructured(StructuredRule rule) {
        return tryParseStructured(rule).orElseThrow();
    }

    @Override
    public ParseResult tryParseStructured(StructuredRule rule) {
        return publish(structuredAdapter.tryParse(rule));
    }

    @Override
    public Rule parseEntry(Object entry) {
        return tryParseEntry(entry).orElseThrow();
    }

    @Override
    public ParseResult tryParseEntry(Object entry) {
        if (entry instanceof String line) {
            return tryParseLine(line);
        }
        return publish(structuredAdapter.tryParseEntry(entry));
    }

    @Override
    public void setParseListener(ParseListener listener) {
        this.listener = listener;
    }

    /**
     * The result cache, or null when caching is disabled.
     */
    public ParseResultCache getCache() {
        return cache;
    }

    private ParseResult publish(ParseResult result) {
        ParseListener current = listener;
        if (current == null) {
            return result;
        }
        for (Diagnostic diagnostic : result.diagnostics()) {
            current.onDiagnostic(result.source(), diagnostic);
        }
        if (result.isSuccess()) {
            current.onRuleParsed(result.source(), result.rule());
        } else if (result.isFailure()) {
            current.onError(result.source(), result.error());
        }
        return result;
    }
}
