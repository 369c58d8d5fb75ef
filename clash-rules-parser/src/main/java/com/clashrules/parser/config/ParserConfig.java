/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.parser.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration for rule parsing.
 *
 * <p><b>Sources</b>, later ones winning:
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>{@code clash-rules.properties} on the classpath ({@link #load()} only)</li>
 *   <li>environment variables {@code CLASH_RULES_<PROPERTY_NAME>}</li>
 * </ol>
 *
 * <p>Example environment variables:
 * <pre>
 * CLASH_RULES_DEDUPE_ENABLED=true
 * CLASH_RULES_FAIL_FAST=false
 * CLASH_RULES_CACHE_MAX_SIZE=50000
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * ParserConfig config = ParserConfig.builder()
 *     .dedupeEnabled(true)
 *     .cacheEnabled(true)
 *     .cacheMaxSize(20_000)
 *     .build();
 *
 * RuleBatchParser batchParser = new RuleBatchParser(config, tracer);
 * }</pre>
 */
public final class ParserConfig {

    private static final Logger logger = LoggerFactory.getLogger(ParserConfig.class);

    public static final String RESOURCE_NAME = "clash-rules.properties";

    // ========================================================================
    // PROPERTY AND ENVIRONMENT KEYS
    // ========================================================================

    static final String PROP_DEDUPE_ENABLED = "parser.dedupe.enabled";
    static final String PROP_FAIL_FAST = "parser.fail.fast";
    static final String PROP_COMMENTS_ENABLED = "parser.comments.enabled";
    static final String PROP_CACHE_ENABLED = "parser.cache.enabled";
    static final String PROP_CACHE_MAX_SIZE = "parser.cache.max.size";

    private static final String ENV_DEDUPE_ENABLED = "CLASH_RULES_DEDUPE_ENABLED";
    private static final String ENV_FAIL_FAST = "CLASH_RULES_FAIL_FAST";
    private static final String ENV_COMMENTS_ENABLED = "CLASH_RULES_COMMENTS_ENABLED";
    private static final String ENV_CACHE_ENABLED = "CLASH_RULES_CACHE_ENABLED";
    private static final String ENV_CACHE_MAX_SIZE = "CLASH_RULES_CACHE_MAX_SIZE";

    // ========================================================================
    // DEFAULTS
    // ========================================================================

    private static final boolean DEFAULT_DEDUPE_ENABLED = false;
    private static final boolean DEFAULT_FAIL_FAST = false;
    private static final boolean DEFAULT_COMMENTS_ENABLED = true;
    private static final boolean DEFAULT_CACHE_ENABLED = false;
    private static final long DEFAULT_CACHE_MAX_SIZE = 10_000;

    private final boolean dedupeEnabled;
    private final boolean failFast;
    private final boolean commentsEnabled;
    private final boolean cacheEnabled;
    private final long cacheMaxSize;

    private ParserConfig(Builder builder) {
        this.dedupeEnabled = builder.dedupeEnabled;
        this.failFast = builder.failFast;
        this.commentsEnabled = builder.commentsEnabled;
        this.cacheEnabled = builder.cacheEnabled;
        this.cacheMaxSize = builder.cacheMaxSize;
        validate();
    }

    private void validate() {
        if (cacheMaxSize <= 0) {
            throw new IllegalArgumentException("cacheMaxSize must be positive, got " + cacheMaxSize);
        }
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static ParserConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads {@value #RESOURCE_NAME} from the classpath if present, then applies
     * environment overrides.
     */
    public static ParserConfig load() {
        Builder builder = builder();
        try (InputStream in = ParserConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                builder.applyProperties(props);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}, using defaults: {}", RESOURCE_NAME, e.getMessage());
        }
        return builder.applyEnvironment(System::getenv).build();
    }

    public static ParserConfig fromProperties(Properties props) {
        return builder().applyProperties(props).build();
    }

    /**
     * Defaults overridden by environment variables only.
     */
    public static ParserConfig fromEnvironment() {
        return builder().applyEnvironment(System::getenv).build();
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    /** Drop rules whose condition text repeats an earlier rule in the same batch. */
    public boolean isDedupeEnabled() {
        return dedupeEnabled;
    }

    /** Abort a batch on its first error instead of collecting per-input results. */
    public boolean isFailFast() {
        return failFast;
    }

    /** Treat lines starting with {@code #} as comments. */
    public boolean isCommentsEnabled() {
        return commentsEnabled;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public long getCacheMaxSize() {
        return cacheMaxSize;
    }

    public Builder toBuilder() {
        return builder()
                .dedupeEnabled(dedupeEnabled)
                .failFast(failFast)
                .commentsEnabled(commentsEnabled)
                .cacheEnabled(cacheEnabled)
                .cacheMaxSize(cacheMaxSize);
    }

    @Override
    public String toString() {
        return "ParserConfig{" +
                "dedupeEnabled=" + dedupeEnabled +
                ", failFast=" + failFast +
                ", commentsEnabled=" + commentsEnabled +
                ", cacheEnabled=" + cacheEnabled +
                ", cacheMaxSize=" + cacheMaxSize +
                '}';
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {
        private boolean dedupeEnabled = DEFAULT_DEDUPE_ENABLED;
        private boolean failFast = DEFAULT_FAIL_FAST;
        private boolean commentsEnabled = DEFAULT_COMMENTS_ENABLED;
        private boolean cacheEnabled = DEFAULT_CACHE_ENABLED;
        private long cacheMaxSize = DEFAULT_CACHE_MAX_SIZE;

        private Builder() {
        }

        public Builder dedupeEnabled(boolean dedupeEnabled) {
            this.dedupeEnabled = dedupeEnabled;
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public Builder commentsEnabled(boolean commentsEnabled) {
            this.commentsEnabled = commentsEnabled;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder cacheMaxSize(long cacheMaxSize) {
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        Builder applyProperties(Properties props) {
            readBoolean(props::getProperty, PROP_DEDUPE_ENABLED).ifPresent(this::dedupeEnabled);
            readBoolean(props::getProperty, PROP_FAIL_FAST).ifPresent(this::failFast);
            readBoolean(props::getProperty, PROP_COMMENTS_ENABLED).ifPresent(this::commentsEnabled);
            readBoolean(props::getProperty, PROP_CACHE_ENABLED).ifPresent(this::cacheEnabled);
            readLong(props::getProperty, PROP_CACHE_MAX_SIZE).ifPresent(this::cacheMaxSize);
            return this;
        }

        Builder applyEnvironment(Function<String, String> env) {
            readBoolean(env, ENV_DEDUPE_ENABLED).ifPresent(this::dedupeEnabled);
            readBoolean(env, ENV_FAIL_FAST).ifPresent(this::failFast);
            readBoolean(env, ENV_COMMENTS_ENABLED).ifPresent(this::commentsEnabled);
            readBoolean(env, ENV_CACHE_ENABLED).ifPresent(this::cacheEnabled);
            readLong(env, ENV_CACHE_MAX_SIZE).ifPresent(this::cacheMaxSize);
            return this;
        }

        public ParserConfig build() {
            return new ParserConfig(this);
        }

        // ====================================================================
        // VALUE HELPERS
        // ====================================================================

        private static Optional<String> read(Function<String, String> source, String key) {
            String value = source.apply(key);
            if (value != null && !value.trim().isEmpty()) {
                logger.debug("Loaded {}={}", key, value.trim());
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Boolean> readBoolean(Function<String, String> source, String key) {
            return read(source, key).map(val -> {
                String normalized = val.toLowerCase(Locale.ROOT);
                if (normalized.equals("true") || normalized.equals("1") || normalized.equals("yes")) {
                    return true;
                }
                if (normalized.equals("false") || normalized.equals("0") || normalized.equals("no")) {
                    return false;
                }
                logger.warn("Invalid boolean value for {}: {}", key, val);
                return null;
            });
        }

        private static Optional<Long> readLong(Function<String, String> source, String key) {
            return read(source, key).map(val -> {
                try {
                    return Long.parseLong(val);
                } catch (NumberFormatException e) {
                    logger.warn("Invalid long value for {}: {}", key, val);
                    return null;
                }
            });
        }
    }
}
