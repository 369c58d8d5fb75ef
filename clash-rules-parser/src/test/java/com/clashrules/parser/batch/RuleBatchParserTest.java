package com.clashrules.parser.batch;

import com.clashrules.api.IRuleParser;
import com.clashrules.api.exceptions.RuleParseException;
import com.clashrules.api.model.BatchParseResult;
import com.clashrules.api.model.Diagnostic;
import com.clashrules.api.model.ParseError;
import com.clashrules.api.model.ParseResult;
import com.clashrules.api.model.Rule;
import com.clashrules.api.model.StructuredRule;
import com.clashrules.parser.config.ParserConfig;
import com.clashrules.parser.serialize.RuleSerializer;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RuleBatchParserTest {

    private static final List<String> SUBSCRIPTION = List.of(
            "# ad blocking",
            "DOMAIN-SUFFIX,ads.example.com,REJECT",
            "",
            "FOO,bar,DIRECT",
            "AND,((DOMAIN,a.com),(NETWORK,UDP)),Proxy",
            "DOMAIN-SUFFIX,ads.example.com,DIRECT",
            "MATCH,DIRECT"
    );

    private Tracer tracer;

    @BeforeEach
    void setUp() {
        tracer = OpenTelemetry.noop().getTracer("test");
    }

    private RuleBatchParser batchParser(ParserConfig config) {
        return new RuleBatchParser(config, tracer);
    }

    @Test
    @DisplayName("Should keep one result per input in input order")
    void shouldKeepResultsInOrder() {
        BatchParseResult result = batchParser(ParserConfig.defaults()).parseLines(SUBSCRIPTION);

        assertThat(result.results()).extracting(ParseResult::source).containsExactlyElementsOf(SUBSCRIPTION);
        assertThat(result.results()).extracting(ParseResult::isSuccess)
                .containsExactly(false, true, false, false, true, true, true);
    }

    @Test
    @DisplayName("Should assign priorities by position among accepted rules")
    void shouldAssignPriorities() {
        BatchParseResult result = batchParser(ParserConfig.defaults()).parseLines(SUBSCRIPTION);

        assertThat(result.rules()).extracting(Rule::priority).containsExactly(0, 1, 2, 3);
        assertThat(result.rules()).extracting(RuleSerializer::render).containsExactly(
                "DOMAIN-SUFFIX,ads.example.com,REJECT",
                "AND,((DOMAIN,a.com),(NETWORK,UDP)),Proxy",
                "DOMAIN-SUFFIX,ads.example.com,DIRECT",
                "MATCH,DIRECT");
    }

    @Test
    @DisplayName("Should count parsed, skipped and failed inputs")
    void shouldCountStats() {
        BatchParseResult result = batchParser(ParserConfig.defaults()).parseLines(SUBSCRIPTION);

        assertThat(result.stats()).isEqualTo(new BatchParseResult.BatchStats(7, 4, 2, 1, 0));
        assertThat(result.failures()).singleElement()
                .extracting(ParseResult::error)
                .isEqualTo(ParseError.unknownRuleKind("FOO"));
    }

    @Test
    @DisplayName("Should drop repeated conditions when deduplication is enabled")
    void shouldDeduplicate() {
        ParserConfig config = ParserConfig.builder().dedupeEnabled(true).build();

        BatchParseResult result = batchParser(config).parseLines(SUBSCRIPTION);

        assertThat(result.rules()).extracting(RuleSerializer::render).containsExactly(
                "DOMAIN-SUFFIX,ads.example.com,REJECT",
                "AND,((DOMAIN,a.com),(NETWORK,UDP)),Proxy",
                "MATCH,DIRECT");
        assertThat(result.rules()).extracting(Rule::priority).containsExactly(0, 1, 2);
        assertThat(result.stats().duplicates()).isEqualTo(1);
        assertThat(result.stats().accepted()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should report comment lines as failures when comments are disabled")
    void shouldParseCommentsWhenDisabled() {
        ParserConfig config = ParserConfig.builder().commentsEnabled(false).build();

        BatchParseResult result = batchParser(config).parseLines(List.of("# DOMAIN,a.com,DIRECT"));

        assertThat(result.stats().failed()).isEqualTo(1);
        assertThat(result.failures().get(0).error()).isEqualTo(ParseError.unknownRuleKind("# DOMAIN"));
    }

    @Test
    @DisplayName("Should abort on the first error when fail-fast is enabled")
    void shouldFailFast() {
        ParserConfig config = ParserConfig.builder().failFast(true).build();

        assertThatThrownBy(() -> batchParser(config).parseLines(SUBSCRIPTION))
                .isInstanceOf(RuleParseException.class)
                .satisfies(e -> {
                    RuleParseException parseError = (RuleParseException) e;
                    assertThat(parseError.getError()).isEqualTo(ParseError.unknownRuleKind("FOO"));
                    assertThat(parseError.getInput()).isEqualTo("FOO,bar,DIRECT");
                });
    }

    @Test
    @DisplayName("Should parse mixed strings, structured rules and maps")
    void shouldParseMixedEntries() {
        List<Object> entries = List.of(
                "DOMAIN,a.com,DIRECT",
                StructuredRule.simple("GEOIP", "CN", "DIRECT", List.of()),
                Map.of("type", "OR", "action", "Proxy", "conditions", List.of("DOMAIN,b.com", "DOMAIN,c.com")),
                42);

        BatchParseResult result = batchParser(ParserConfig.defaults()).parseEntries(entries);

        assertThat(result.rules()).extracting(RuleSerializer::render).containsExactly(
                "DOMAIN,a.com,DIRECT",
                "GEOIP,CN,DIRECT",
                "OR,((DOMAIN,b.com),(DOMAIN,c.com)),Proxy");
        assertThat(result.failures()).singleElement()
                .extracting(r -> r.error().kind())
                .isEqualTo(ParseError.ErrorKind.INVALID_INPUT);
    }

    @Test
    @DisplayName("Should collect diagnostics of all successful rules")
    void shouldCollectDiagnostics() {
        BatchParseResult result = batchParser(ParserConfig.defaults()).parseLines(List.of(
                "AND,((DOMAIN,a.com),(BAD,x)),DIRECT",
                "OR,((DOMAIN,b.com),(GEOIP)),DIRECT"));

        assertThat(result.diagnostics()).extracting(Diagnostic::kind).containsExactly(
                Diagnostic.Kind.UNKNOWN_CONDITION_KIND,
                Diagnostic.Kind.INVALID_CONDITION_FORMAT);
    }

    @Test
    @DisplayName("Should handle an empty batch")
    void shouldHandleEmptyBatch() {
        BatchParseResult result = batchParser(ParserConfig.defaults()).parseLines(List.of());

        assertThat(result.rules()).isEmpty();
        assertThat(result.stats()).isEqualTo(new BatchParseResult.BatchStats(0, 0, 0, 0, 0));
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Tracing")
    class Tracing {

        @Mock
        private Tracer mockTracer;
        @Mock
        private SpanBuilder spanBuilder;
        @Mock
        private Span span;

        @BeforeEach
        void setUpSpan() {
            when(mockTracer.spanBuilder("parse-rules")).thenReturn(spanBuilder);
            when(spanBuilder.startSpan()).thenReturn(span);
        }

        @Test
        @DisplayName("Should record batch counts on the span")
        void shouldRecordCounts() {
            new RuleBatchParser(ParserConfig.defaults(), mockTracer).parseLines(SUBSCRIPTION);

            verify(span).setAttribute("inputCount", 7L);
            verify(span).setAttribute("acceptedCount", 4L);
            verify(span).setAttribute("failedCount", 1L);
            verify(span).end();
        }

        @Test
        @DisplayName("Should record unexpected runtime failures on the span")
        void shouldRecordUnexpectedFailure() {
            IRuleParser broken = mock(IRuleParser.class);
            IllegalStateException failure = new IllegalStateException("parser unavailable");
            when(broken.tryParseEntry("DOMAIN,a.com,DIRECT")).thenThrow(failure);
            RuleBatchParser batch = new RuleBatchParser(broken, ParserConfig.defaults(), mockTracer);

            assertThatThrownBy(() -> batch.parseLines(List.of("DOMAIN,a.com,DIRECT")))
                    .isSameAs(failure);

            verify(span).recordException(failure);
            verify(span).end();
        }

        @Test
        @DisplayName("Should record the fail-fast error on the span")
        void shouldRecordException() {
            RuleBatchParser failFast = new RuleBatchParser(ParserConfig.builder().failFast(true).build(), mockTracer);

            assertThatThrownBy(() -> failFast.parseLines(List.of("MATCH")))
                    .isInstanceOf(RuleParseException.class);

            verify(span).recordException(any(RuleParseException.class));
            verify(span).end();
        }
    }
}
