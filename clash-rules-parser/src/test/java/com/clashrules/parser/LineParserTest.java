package com.clashrules.parser;

import com.clashrules.api.exceptions.RuleParseException;
import com.clashrules.api.model.Action;
import com.clashrules.api.model.BuiltInAction;
import com.clashrules.api.model.Diagnostic;
import com.clashrules.api.model.LogicRule;
import com.clashrules.api.model.MatchRule;
import com.clashrules.api.model.ParseError;
import com.clashrules.api.model.ParseResult;
import com.clashrules.api.model.Rule;
import com.clashrules.api.model.RuleKind;
import com.clashrules.api.model.SimpleRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LineParserTest {

    private LineParser parser;

    @BeforeEach
    void setUp() {
        parser = new LineParser();
    }

    private Rule parse(String line) {
        return parser.parse(line, new ArrayList<>());
    }

    private ParseError.ErrorKind errorOf(String line) {
        ParseResult result = parser.tryParse(line);
        assertThat(result.isSuccess()).as("expected failure for '%s'", line).isFalse();
        return result.error().kind();
    }

    @Nested
    @DisplayName("Simple rules")
    class SimpleRules {

        @Test
        @DisplayName("Should parse kind, payload and named action")
        void shouldParseSimpleRule() {
            Rule rule = parse("DOMAIN-SUFFIX,google.com,Proxy");

            assertThat(rule).isEqualTo(new SimpleRule(RuleKind.DOMAIN_SUFFIX, "google.com", new Action.Named("Proxy")));
            assertThat(rule.rawText()).isEqualTo("DOMAIN-SUFFIX,google.com,Proxy");
            assertThat(rule.priority()).isZero();
        }

        @Test
        @DisplayName("Should keep trailing qualifiers in order")
        void shouldKeepQualifiers() {
            SimpleRule rule = (SimpleRule) parse("IP-CIDR,192.168.0.0/16,DIRECT,no-resolve");

            assertThat(rule.kind()).isEqualTo(RuleKind.IP_CIDR);
            assertThat(rule.action()).isEqualTo(Action.of(BuiltInAction.DIRECT));
            assertThat(rule.extraParams()).containsExactly("no-resolve");
        }

        @Test
        @DisplayName("Should trim fields and skip empty segments")
        void shouldTrimFields() {
            SimpleRule rule = (SimpleRule) parse("  domain-keyword , ads ,, reject  ");

            assertThat(rule.kind()).isEqualTo(RuleKind.DOMAIN_KEYWORD);
            assertThat(rule.payload()).isEqualTo("ads");
            assertThat(rule.action()).isEqualTo(Action.of(BuiltInAction.REJECT));
            assertThat(rule.rawText()).isEqualTo("domain-keyword , ads ,, reject");
        }

        @Test
        @DisplayName("Should fail with UnknownRuleKind for unknown kinds")
        void shouldRejectUnknownKind() {
            assertThatThrownBy(() -> parse("FOO,bar,DIRECT"))
                    .isInstanceOf(RuleParseException.class)
                    .satisfies(e -> assertThat(((RuleParseException) e).getError())
                            .isEqualTo(ParseError.unknownRuleKind("FOO")));
        }

        @Test
        @DisplayName("Should require at least kind, payload and action")
        void shouldRequireThreeFields() {
            assertThat(errorOf("DOMAIN,example.com")).isEqualTo(ParseError.ErrorKind.INVALID_RULE_FORMAT);
            assertThat(errorOf("DOMAIN,,")).isEqualTo(ParseError.ErrorKind.INVALID_RULE_FORMAT);
        }

        @Test
        @DisplayName("Should not let combinators through the simple path")
        void shouldRejectLowercaseLogicKeyword() {
            // the logic keyword is case-sensitive, so this reaches the simple path
            assertThat(errorOf("and,((DOMAIN,a.com)),DIRECT")).isEqualTo(ParseError.ErrorKind.INVALID_LOGIC_FORMAT);
            assertThat(errorOf("MATCH ,x,DIRECT")).isEqualTo(ParseError.ErrorKind.INVALID_MATCH_FORMAT);
        }

        @ParameterizedTest
        @ValueSource(strings = {"match , Final", "MATCH ,DIRECT", "MATCH"})
        @DisplayName("Should report a malformed MATCH prefix as InvalidMatchFormat whatever the field count")
        void shouldRejectMalformedMatchPrefix(String line) {
            assertThat(errorOf(line)).isEqualTo(ParseError.ErrorKind.INVALID_MATCH_FORMAT);
        }

        @ParameterizedTest
        @ValueSource(strings = {"and,((DOMAIN,a.com))", "or ,x", "NOT"})
        @DisplayName("Should report a malformed combinator prefix as InvalidLogicFormat whatever the field count")
        void shouldRejectMalformedLogicPrefix(String line) {
            assertThat(errorOf(line)).isEqualTo(ParseError.ErrorKind.INVALID_LOGIC_FORMAT);
        }
    }

    @Nested
    @DisplayName("Match rules")
    class MatchRules {

        @Test
        @DisplayName("Should parse MATCH with built-in action")
        void shouldParseMatch() {
            assertThat(parse("MATCH,DIRECT")).isEqualTo(new MatchRule(Action.of(BuiltInAction.DIRECT)));
        }

        @Test
        @DisplayName("Should accept any case for MATCH and named groups")
        void shouldAcceptLowercaseMatch() {
            Rule rule = parse("match, Final Group");

            assertThat(rule).isInstanceOf(MatchRule.class);
            assertThat(rule.action()).isEqualTo(new Action.Named("Final Group"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"MATCH,DIRECT,EXTRA", "MATCH,", "MATCH, ,"})
        @DisplayName("Should fail with InvalidMatchFormat unless there are exactly two fields")
        void shouldRejectMalformedMatch(String line) {
            assertThat(errorOf(line)).isEqualTo(ParseError.ErrorKind.INVALID_MATCH_FORMAT);
        }
    }

    @Nested
    @DisplayName("Logic rules")
    class LogicRules {

        @Test
        @DisplayName("Should parse AND with two conditions")
        void shouldParseAnd() {
            LogicRule rule = (LogicRule) parse("AND,((DOMAIN,ad.com),(NETWORK,UDP)),REJECT");

            assertThat(rule.kind()).isEqualTo(RuleKind.AND);
            assertThat(rule.action()).isEqualTo(Action.of(BuiltInAction.REJECT));
            assertThat(rule.conditions()).containsExactly(
                    SimpleRule.condition(RuleKind.DOMAIN, "ad.com", ""),
                    SimpleRule.condition(RuleKind.NETWORK, "UDP", ""));
        }

        @Test
        @DisplayName("Should tolerate whitespace around body and action")
        void shouldTolerateWhitespace() {
            LogicRule rule = (LogicRule) parse("OR, ( (GEOIP,CN) , (DST-PORT,443) ) ,  Proxy ");

            assertThat(rule.kind()).isEqualTo(RuleKind.OR);
            assertThat(rule.conditions()).hasSize(2);
            assertThat(rule.action()).isEqualTo(new Action.Named("Proxy"));
        }

        @Test
        @DisplayName("Should accept NOT with more than one condition")
        void shouldAcceptNotWithSeveralConditions() {
            LogicRule rule = (LogicRule) parse("NOT,((DOMAIN,a.com),(DOMAIN,b.com)),DIRECT");

            assertThat(rule.kind()).isEqualTo(RuleKind.NOT);
            assertThat(rule.conditions()).hasSize(2);
        }

        @Test
        @DisplayName("Should drop a malformed inner group instead of failing")
        void shouldDropMalformedCondition() {
            List<Diagnostic> diagnostics = new ArrayList<>();

            LogicRule rule = (LogicRule) parser.parse("AND,((DOMAIN,a.com),(BAD_KIND,x)),DIRECT", diagnostics);

            assertThat(rule.conditions()).containsExactly(SimpleRule.condition(RuleKind.DOMAIN, "a.com", ""));
            assertThat(diagnostics).singleElement()
                    .satisfies(d -> {
                        assertThat(d.kind()).isEqualTo(Diagnostic.Kind.UNKNOWN_CONDITION_KIND);
                        assertThat(d.text()).isEqualTo("BAD_KIND,x");
                    });
        }

        @Test
        @DisplayName("Should report diagnostics on a successful result")
        void shouldExposeDiagnosticsOnResult() {
            ParseResult result = parser.tryParse("OR,((DOMAIN,a.com),(just-text)),DIRECT");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.diagnostics()).extracting(Diagnostic::kind)
                    .containsExactly(Diagnostic.Kind.INVALID_CONDITION_FORMAT);
        }

        @Test
        @DisplayName("Should not build nested logic rules from nested groups")
        void shouldNotNestLogic() {
            LogicRule rule = (LogicRule) parse("OR,((DOMAIN,a.com),(AND,((NETWORK,UDP),(DST-PORT,53)))),DIRECT");

            assertThat(rule.conditions()).containsExactly(SimpleRule.condition(RuleKind.DOMAIN, "a.com", ""));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "AND,((DOMAIN,a.com),(NETWORK,UDP),REJECT",
                "AND,((DOMAIN,a.com))",
                "AND,((DOMAIN,a.com)),",
                "AND,((DOMAIN,a.com)),REJECT,extra",
                "AND,DOMAIN,a.com,REJECT",
                "AND,((DOMAIN,a.com)) REJECT"
        })
        @DisplayName("Should fail with InvalidLogicFormat for structurally broken lines")
        void shouldRejectBrokenLogic(String line) {
            assertThat(errorOf(line)).isEqualTo(ParseError.ErrorKind.INVALID_LOGIC_FORMAT);
        }

        @Test
        @DisplayName("Should fail with EmptyConditions when no condition survives")
        void shouldRejectLogicWithoutConditions() {
            assertThat(errorOf("AND,((FOO,x),(BAR,y)),DIRECT")).isEqualTo(ParseError.ErrorKind.EMPTY_CONDITIONS);
            assertThat(errorOf("OR,(),DIRECT")).isEqualTo(ParseError.ErrorKind.EMPTY_CONDITIONS);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\t\n"})
    @DisplayName("Should report Empty for blank input")
    void shouldReportEmptyForBlankInput(String line) {
        ParseResult result = parser.tryParse(line);

        assertThat(result.isSkipped()).isTrue();
        assertThat(result.error()).isEqualTo(ParseError.empty());
    }

    @Test
    @DisplayName("Should report Empty for null input")
    void shouldReportEmptyForNull() {
        assertThat(parser.tryParse(null).isSkipped()).isTrue();
    }
}
