package com.vortex.logql;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("tier1")
@DisplayName("LogQL expression model")
public class ExprTest {

    @Nested
    @DisplayName("Matcher")
    class MatcherTests {

        @Test
        @DisplayName("regexString is the value only for regex matchers")
        void testRegexString() {
            assertThat(Matcher.equal("app", "api").regexString()).isEmpty();
            assertThat(Matcher.notEqual("app", "api").regexString()).isEmpty();
            assertThat(Matcher.regex("app", "api.*").regexString()).isEqualTo("api.*");
            assertThat(Matcher.notRegex("app", "api.*").regexString()).isEqualTo("api.*");
        }

        @Test
        @DisplayName("A matcher without value is empty")
        void testEmpty() {
            assertThat(Matcher.equal("app", "").isEmpty()).isTrue();
            assertThat(Matcher.regex("app", "").isEmpty()).isTrue();
            assertThat(Matcher.equal("app", "x").isEmpty()).isFalse();
        }

        @Test
        @DisplayName("Renders as LogQL")
        void testToString() {
            assertThat(Matcher.equal("app", "api").toString()).isEqualTo("app=\"api\"");
            assertThat(Matcher.notRegex("path", "/v1/\"x\"").toString()).isEqualTo("path!~\"/v1/\\\"x\\\"\"");
        }

        @Test
        @DisplayName("Rejects null fields")
        void testNulls() {
            assertThatThrownBy(() -> new Matcher(null, MatchType.EQUAL, "x"))
                .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> new Matcher("a", null, "x"))
                .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("MatchType")
    class MatchTypeTests {

        @Test
        @DisplayName("Regex and negation flags")
        void testFlags() {
            assertThat(MatchType.REGEX_NOT_MATCH.isRegex()).isTrue();
            assertThat(MatchType.REGEX_NOT_MATCH.isNegated()).isTrue();
            assertThat(MatchType.EQUAL.isRegex()).isFalse();
            assertThat(MatchType.EQUAL.isNegated()).isFalse();
        }
    }

    @Nested
    @DisplayName("Rendering and traversal")
    class TreeTests {

        private final PipelineExpr pipeline = PipelineExpr.of(
            MatchersExpr.of(Matcher.equal("service_name", "api"), Matcher.regex("env", "prod|stage")),
            LineFilterExpr.contains("error"),
            LabelParserExpr.json(),
            LineFilterExpr.notRegex("health.*"));

        @Test
        @DisplayName("Pipeline renders back to LogQL")
        void testPipelineToString() {
            assertThat(pipeline.toString()).isEqualTo(
                "{service_name=\"api\", env=~\"prod|stage\"} |= \"error\" | json !~ \"health.*\"");
        }

        @Test
        @DisplayName("walk visits every node depth-first")
        void testWalkOrder() {
            List<String> visited = new ArrayList<>();
            pipeline.walk(node -> visited.add(node.getClass().getSimpleName()));

            assertThat(visited).containsExactly(
                "PipelineExpr", "MatchersExpr", "LineFilterExpr", "LabelParserExpr", "LineFilterExpr");
        }

        @Test
        @DisplayName("Parser stages render with and without a parameter")
        void testLabelParser() {
            LabelParserExpr regexp = new LabelParserExpr("regexp", "(?P<status>\\d+)");

            assertThat(LabelParserExpr.logfmt().toString()).isEqualTo("| logfmt");
            assertThat(regexp.parser()).isEqualTo("regexp");
            assertThat(regexp.params()).isEqualTo("(?P<status>\\d+)");
            assertThat(regexp.toString()).isEqualTo("| regexp \"(?P<status>\\\\d+)\"");
        }

        @Test
        @DisplayName("Pipeline exposes the selector matchers")
        void testPipelineMatchers() {
            assertThat(pipeline.matchers()).containsExactly(
                Matcher.equal("service_name", "api"), Matcher.regex("env", "prod|stage"));
        }

        @Test
        @DisplayName("Equal trees are equal")
        void testEquality() {
            PipelineExpr other = PipelineExpr.of(
                MatchersExpr.of(Matcher.equal("service_name", "api"), Matcher.regex("env", "prod|stage")),
                LineFilterExpr.contains("error"),
                LabelParserExpr.json(),
                LineFilterExpr.notRegex("health.*"));

            assertThat(other).isEqualTo(pipeline);
            assertThat(other.hashCode()).isEqualTo(pipeline.hashCode());
        }
    }

    @Nested
    @DisplayName("LogQLStrings.quote")
    class QuoteTests {

        @Test
        @DisplayName("Escapes quotes, backslashes and control characters")
        void testQuote() {
            assertThat(LogQLStrings.quote("plain")).isEqualTo("\"plain\"");
            assertThat(LogQLStrings.quote("a\"b\\c")).isEqualTo("\"a\\\"b\\\\c\"");
            assertThat(LogQLStrings.quote("l1\nl2\tx\r")).isEqualTo("\"l1\\nl2\\tx\\r\"");
            assertThat(LogQLStrings.quote("\u0001")).isEqualTo("\"\\u0001\"");
        }

        @Test
        @DisplayName("Leaves non-ASCII text alone")
        void testUnicode() {
            assertThat(LogQLStrings.quote("héllo ✓")).isEqualTo("\"héllo ✓\"");
        }
    }
}
