package com.vortex.exception;

import com.vortex.logql.Matcher;
import com.vortex.logql.MatchersExpr;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("tier1")
@DisplayName("Exceptions")
public class ExceptionTest {

    @Nested
    @DisplayName("QueryExecutionException")
    class QueryExecutionTests {

        @Test
        @DisplayName("Carries the failed SQL and its cause")
        void testTechnicalMessage() {
            SQLException cause = new SQLException("connection reset");
            QueryExecutionException e = new QueryExecutionException("Failed to execute log query", cause, "SELECT 1");

            assertThat(e.getFailedSQL()).isEqualTo("SELECT 1");
            assertThat(e.getCause()).isSameAs(cause);
            assertThat(e.getTechnicalMessage())
                .contains("Failed SQL:\nSELECT 1")
                .contains("java.sql.SQLException")
                .contains("connection reset");
        }

        @Test
        @DisplayName("Recognizes missing tables")
        void testMissingTable() {
            assertThat(new QueryExecutionException("Code: 60. DB::Exception: UNKNOWN_TABLE", "q").getUserMessage())
                .startsWith("Log table not found");
            assertThat(new QueryExecutionException(
                "Catalog Error: Table with name logs does not exist!", "q").getUserMessage())
                .startsWith("Log table not found");
        }

        @Test
        @DisplayName("Recognizes missing columns")
        void testMissingColumn() {
            assertThat(new QueryExecutionException(
                "Binder Error: Referenced column \"Body\" not found", "q").getUserMessage())
                .contains("missing an expected column");
        }

        @Test
        @DisplayName("Recognizes bad regular expressions")
        void testBadRegex() {
            assertThat(new QueryExecutionException("CANNOT_COMPILE_REGEXP: missing )", "q").getUserMessage())
                .startsWith("Invalid regular expression");
        }

        @Test
        @DisplayName("Falls back to the raw message")
        void testFallback() {
            assertThat(new QueryExecutionException("boom", "q").getUserMessage())
                .isEqualTo("Log query execution failed: boom");
        }
    }

    @Nested
    @DisplayName("SQLGenerationException")
    class SQLGenerationTests {

        @Test
        @DisplayName("Describes the failed expression")
        void testTechnicalMessage() {
            MatchersExpr expr = MatchersExpr.of(Matcher.regex("app", "x"));
            SQLGenerationException e = new SQLGenerationException("Invalid match type", expr);

            assertThat(e.getFailedExpr()).isSameAs(expr);
            assertThat(e.getTechnicalMessage())
                .contains("Expression Type: MatchersExpr")
                .contains("Expression: {app=~\"x\"}");
        }

        @Test
        @DisplayName("Tolerates a missing expression")
        void testNoExpression() {
            assertThat(new SQLGenerationException("bad", null).getTechnicalMessage())
                .doesNotContain("Expression");
        }
    }

    @Test
    @DisplayName("NotImplementedException names the operation")
    void testNotImplemented() {
        NotImplementedException e = new NotImplementedException("Tail");

        assertThat(e).isInstanceOf(UnsupportedOperationException.class);
        assertThat(e.getOperation()).isEqualTo("Tail");
        assertThat(e.getMessage()).isEqualTo("Tail: not implemented");
    }
}
