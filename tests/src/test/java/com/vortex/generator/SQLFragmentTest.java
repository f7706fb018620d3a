package com.vortex.generator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("tier1")
@DisplayName("SQL fragments")
public class SQLFragmentTest {

    @Test
    @DisplayName("Appending keeps arguments in placeholder order")
    void testAppend() {
        SQLFragment fragment = SQLFragment.of("f(?)", "a").append(" = ?", "b");

        assertThat(fragment.text()).isEqualTo("f(?) = ?");
        assertThat(fragment.args()).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Rejects a mismatch between placeholders and arguments")
    void testMismatch() {
        assertThatThrownBy(() -> SQLFragment.of("a = ? AND b = ?", "x"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("2 placeholders but 1 arguments");
    }

    @Test
    @DisplayName("Question marks inside quotes are not placeholders")
    void testQuotedQuestionMarks() {
        assertThat(SQLFragment.of("x = '?' AND \"col?\" = ? AND `c?` = 1", 5).args()).containsExactly(5);
    }

    @Test
    @DisplayName("not wraps the fragment in NOT (...)")
    void testNot() {
        SQLFragment fragment = SQLFragment.of("match(x, ?)", "p").not();

        assertThat(fragment.text()).isEqualTo("NOT (match(x, ?))");
        assertThat(fragment.args()).containsExactly("p");
    }

    @Test
    @DisplayName("join separates fragments and concatenates arguments")
    void testJoin() {
        SQLFragment joined = SQLFragment.join(" AND ", List.of(
            SQLFragment.of("a = ?", 1),
            SQLFragment.of("b"),
            SQLFragment.of("c = ?", 3)));

        assertThat(joined.text()).isEqualTo("a = ? AND b AND c = ?");
        assertThat(joined.args()).containsExactly(1, 3);
        assertThat(SQLFragment.join(", ", List.of()).text()).isEmpty();
    }

    @Test
    @DisplayName("Arguments are immutable")
    void testImmutableArgs() {
        SQLFragment fragment = SQLFragment.of("?", "a");

        assertThatThrownBy(() -> fragment.args().add("b"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
