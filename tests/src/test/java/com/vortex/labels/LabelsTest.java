package com.vortex.labels;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("tier1")
@DisplayName("Labels")
public class LabelsTest {

    @Test
    @DisplayName("Labels are sorted by name whatever the input order")
    void testSorted() {
        Map<String, String> map = new HashMap<>();
        map.put("zone", "eu");
        map.put("app", "api");
        map.put("env", "prod");

        Labels labels = Labels.fromMap(map);

        assertThat(labels).extracting(Label::name).containsExactly("app", "env", "zone");
        assertThat(labels.toString()).isEqualTo("{app=\"api\", env=\"prod\", zone=\"eu\"}");
    }

    @Test
    @DisplayName("Values are quoted in the canonical string")
    void testQuoting() {
        Labels labels = Labels.of("msg", "say \"hi\"\n");

        assertThat(labels.toString()).isEqualTo("{msg=\"say \\\"hi\\\"\\n\"}");
    }

    @Test
    @DisplayName("Empty set renders as {}")
    void testEmpty() {
        assertThat(Labels.empty().toString()).isEqualTo("{}");
        assertThat(Labels.fromMap(Map.of())).isSameAs(Labels.empty());
        assertThat(Labels.empty()).isEmpty();
    }

    @Test
    @DisplayName("Equal content means equal sets")
    void testEquality() {
        Labels a = Labels.of("b", "2", "a", "1");
        Labels b = Labels.fromMap(Map.of("a", "1", "b", "2"));

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(Labels.of("a", "1"));
    }

    @Test
    @DisplayName("of rejects an odd number of strings")
    void testOddPairs() {
        assertThatThrownBy(() -> Labels.of("a", "1", "b"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Iterates labels in name order")
    void testIterator() {
        Labels labels = Labels.of("b", "2", "a", "1");

        assertThat(labels).containsExactly(new Label("a", "1"), new Label("b", "2"));
    }

    @Test
    @DisplayName("Labels order by name, then value")
    void testLabelOrder() {
        assertThat(new Label("a", "2")).isLessThan(new Label("b", "1"));
        assertThat(new Label("a", "1")).isLessThan(new Label("a", "2"));
    }
}
