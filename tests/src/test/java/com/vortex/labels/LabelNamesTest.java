package com.vortex.labels;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("tier1")
@DisplayName("Label name conversion")
public class LabelNamesTest {

    @Nested
    @DisplayName("denormalize")
    class DenormalizeTests {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "service_name, service.name",
            "k8s_pod_name, k8s.pod.name",
            "env, env",
            "__name__, ..name..",
        })
        @DisplayName("Every underscore becomes a dot")
        void testDenormalize(String name, String key) {
            assertThat(LabelNames.denormalize(name)).isEqualTo(key);
        }
    }

    @Nested
    @DisplayName("normalize")
    class NormalizeTests {

        @ParameterizedTest(name = "''{0}'' -> ''{1}''")
        @CsvSource({
            "service.name, service_name",
            "http.status-code, http_status_code",
            "env, env",
            "0abc, key_0abc",
            "9.x, key_9_x",
            "_private, key_private",
            ".hidden, key_hidden",
            "__reserved, __reserved",
            "a/b c, a_b_c",
            "café.名前, café_名前",
        })
        @DisplayName("Non-alphanumerics become underscores, with key prefixes for digits and single underscores")
        void testNormalize(String key, String name) {
            assertThat(LabelNames.normalize(key)).isEqualTo(name);
        }

        @Test
        @DisplayName("Empty key stays empty")
        void testEmpty() {
            assertThat(LabelNames.normalize("")).isEmpty();
        }

        @Test
        @DisplayName("Supplementary code points are replaced once, not per surrogate")
        void testSurrogatePair() {
            assertThat(LabelNames.normalize("a\uD83D\uDE00b")).isEqualTo("a_b");
        }

        @Test
        @DisplayName("Normalizing a denormalized simple name restores it")
        void testRoundTrip() {
            assertThat(LabelNames.normalize(LabelNames.denormalize("service_name"))).isEqualTo("service_name");
        }
    }
}
