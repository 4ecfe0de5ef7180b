package org.calista.accuracy.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccuracyJsonTest {

    private final AccuracyJson json = AccuracyJson.withDefaults();

    @Test
    @DisplayName("reads integral numbers as Integer and fractions as Double")
    void numberTypes() throws IOException {
        Map<String, Object> m = json.read("{\"tokens\":12,\"score\":0.5,\"list\":[1,2]}");

        assertThat(m.get("tokens")).isInstanceOf(Integer.class);
        assertThat(m.get("score")).isEqualTo(0.5);
        assertThat(m.get("list")).isEqualTo(List.of(1, 2));
    }

    @Test
    @DisplayName("write then read preserves the map")
    void writeRead() throws IOException {
        Map<String, Object> src = Map.of("action", "direct", "original_score", 0.9);

        assertThat(json.read(json.write(src))).isEqualTo(src);
    }

    @Test
    @DisplayName("small longs come back as Integer, large ones stay Long")
    void integralNarrowing() throws IOException {
        Map<String, Object> back = json.read(json.write(Map.of("small", 3L, "large", 5_000_000_000L)));

        assertThat(back.get("small")).isEqualTo(3);
        assertThat(back.get("large")).isEqualTo(5_000_000_000L);
    }

    @Test
    @DisplayName("non-object or broken text is an IOException")
    void invalid() {
        assertThatThrownBy(() -> json.read("[1,2]")).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> json.read("{oops")).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> json.read("null")).isInstanceOf(IOException.class);
    }
}
