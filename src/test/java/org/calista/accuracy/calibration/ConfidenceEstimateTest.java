package org.calista.accuracy.calibration;

import org.calista.accuracy.error.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfidenceEstimateTest {

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("score must be present and in [0,1]")
        void score() {
            assertThat(ConfidenceEstimate.create(null, "attention").error()).isEqualTo(ErrorCode.INVALID_SCORE);
            assertThat(ConfidenceEstimate.create(-0.1, "attention").error()).isEqualTo(ErrorCode.INVALID_SCORE);
            assertThat(ConfidenceEstimate.create(Double.NaN, "attention").error()).isEqualTo(ErrorCode.INVALID_SCORE);
            assertThat(ConfidenceEstimate.create(1.0, "attention").isOk()).isTrue();
        }

        @Test
        @DisplayName("method must be non-blank")
        void method() {
            assertThat(ConfidenceEstimate.create(0.5, null).error()).isEqualTo(ErrorCode.INVALID_METHOD);
            assertThat(ConfidenceEstimate.create(0.5, "  ").error()).isEqualTo(ErrorCode.INVALID_METHOD);
        }

        @Test
        @DisplayName("token-level confidences may not contain null")
        void tokenLevel() {
            assertThat(ConfidenceEstimate.builder().score(0.5).method("m")
                    .tokenLevelConfidence(Arrays.asList(0.2, null)).create().error())
                    .isEqualTo(ErrorCode.INVALID_CONFIDENCE);
            assertThat(ConfidenceEstimate.builder().score(0.5).method("m")
                    .tokenLevelConfidence(List.of(0.2, 0.9)).build().tokenLevelConfidence)
                    .containsExactly(0.2, 0.9);
        }
    }

    @Test
    @DisplayName("bands use the fixed 0.7 / 0.4 thresholds")
    void bands() {
        assertThat(ConfidenceEstimate.of(0.7, "m").isHigh()).isTrue();
        assertThat(ConfidenceEstimate.of(0.4, "m").isMedium()).isTrue();
        assertThat(ConfidenceEstimate.of(0.39, "m").isLow()).isTrue();
        assertThat(ConfidenceEstimate.of(0.69, "m").level()).isEqualTo(ConfidenceLevel.MEDIUM);
    }

    @Nested
    @DisplayName("Serialization")
    class Serialization {

        @Test
        @DisplayName("round-trips every field")
        void roundTrip() {
            ConfidenceEstimate e = ConfidenceEstimate.builder()
                    .score(0.62)
                    .method("ensemble")
                    .calibration(0.58)
                    .reasoning("two of three agree")
                    .tokenLevelConfidence(List.of(0.5, 0.7))
                    .metadata(Map.of("models", 3))
                    .build();

            assertThat(ConfidenceEstimate.fromMap(e.toMap()).value()).isEqualTo(e);
        }

        @Test
        @DisplayName("absent optionals are omitted from the map")
        void sparse() {
            assertThat(ConfidenceEstimate.of(0.5, "m").toMap()).containsOnlyKeys("score", "method");
        }

        @Test
        @DisplayName("malformed fields are rejected")
        void malformed() {
            assertThat(ConfidenceEstimate.fromMap(null).error()).isEqualTo(ErrorCode.INVALID_MAP);
            assertThat(ConfidenceEstimate.fromMap(Map.of("method", "m")).error()).isEqualTo(ErrorCode.INVALID_SCORE);
            assertThat(ConfidenceEstimate.fromMap(Map.of("score", 0.5)).error()).isEqualTo(ErrorCode.INVALID_METHOD);
            assertThat(ConfidenceEstimate.fromMap(Map.of("score", 0.5, "method", "m", "token_level_confidence", "x")).error())
                    .isEqualTo(ErrorCode.INVALID_MAP);
            assertThat(ConfidenceEstimate.fromMap(Map.of("score", 0.5, "method", "m", "calibration", "x")).error())
                    .isEqualTo(ErrorCode.INVALID_MAP);
        }
    }
}
