package org.calista.accuracy.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutcomeTest {

    @Test
    @DisplayName("ok carries a value and no error")
    void okOutcome() {
        Outcome<String> o = Outcome.ok("x");

        assertThat(o.isOk()).isTrue();
        assertThat(o.isFailure()).isFalse();
        assertThat(o.value()).isEqualTo("x");
        assertThat(o.error()).isNull();
    }

    @Test
    @DisplayName("ok may carry null")
    void okNull() {
        assertThat(Outcome.ok(null).isOk()).isTrue();
        assertThat(Outcome.ok(null).value()).isNull();
    }

    @Test
    @DisplayName("value() on a failure throws")
    void failureValue() {
        Outcome<String> o = Outcome.failure(ErrorCode.INVALID_SCORE);

        assertThat(o.error()).isEqualTo(ErrorCode.INVALID_SCORE);
        assertThatThrownBy(o::value)
                .isInstanceOf(NoSuchElementException.class)
                .hasMessageContaining("invalid_score");
    }

    @Test
    @DisplayName("orElseThrow raises AccuracyException with subject and code label")
    void orElseThrow() {
        Outcome<String> o = Outcome.failure(ErrorCode.INVALID_THRESHOLDS);

        assertThatThrownBy(() -> o.orElseThrow("CalibrationGate"))
                .isInstanceOf(AccuracyException.class)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid CalibrationGate: invalid_thresholds");
    }

    @Test
    @DisplayName("map and flatMap short-circuit failures")
    void chaining() {
        Outcome<Integer> ok = Outcome.ok(2);
        Outcome<Integer> bad = Outcome.failure(ErrorCode.INVALID_MAP);

        assertThat(ok.map(i -> i * 3).value()).isEqualTo(6);
        assertThat(ok.flatMap(i -> Outcome.<Integer>failure(ErrorCode.TIMEOUT)).error()).isEqualTo(ErrorCode.TIMEOUT);
        assertThat(bad.map(i -> i * 3).error()).isEqualTo(ErrorCode.INVALID_MAP);
        assertThat(bad.flatMap(i -> Outcome.ok(1)).error()).isEqualTo(ErrorCode.INVALID_MAP);
    }

    @Test
    @DisplayName("error codes render as snake_case labels")
    void labels() {
        assertThat(ErrorCode.QUERY_TOO_LONG.label()).isEqualTo("query_too_long");
        assertThat(ErrorCode.INVALID_CONFIDENCE_LEVEL.toString()).isEqualTo("invalid_confidence_level");
        assertThat(new AccuracyException("X", ErrorCode.TIMEOUT).code()).isEqualTo(ErrorCode.TIMEOUT);
    }
}
