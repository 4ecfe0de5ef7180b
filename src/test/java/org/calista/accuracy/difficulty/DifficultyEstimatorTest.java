package org.calista.accuracy.difficulty;

import org.calista.accuracy.error.ErrorCode;
import org.calista.accuracy.error.Outcome;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DifficultyEstimatorTest {

    /** Scores by query length so results are easy to predict. */
    private final DifficultyEstimator byLength = (query, context) -> {
        if (query == null || query.isBlank()) return Outcome.failure(ErrorCode.INVALID_QUERY);
        double score = Math.min(1.0, query.length() / 10.0);
        return DifficultyEstimate.builder().score(score).create();
    };

    @Test
    void batchKeepsInputOrder() {
        List<DifficultyEstimate> out = byLength.estimateBatch(List.of("ab", "abcde", "abcdefghij"), Map.of()).value();

        assertThat(out).extracting(e -> e.level)
                .containsExactly(DifficultyLevel.EASY, DifficultyLevel.MEDIUM, DifficultyLevel.HARD);
    }

    @Test
    void anyFailureFailsTheBatch() {
        Outcome<List<DifficultyEstimate>> r = byLength.estimateBatch(List.of("ok", " ", "fine"), Map.of());

        assertThat(r.error()).isEqualTo(ErrorCode.BATCH_ESTIMATION_FAILED);
    }

    @Test
    void emptyBatchIsEmpty() {
        assertThat(byLength.estimateBatch(List.of(), Map.of()).value()).isEmpty();
        assertThat(byLength.estimateBatch(null, Map.of()).value()).isEmpty();
    }
}
