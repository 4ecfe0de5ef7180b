package org.calista.accuracy.difficulty;

import org.calista.accuracy.error.ErrorCode;
import org.calista.accuracy.error.Outcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A difficulty estimator classifies how hard a query is so callers can size their compute budget.
 *
 * Contracts:
 *  - estimate must not throw for bad input; it returns a failed {@link Outcome}
 *  - context is an open map (domain hints, precomputed features...), may be empty, never required
 *  - implementations should reuse {@link DifficultyEstimate#toLevel(Double)} for the score band
 */
public interface DifficultyEstimator {

    Outcome<DifficultyEstimate> estimate(String query, Map<String, Object> context);

    /**
     * Batch hook. Default calls {@link #estimate(String, Map)} sequentially and keeps input order;
     * any single failure fails the whole batch with {@code batch_estimation_failed}.
     */
    default Outcome<List<DifficultyEstimate>> estimateBatch(List<String> queries, Map<String, Object> context) {
        if (queries == null || queries.isEmpty()) return Outcome.ok(List.of());

        ArrayList<DifficultyEstimate> out = new ArrayList<>(queries.size());
        for (String q : queries) {
            Outcome<DifficultyEstimate> r = estimate(q, context);
            if (r.isFailure()) return Outcome.failure(ErrorCode.BATCH_ESTIMATION_FAILED);
            out.add(r.value());
        }
        return Outcome.ok(List.copyOf(out));
    }
}
