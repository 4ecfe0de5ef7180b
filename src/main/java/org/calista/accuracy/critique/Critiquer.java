package org.calista.accuracy.critique;

import org.calista.accuracy.candidate.Candidate;
import org.calista.accuracy.error.Outcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A critiquer reviews one candidate answer and reports issues with a severity.
 *
 * Contracts:
 *  - critique returns a failed {@link Outcome} instead of throwing for bad input
 *  - context is an open map (original prompt, rubric...), may be empty
 */
@FunctionalInterface
public interface Critiquer {

    Outcome<CritiqueResult> critique(Candidate candidate, Map<String, Object> context);

    /**
     * Batch hook. Default reviews candidates one by one in input order and stops at the first failure,
     * returning its error code. Implementations backed by a remote model may override to batch requests.
     */
    default Outcome<List<CritiqueResult>> critiqueBatch(List<Candidate> candidates, Map<String, Object> context) {
        if (candidates == null || candidates.isEmpty()) return Outcome.ok(List.of());

        ArrayList<CritiqueResult> out = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            Outcome<CritiqueResult> r = critique(c, context);
            if (r.isFailure()) return Outcome.failure(r.error());
            out.add(r.value());
        }
        return Outcome.ok(List.copyOf(out));
    }
}
