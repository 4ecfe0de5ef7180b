package org.calista.accuracy.candidate;

import org.calista.accuracy.core.Maps;
import org.calista.accuracy.error.ErrorCode;
import org.calista.accuracy.error.Outcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * GenerationResult — ordered set of candidates for one query plus derived aggregates.
 *
 * <p>Immutable. {@link #addCandidate(Candidate)} returns a new result; the candidate list and
 * the cached aggregates ({@code totalTokens}, {@code bestCandidate}) are always rebuilt together.
 *
 * <p>Selection:
 * <pre>
 * best  : max score among scored candidates, first occurrence wins ties
 * first : first inserted
 * last  : last inserted
 * vote  : largest group of identical contents, earliest group wins ties, group's first member
 * other : falls back to best
 * </pre>
 *
 * Vote groups by exact content. Answers that differ by a word are separate groups; callers that need
 * near-duplicate grouping can cluster with {@link org.calista.accuracy.similarity.Similarity} first.
 */
public final class GenerationResult {

    private static final String SUBJECT = "GenerationResult";

    private final List<Candidate> candidates;
    private final long totalTokens;
    private final Candidate bestCandidate;
    private final AggregationMethod aggregationMethod;
    private final Map<String, Object> metadata;

    private GenerationResult(List<Candidate> candidates, AggregationMethod method, Map<String, Object> metadata) {
        this.candidates = candidates;
        this.totalTokens = sumTokens(candidates);
        this.bestCandidate = findBest(candidates);
        this.aggregationMethod = (method == null) ? AggregationMethod.NONE : method;
        this.metadata = Maps.copyOf(metadata);
    }

    /**
     * Validating factory.
     *
     * @return {@code invalid_candidates} when the list contains a null element
     */
    public static Outcome<GenerationResult> create(List<Candidate> candidates,
                                                   AggregationMethod method,
                                                   Map<String, Object> metadata) {
        if (candidates == null || candidates.isEmpty()) {
            return Outcome.ok(new GenerationResult(List.of(), method, metadata));
        }
        ArrayList<Candidate> copy = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            if (c == null) return Outcome.failure(ErrorCode.INVALID_CANDIDATES);
            copy.add(c);
        }
        return Outcome.ok(new GenerationResult(Collections.unmodifiableList(copy), method, metadata));
    }

    public static Outcome<GenerationResult> create(List<Candidate> candidates) {
        return create(candidates, AggregationMethod.NONE, Map.of());
    }

    public static GenerationResult of(List<Candidate> candidates, AggregationMethod method, Map<String, Object> metadata) {
        return create(candidates, method, metadata).orElseThrow(SUBJECT);
    }

    public static GenerationResult of(List<Candidate> candidates) {
        return of(candidates, AggregationMethod.NONE, Map.of());
    }

    public static GenerationResult empty() {
        return new GenerationResult(List.of(), AggregationMethod.NONE, Map.of());
    }

    /** Appends to the tail and returns a new result with recomputed aggregates. */
    public GenerationResult addCandidate(Candidate candidate) {
        Objects.requireNonNull(candidate, "candidate");
        ArrayList<Candidate> next = new ArrayList<>(candidates.size() + 1);
        next.addAll(candidates);
        next.add(candidate);
        return new GenerationResult(Collections.unmodifiableList(next), aggregationMethod, metadata);
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    /** Insertion order, unmodifiable. */
    public List<Candidate> candidates() {
        return candidates;
    }

    public int size() {
        return candidates.size();
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    /** @return best scored candidate, or null when no candidate carries a score */
    public Candidate bestCandidate() {
        return bestCandidate;
    }

    public long totalTokens() {
        return totalTokens;
    }

    public AggregationMethod aggregationMethod() {
        return aggregationMethod;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public GenerationResult withAggregationMethod(AggregationMethod method) {
        return new GenerationResult(candidates, method, metadata);
    }

    public GenerationResult withMetadata(String key, Object value) {
        return new GenerationResult(candidates, aggregationMethod, Maps.with(metadata, key, value));
    }

    // ---------------------------------------------------------------------
    // Selection
    // ---------------------------------------------------------------------

    /** @return selected candidate, or null when the result is empty (or, for best, nothing is scored) */
    public Candidate selectByStrategy(SelectionStrategy strategy) {
        SelectionStrategy s = (strategy == null) ? SelectionStrategy.BEST : strategy;
        switch (s) {
            case FIRST:
                return candidates.isEmpty() ? null : candidates.get(0);
            case LAST:
                return candidates.isEmpty() ? null : candidates.get(candidates.size() - 1);
            case VOTE:
                return majority(candidates);
            case BEST:
            default:
                return bestCandidate;
        }
    }

    /** Label form ({@code "best"}, {@code "first"}, {@code "last"}, {@code "vote"}); unknown means best. */
    public Candidate selectByStrategy(String strategy) {
        return selectByStrategy(SelectionStrategy.fromLabel(strategy));
    }

    private static long sumTokens(List<Candidate> candidates) {
        long sum = 0L;
        for (Candidate c : candidates) sum += c.tokensOrZero();
        return sum;
    }

    private static Candidate findBest(List<Candidate> candidates) {
        Candidate best = null;
        for (Candidate c : candidates) {
            if (c.score == null) continue;
            // strict '>' keeps the first occurrence on ties
            if (best == null || c.score > best.score) best = c;
        }
        return best;
    }

    private static Candidate majority(List<Candidate> candidates) {
        if (candidates.isEmpty()) return null;

        // insertion-ordered groups: iteration order is order of first appearance
        LinkedHashMap<String, List<Candidate>> groups = new LinkedHashMap<>();
        for (Candidate c : candidates) {
            groups.computeIfAbsent(c.content, k -> new ArrayList<>()).add(c);
        }

        List<Candidate> winner = null;
        for (List<Candidate> g : groups.values()) {
            if (winner == null || g.size() > winner.size()) winner = g;
        }
        return winner.get(0);
    }

    // ---------------------------------------------------------------------
    // Serialization
    // ---------------------------------------------------------------------

    public Map<String, Object> toMap() {
        ArrayList<Map<String, Object>> list = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) list.add(c.toMap());

        LinkedHashMap<String, Object> m = new LinkedHashMap<>();
        m.put("candidates", list);
        m.put("total_tokens", totalTokens);
        m.put("best_candidate", bestCandidate == null ? null : bestCandidate.toMap());
        m.put("aggregation_method", aggregationMethod.label());
        m.put("metadata", metadata);
        return m;
    }

    /**
     * Inverse of {@link #toMap()}.
     *
     * <p>{@code total_tokens} and {@code best_candidate} in the map are ignored: aggregates are
     * recomputed from the deserialized candidates so a tampered map cannot desynchronize them.
     */
    public static Outcome<GenerationResult> fromMap(Map<String, ?> map) {
        if (map == null) return Outcome.failure(ErrorCode.INVALID_MAP);

        Object rawCandidates = map.get("candidates");
        if (rawCandidates != null && !(rawCandidates instanceof List)) return Outcome.failure(ErrorCode.INVALID_MAP);

        ArrayList<Candidate> list = new ArrayList<>();
        if (rawCandidates != null) {
            for (Object o : (List<?>) rawCandidates) {
                Map<String, Object> cm = Maps.asMap(o);
                if (cm == null) return Outcome.failure(ErrorCode.INVALID_MAP);
                Outcome<Candidate> c = Candidate.fromMap(cm);
                if (c.isFailure()) return Outcome.failure(ErrorCode.INVALID_MAP);
                list.add(c.value());
            }
        }

        // cached aggregate: validated when present, then recomputed from the candidates
        Object rawBest = map.get("best_candidate");
        if (rawBest != null) {
            Map<String, Object> bm = Maps.asMap(rawBest);
            if (bm == null || Candidate.fromMap(bm).isFailure()) return Outcome.failure(ErrorCode.INVALID_MAP);
        }

        Object rawMethod = map.get("aggregation_method");
        AggregationMethod method = (rawMethod instanceof AggregationMethod am)
                ? am
                : AggregationMethod.fromLabel(rawMethod == null ? null : String.valueOf(rawMethod));

        Object rawMetadata = map.get("metadata");
        if (rawMetadata != null && !(rawMetadata instanceof Map)) return Outcome.failure(ErrorCode.INVALID_MAP);

        return create(list, method, Maps.asMap(rawMetadata));
    }

    public static GenerationResult fromMapOrThrow(Map<String, ?> map) {
        return fromMap(map).orElseThrow(SUBJECT);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof GenerationResult g)) return false;
        return candidates.equals(g.candidates)
                && aggregationMethod == g.aggregationMethod
                && metadata.equals(g.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidates, aggregationMethod, metadata);
    }

    @Override
    public String toString() {
        return "GenerationResult{size=" + candidates.size()
                + ", totalTokens=" + totalTokens
                + ", best=" + (bestCandidate == null ? "null" : bestCandidate.id)
                + ", method=" + aggregationMethod.label()
                + '}';
    }
}
