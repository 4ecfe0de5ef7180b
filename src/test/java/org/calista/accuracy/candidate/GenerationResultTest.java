package org.calista.accuracy.candidate;

import org.calista.accuracy.core.AccuracyJson;
import org.calista.accuracy.error.AccuracyException;
import org.calista.accuracy.error.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationResultTest {

    private static Candidate cand(String id, String content, Double score, Integer tokens) {
        return Candidate.builder().id(id).content(content).score(score).tokensUsed(tokens).build();
    }

    @Nested
    @DisplayName("Aggregates")
    class Aggregates {

        @Test
        @DisplayName("best candidate and total tokens follow appends")
        void bestAndTotals() {
            Candidate c1 = cand("c1", "a", 0.7, 10);
            Candidate c2 = cand("c2", "b", 0.9, 20);
            GenerationResult r = GenerationResult.of(List.of(c1, c2));

            assertThat(r.bestCandidate()).isEqualTo(c2);
            assertThat(r.totalTokens()).isEqualTo(30);

            Candidate c3 = cand("c3", "c", 0.95, 5);
            GenerationResult next = r.addCandidate(c3);

            assertThat(next.bestCandidate()).isEqualTo(c3);
            assertThat(next.totalTokens()).isEqualTo(35);
            assertThat(next.candidates()).containsExactly(c1, c2, c3);

            // original is untouched
            assertThat(r.size()).isEqualTo(2);
            assertThat(r.bestCandidate()).isEqualTo(c2);
        }

        @Test
        @DisplayName("ties keep the first occurrence")
        void stableMax() {
            Candidate first = cand("first", "a", 0.8, null);
            Candidate second = cand("second", "b", 0.8, null);

            assertThat(GenerationResult.of(List.of(first, second)).bestCandidate()).isEqualTo(first);
            assertThat(GenerationResult.of(List.of(first)).addCandidate(second).bestCandidate()).isEqualTo(first);
        }

        @Test
        @DisplayName("unscored candidates are ignored; none scored means no best")
        void unscored() {
            Candidate unscored = cand("u", "a", null, 3);
            Candidate low = cand("l", "b", 0.1, null);

            assertThat(GenerationResult.of(List.of(unscored)).bestCandidate()).isNull();
            assertThat(GenerationResult.of(List.of(unscored, low)).bestCandidate()).isEqualTo(low);
            assertThat(GenerationResult.of(List.of(unscored, low)).totalTokens()).isEqualTo(3);
        }

        @Test
        @DisplayName("empty result")
        void empty() {
            GenerationResult r = GenerationResult.empty();

            assertThat(r.isEmpty()).isTrue();
            assertThat(r.totalTokens()).isZero();
            assertThat(r.bestCandidate()).isNull();
            assertThat(r.aggregationMethod()).isEqualTo(AggregationMethod.NONE);
            assertThat(GenerationResult.create(null).value()).isEqualTo(r);
        }

        @Test
        @DisplayName("null element is invalid_candidates")
        void nullElement() {
            List<Candidate> withNull = Arrays.asList(cand("a", "a", 0.1, 1), null);

            assertThat(GenerationResult.create(withNull).error()).isEqualTo(ErrorCode.INVALID_CANDIDATES);
            assertThatThrownBy(() -> GenerationResult.of(withNull))
                    .isInstanceOf(AccuracyException.class)
                    .hasMessage("Invalid GenerationResult: invalid_candidates");
        }

        @Test
        @DisplayName("candidates view is read-only and detached from the input list")
        void immutableView() {
            ArrayList<Candidate> input = new ArrayList<>(List.of(cand("a", "a", 0.5, 1)));
            GenerationResult r = GenerationResult.of(input);
            input.add(cand("b", "b", 0.9, 1));

            assertThat(r.size()).isEqualTo(1);
            assertThatThrownBy(() -> r.candidates().add(cand("c", "c", 0.1, 1)))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        private final Candidate a1 = cand("a1", "Paris", 0.6, 1);
        private final Candidate b1 = cand("b1", "Lyon", 0.9, 1);
        private final Candidate a2 = cand("a2", "Paris", 0.5, 1);
        private final Candidate c1 = cand("c1", "Nice", 0.7, 1);
        private final GenerationResult result = GenerationResult.of(List.of(a1, b1, a2, c1));

        @Test
        @DisplayName("best, first and last")
        void positional() {
            assertThat(result.selectByStrategy(SelectionStrategy.BEST)).isEqualTo(b1);
            assertThat(result.selectByStrategy(SelectionStrategy.FIRST)).isEqualTo(a1);
            assertThat(result.selectByStrategy(SelectionStrategy.LAST)).isEqualTo(c1);
        }

        @Test
        @DisplayName("vote returns the first member of the largest exact-content group")
        void vote() {
            assertThat(result.selectByStrategy(SelectionStrategy.VOTE)).isEqualTo(a1);
        }

        @Test
        @DisplayName("vote ties go to the group seen first")
        void voteTie() {
            Candidate x1 = cand("x1", "x", null, null);
            Candidate y1 = cand("y1", "y", null, null);
            Candidate y2 = cand("y2", "y", null, null);
            Candidate x2 = cand("x2", "x", null, null);

            assertThat(GenerationResult.of(List.of(y1, x1, x2, y2)).selectByStrategy("vote")).isEqualTo(y1);
        }

        @Test
        @DisplayName("vote does not merge near-duplicates")
        void voteExactOnly() {
            Candidate p1 = cand("p1", "The answer is 42", null, null);
            Candidate p2 = cand("p2", "The answer is 42.", null, null);
            Candidate q1 = cand("q1", "It is 41", null, null);

            assertThat(GenerationResult.of(List.of(q1, p1, p2)).selectByStrategy("vote")).isEqualTo(q1);
        }

        @Test
        @DisplayName("labels select strategies; unknown falls back to best")
        void labels() {
            assertThat(result.selectByStrategy("first")).isEqualTo(a1);
            assertThat(result.selectByStrategy("last")).isEqualTo(c1);
            assertThat(result.selectByStrategy("random")).isEqualTo(b1);
            assertThat(result.selectByStrategy((String) null)).isEqualTo(b1);
        }

        @Test
        @DisplayName("every strategy on an empty result is null")
        void emptySelection() {
            GenerationResult empty = GenerationResult.empty();
            for (SelectionStrategy s : SelectionStrategy.values()) {
                assertThat(empty.selectByStrategy(s)).isNull();
            }
        }
    }

    @Nested
    @DisplayName("Serialization")
    class Serialization {

        @Test
        @DisplayName("toMap exposes candidates, aggregates, method and metadata")
        void shape() {
            Candidate c = cand("c1", "a", 0.4, 9);
            Map<String, Object> m = GenerationResult.of(List.of(c), AggregationMethod.BEST_OF_N, Map.of("n", 1)).toMap();

            assertThat(m).containsOnlyKeys("candidates", "total_tokens", "best_candidate", "aggregation_method", "metadata");
            assertThat(m.get("total_tokens")).isEqualTo(9L);
            assertThat(m.get("aggregation_method")).isEqualTo("best_of_n");
            assertThat(m.get("best_candidate")).isEqualTo(c.toMap());
        }

        @Test
        @DisplayName("round-trips, including through JSON text")
        void roundTrip() throws Exception {
            GenerationResult r = GenerationResult.of(
                    List.of(cand("c1", "a", 0.4, 9), cand("c2", "b", 0.8, 3)),
                    AggregationMethod.MAJORITY_VOTE,
                    Map.of("query", "q"));

            assertThat(GenerationResult.fromMap(r.toMap()).value()).isEqualTo(r);

            AccuracyJson json = AccuracyJson.withDefaults();
            GenerationResult back = GenerationResult.fromMap(json.read(json.write(r.toMap()))).value();
            assertThat(back).isEqualTo(r);
            assertThat(back.bestCandidate().id).isEqualTo("c2");
        }

        @Test
        @DisplayName("tampered aggregates are recomputed from candidates")
        void tamperedAggregates() {
            GenerationResult r = GenerationResult.of(List.of(cand("c1", "a", 0.4, 9)));
            LinkedHashMap<String, Object> m = new LinkedHashMap<>(r.toMap());
            m.put("total_tokens", 1_000_000);
            m.put("best_candidate", cand("fake", "z", 1.0, 0).toMap());

            GenerationResult back = GenerationResult.fromMap(m).value();

            assertThat(back.totalTokens()).isEqualTo(9);
            assertThat(back.bestCandidate().id).isEqualTo("c1");
        }

        @Test
        @DisplayName("a best candidate that is not a valid candidate map is rejected")
        void malformedBestCandidate() {
            LinkedHashMap<String, Object> notAMap = new LinkedHashMap<>(GenerationResult.of(List.of(cand("c1", "a", 0.4, 9))).toMap());
            notAMap.put("best_candidate", "c1");
            LinkedHashMap<String, Object> badScore = new LinkedHashMap<>(notAMap);
            badScore.put("best_candidate", Map.of("id", "c1", "score", "high"));

            assertThat(GenerationResult.fromMap(notAMap).error()).isEqualTo(ErrorCode.INVALID_MAP);
            assertThat(GenerationResult.fromMap(badScore).error()).isEqualTo(ErrorCode.INVALID_MAP);
        }

        @Test
        @DisplayName("unknown or missing aggregation method becomes none")
        void unknownMethod() {
            assertThat(GenerationResult.fromMap(Map.of("aggregation_method", "ensemble")).value().aggregationMethod())
                    .isEqualTo(AggregationMethod.NONE);
            assertThat(GenerationResult.fromMap(Map.of()).value().aggregationMethod())
                    .isEqualTo(AggregationMethod.NONE);
        }

        @Test
        @DisplayName("malformed structure is invalid_map")
        void malformed() {
            assertThat(GenerationResult.fromMap(null).error()).isEqualTo(ErrorCode.INVALID_MAP);
            assertThat(GenerationResult.fromMap(Map.of("candidates", "x")).error()).isEqualTo(ErrorCode.INVALID_MAP);
            assertThat(GenerationResult.fromMap(Map.of("candidates", List.of("x"))).error()).isEqualTo(ErrorCode.INVALID_MAP);
            assertThat(GenerationResult.fromMap(Map.of("candidates", List.of(Map.of("score", "bad")))).error())
                    .isEqualTo(ErrorCode.INVALID_MAP);
        }
    }
}
