package org.calista.accuracy.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimilarityTest {

    @Nested
    @DisplayName("Jaccard")
    class Jaccard {

        @Test
        @DisplayName("identical non-empty text is 1.0")
        void identical() {
            assertThat(Similarity.jaccard("The answer is 42", "The answer is 42")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("both empty is 1.0, one empty is 0.0")
        void emptyCases() {
            assertThat(Similarity.jaccard("", "")).isEqualTo(1.0);
            assertThat(Similarity.jaccard("a b", "")).isEqualTo(0.0);
            assertThat(Similarity.jaccard(null, "a")).isEqualTo(0.0);
        }

        @Test
        @DisplayName("case and punctuation do not matter")
        void normalization() {
            assertThat(Similarity.jaccard("Hello, World!", "hello world")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("partial overlap is |A∩B| / |A∪B|")
        void partialOverlap() {
            // {the, cat, sat} vs {the, dog, sat}: 2 shared of 4 distinct
            assertThat(Similarity.jaccard("the cat sat", "the dog sat")).isEqualTo(0.5);
        }

        @Test
        @DisplayName("token sets ignore repetition")
        void setSemantics() {
            assertThat(Similarity.jaccard("yes yes yes", "yes")).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Edit distance")
    class EditDistance {

        @Test
        @DisplayName("kitten/sitting is 1 - 3/7")
        void kittenSitting() {
            assertThat(Similarity.levenshtein("kitten", "sitting")).isEqualTo(3);
            assertThat(Similarity.editDistanceSimilarity("kitten", "sitting")).isCloseTo(1.0 - 3.0 / 7.0, within(1e-4));
        }

        @Test
        @DisplayName("identical text is 1.0; empty cases follow Jaccard conventions")
        void identicalAndEmpty() {
            assertThat(Similarity.editDistanceSimilarity("abc", "abc")).isEqualTo(1.0);
            assertThat(Similarity.editDistanceSimilarity("", "")).isEqualTo(1.0);
            assertThat(Similarity.editDistanceSimilarity("abc", "")).isEqualTo(0.0);
        }

        @Test
        @DisplayName("combining marks count as one grapheme")
        void graphemes() {
            String composed = "caf\u00e9";
            String decomposed = "cafe\u0301";
            assertThat(Similarity.graphemes(decomposed)).hasSize(4);
            // one substitution over four user-perceived characters
            assertThat(Similarity.levenshtein(composed, decomposed)).isEqualTo(1);
            assertThat(Similarity.editDistanceSimilarity("cafe", decomposed)).isCloseTo(0.75, within(1e-9));
        }

        @Test
        @DisplayName("distance is symmetric")
        void symmetric() {
            assertThat(Similarity.levenshtein("flaw", "lawn")).isEqualTo(Similarity.levenshtein("lawn", "flaw"));
            assertThat(Similarity.levenshtein("flaw", "lawn")).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Combined")
    class Combined {

        @Test
        @DisplayName("weighted average of both metrics")
        void weighted() {
            double j = Similarity.jaccard("the cat sat", "the dog sat");
            double e = Similarity.editDistanceSimilarity("the cat sat", "the dog sat");

            assertThat(Similarity.combined("the cat sat", "the dog sat", 1.0, 3.0))
                    .isCloseTo((j + 3 * e) / 4.0, within(1e-12));
            assertThat(Similarity.combined("the cat sat", "the dog sat", Similarity.Weights.EQUAL))
                    .isCloseTo((j + e) / 2.0, within(1e-12));
        }

        @Test
        @DisplayName("non-positive weight sum yields 0.0")
        void zeroWeights() {
            assertThat(Similarity.combined("a", "a", 0.0, 0.0)).isEqualTo(0.0);
            assertThat(Similarity.combined("a", "a", 1.0, -1.0)).isEqualTo(0.0);
        }

        @Test
        @DisplayName("maxSimilarity picks the closest text, 0.0 for no others")
        void maxSimilarity() {
            double best = Similarity.maxSimilarity("the answer is 42",
                    List.of("something else", "the answer is 42"), Similarity.Weights.EQUAL);

            assertThat(best).isEqualTo(1.0);
            assertThat(Similarity.maxSimilarity("x", List.of(), Similarity.Weights.EQUAL)).isEqualTo(0.0);
        }
    }
}
