package org.calista.accuracy.similarity;

import org.calista.accuracy.text.PunctuationTokenizer;
import org.calista.accuracy.text.Tokenizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Similarity — text overlap metrics used for majority grouping and diversity checks.
 *
 * <ul>
 *   <li>{@link #jaccard(String, String)}: token-set overlap, {@code |A∩B| / |A∪B|}</li>
 *   <li>{@link #editDistanceSimilarity(String, String)}: {@code 1 - levenshtein / maxLength}
 *       over grapheme clusters</li>
 *   <li>{@link #combined(String, String, double, double)}: weighted blend of both</li>
 * </ul>
 *
 * All functions are pure and total: {@code null} is treated as the empty string,
 * two empty texts are identical (1.0), one empty text matches nothing (0.0).
 *
 * <p>Cost: Jaccard is O(n) per text, Levenshtein O(n·m) per pair. An all-pairs pass over N
 * candidates is O(N²·n·m); fine for tens of candidates, not for millions.
 */
public final class Similarity {

    private static final Pattern GRAPHEME = Pattern.compile("\\X");

    private Similarity() {}

    // ---------------------------------------------------------------------
    // Jaccard
    // ---------------------------------------------------------------------

    public static double jaccard(String text1, String text2) {
        return jaccard(text1, text2, PunctuationTokenizer.instance());
    }

    public static double jaccard(String text1, String text2, Tokenizer tokenizer) {
        Objects.requireNonNull(tokenizer, "tokenizer");

        Set<String> a = new HashSet<>(tokenizer.tokenize(text1));
        Set<String> b = new HashSet<>(tokenizer.tokenize(text2));

        if (a.isEmpty() && b.isEmpty()) return 1.0;
        if (a.isEmpty() || b.isEmpty()) return 0.0;

        int intersection = 0;
        Set<String> small = a.size() <= b.size() ? a : b;
        Set<String> large = (small == a) ? b : a;
        for (String t : small) if (large.contains(t)) intersection++;

        int union = a.size() + b.size() - intersection;
        return (double) intersection / (double) union;
    }

    // ---------------------------------------------------------------------
    // Levenshtein
    // ---------------------------------------------------------------------

    public static double editDistanceSimilarity(String text1, String text2) {
        List<String> g1 = graphemes(text1);
        List<String> g2 = graphemes(text2);

        int len1 = g1.size();
        int len2 = g2.size();

        if (len1 == 0 && len2 == 0) return 1.0;
        if (len1 == 0 || len2 == 0) return 0.0;

        int distance = levenshtein(g1, g2);
        return 1.0 - ((double) distance / (double) Math.max(len1, len2));
    }

    /** Raw edit distance (insert/delete/substitute cost 1) over grapheme clusters. */
    public static int levenshtein(String text1, String text2) {
        return levenshtein(graphemes(text1), graphemes(text2));
    }

    static int levenshtein(List<String> s1, List<String> s2) {
        int n = s1.size();
        int m = s2.size();

        int[][] d = new int[n + 1][m + 1];
        for (int i = 0; i <= n; i++) d[i][0] = i;
        for (int j = 0; j <= m; j++) d[0][j] = j;

        for (int i = 1; i <= n; i++) {
            String c1 = s1.get(i - 1);
            for (int j = 1; j <= m; j++) {
                int cost = c1.equals(s2.get(j - 1)) ? 0 : 1;
                int del = d[i - 1][j] + 1;
                int ins = d[i][j - 1] + 1;
                int sub = d[i - 1][j - 1] + cost;
                d[i][j] = Math.min(del, Math.min(ins, sub));
            }
        }
        return d[n][m];
    }

    /** User-perceived characters; "é" written as e + combining accent is one element. */
    static List<String> graphemes(String text) {
        if (text == null || text.isEmpty()) return List.of();
        ArrayList<String> out = new ArrayList<>(text.length());
        Matcher m = GRAPHEME.matcher(text);
        while (m.find()) out.add(m.group());
        return out;
    }

    // ---------------------------------------------------------------------
    // Combined
    // ---------------------------------------------------------------------

    /**
     * Weighted average {@code (jaccard·wj + edit·we) / (wj + we)}.
     * A non-positive weight sum yields 0.0.
     */
    public static double combined(String text1, String text2, double jaccardWeight, double editWeight) {
        double total = jaccardWeight + editWeight;
        if (!(total > 0.0)) return 0.0;

        double j = jaccard(text1, text2);
        double e = editDistanceSimilarity(text1, text2);
        return (j * jaccardWeight + e * editWeight) / total;
    }

    public static double combined(String text1, String text2, Weights weights) {
        Objects.requireNonNull(weights, "weights");
        return combined(text1, text2, weights.jaccard, weights.edit);
    }

    /**
     * Highest combined similarity between {@code text} and any of {@code others}; 0.0 when there are none.
     * Cost is O(|others|·n·m).
     */
    public static double maxSimilarity(String text, Collection<String> others, Weights weights) {
        Objects.requireNonNull(weights, "weights");
        if (others == null || others.isEmpty()) return 0.0;

        double best = 0.0;
        for (String o : others) {
            double s = combined(text, o, weights);
            if (s > best) best = s;
            if (best >= 1.0) break;
        }
        return best;
    }

    // ---------------------------------------------------------------------
    // Weights
    // ---------------------------------------------------------------------

    /** Blend weights for {@link #combined(String, String, Weights)}. */
    public static final class Weights {
        public static final Weights EQUAL = new Weights(0.5, 0.5);

        public final double jaccard;
        public final double edit;

        public Weights(double jaccard, double edit) {
            this.jaccard = jaccard;
            this.edit = edit;
        }

        public static Weights of(double jaccard, double edit) {
            return new Weights(jaccard, edit);
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) return true;
            if (!(other instanceof Weights w)) return false;
            return Double.compare(jaccard, w.jaccard) == 0 && Double.compare(edit, w.edit) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(jaccard, edit);
        }

        @Override
        public String toString() {
            return "Weights{jaccard=" + jaccard + ", edit=" + edit + '}';
        }
    }
}
