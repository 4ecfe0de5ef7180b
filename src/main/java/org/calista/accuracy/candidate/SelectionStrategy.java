package org.calista.accuracy.candidate;

import java.util.Locale;

/**
 * Candidate selection over a {@link GenerationResult}.
 *
 * <ul>
 *   <li>BEST: highest score, first occurrence wins ties</li>
 *   <li>FIRST / LAST: insertion order</li>
 *   <li>VOTE: largest group of exactly equal contents</li>
 * </ul>
 */
public enum SelectionStrategy {
    BEST,
    FIRST,
    LAST,
    VOTE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unknown labels fall back to {@link #BEST}. */
    public static SelectionStrategy fromLabel(String label) {
        if (label == null) return BEST;
        switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "first":
                return FIRST;
            case "last":
                return LAST;
            case "vote":
                return VOTE;
            default:
                return BEST;
        }
    }
}
