package org.calista.accuracy.candidate;

import java.util.Locale;

/** How a {@link GenerationResult} was assembled. Informational tag only. */
public enum AggregationMethod {
    NONE,
    BEST_OF_N,
    MAJORITY_VOTE,
    WEIGHTED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Whitelist conversion; anything unrecognized (including null) is {@link #NONE}. */
    public static AggregationMethod fromLabel(String label) {
        if (label == null) return NONE;
        switch (label) {
            case "best_of_n":
                return BEST_OF_N;
            case "majority_vote":
                return MAJORITY_VOTE;
            case "weighted":
                return WEIGHTED;
            default:
                return NONE;
        }
    }
}
