package org.calista.accuracy.difficulty;

import java.util.Locale;
import java.util.Optional;

/**
 * Three-band difficulty classification. Budget policy keyed on it belongs to the caller.
 */
public enum DifficultyLevel {
    EASY,
    MEDIUM,
    HARD;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whitelist conversion from a wire label. Only the exact lower-case labels are accepted;
     * anything else (including {@code "EASY"} or {@code " easy"}) is rejected.
     */
    public static Optional<DifficultyLevel> fromLabel(String label) {
        if (label == null) return Optional.empty();
        switch (label) {
            case "easy":
                return Optional.of(EASY);
            case "medium":
                return Optional.of(MEDIUM);
            case "hard":
                return Optional.of(HARD);
            default:
                return Optional.empty();
        }
    }
}
