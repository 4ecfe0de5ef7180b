package org.calista.accuracy.calibration;

import java.util.Locale;
import java.util.Optional;

public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ConfidenceLevel> fromLabel(String label) {
        if (label == null) return Optional.empty();
        switch (label) {
            case "high":
                return Optional.of(HIGH);
            case "medium":
                return Optional.of(MEDIUM);
            case "low":
                return Optional.of(LOW);
            default:
                return Optional.empty();
        }
    }

    /** Step function: boundary values belong to the higher band. */
    public static ConfidenceLevel classify(double score, double high, double low) {
        if (score >= high) return HIGH;
        if (score >= low) return MEDIUM;
        return LOW;
    }
}
