package org.calista.accuracy.error;

import java.util.Locale;

/**
 * Failure taxonomy shared by every factory in the library.
 *
 * <p>Each code has a stable snake_case label used on the wire and in exception messages.
 */
public enum ErrorCode {
    INVALID_SCORE,
    INVALID_CONFIDENCE,
    INVALID_THRESHOLDS,
    INVALID_ACTION,
    INVALID_LEVEL,
    INVALID_CONFIDENCE_LEVEL,
    INVALID_CANDIDATES,
    INVALID_CANDIDATE,
    INVALID_MAP,
    INVALID_METHOD,
    INVALID_SEVERITY,
    INVALID_WEIGHTS,
    INVALID_TIMEOUT,
    INVALID_QUERY,
    QUERY_TOO_LONG,
    TIMEOUT,
    FEATURE_EXTRACTION_FAILED,
    BATCH_ESTIMATION_FAILED;

    private final String label;

    ErrorCode() {
        this.label = name().toLowerCase(Locale.ROOT);
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
