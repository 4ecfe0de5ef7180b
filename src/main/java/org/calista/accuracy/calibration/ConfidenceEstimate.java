package org.calista.accuracy.calibration;

import org.calista.accuracy.core.Maps;
import org.calista.accuracy.core.Thresholds;
import org.calista.accuracy.error.ErrorCode;
import org.calista.accuracy.error.Outcome;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ConfidenceEstimate — how much an external estimator trusts one candidate.
 *
 * Produced outside this library (attention/logprob/ensemble methods); validated here
 * because the gate keys its decision on {@link #score}.
 */
public final class ConfidenceEstimate {

    private static final String SUBJECT = "ConfidenceEstimate";

    /** In [0,1]. */
    public final double score;

    /** Estimation method id, e.g. "attention", "ensemble". Never blank. */
    public final String method;

    /** Calibration quality of the method, if known. */
    public final Double calibration;

    public final String reasoning;

    /** Per-token confidences in generation order; empty when not available. */
    public final List<Double> tokenLevelConfidence;

    public final Map<String, Object> metadata;

    private ConfidenceEstimate(Builder b) {
        this.score = b.score;
        this.method = b.method;
        this.calibration = b.calibration;
        this.reasoning = b.reasoning;
        this.tokenLevelConfidence = (b.tokenLevelConfidence == null) ? List.of() : List.copyOf(b.tokenLevelConfidence);
        this.metadata = Maps.copyOf(b.metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Outcome<ConfidenceEstimate> create(Double score, String method) {
        return builder().score(score).method(method).create();
    }

    public static ConfidenceEstimate of(double score, String method) {
        return builder().score(score).method(method).build();
    }

    // fixed default bands, independent of any gate configuration

    public boolean isHigh() {
        return score >= Thresholds.CALIBRATION_HIGH;
    }

    public boolean isMedium() {
        return score >= Thresholds.CALIBRATION_LOW && score < Thresholds.CALIBRATION_HIGH;
    }

    public boolean isLow() {
        return score < Thresholds.CALIBRATION_LOW;
    }

    public ConfidenceLevel level() {
        return ConfidenceLevel.classify(score, Thresholds.CALIBRATION_HIGH, Thresholds.CALIBRATION_LOW);
    }

    // ---------------------------------------------------------------------
    // Serialization
    // ---------------------------------------------------------------------

    public Map<String, Object> toMap() {
        LinkedHashMap<String, Object> m = new LinkedHashMap<>();
        m.put("score", score);
        m.put("method", method);
        Maps.putIfMeaningful(m, "calibration", calibration);
        Maps.putIfMeaningful(m, "reasoning", reasoning);
        if (!tokenLevelConfidence.isEmpty()) m.put("token_level_confidence", tokenLevelConfidence);
        Maps.putIfMeaningful(m, "metadata", metadata);
        return m;
    }

    public static Outcome<ConfidenceEstimate> fromMap(Map<String, ?> map) {
        if (map == null) return Outcome.failure(ErrorCode.INVALID_MAP);

        Object rawScore = map.get("score");
        if (!Maps.isFiniteNumber(rawScore)) return Outcome.failure(ErrorCode.INVALID_SCORE);

        Object rawMethod = map.get("method");
        Object rawCalibration = map.get("calibration");
        if (rawCalibration != null && !Maps.isFiniteNumber(rawCalibration)) return Outcome.failure(ErrorCode.INVALID_MAP);

        Object rawTokens = map.get("token_level_confidence");
        ArrayList<Double> tokens = null;
        if (rawTokens != null) {
            if (!(rawTokens instanceof List<?> l)) return Outcome.failure(ErrorCode.INVALID_MAP);
            tokens = new ArrayList<>(l.size());
            for (Object o : l) {
                if (!Maps.isFiniteNumber(o)) return Outcome.failure(ErrorCode.INVALID_MAP);
                tokens.add(((Number) o).doubleValue());
            }
        }

        Object rawMetadata = map.get("metadata");
        if (rawMetadata != null && !(rawMetadata instanceof Map)) return Outcome.failure(ErrorCode.INVALID_MAP);

        Object rawReasoning = map.get("reasoning");

        return builder()
                .score(((Number) rawScore).doubleValue())
                .method(rawMethod == null ? null : String.valueOf(rawMethod))
                .calibration(rawCalibration == null ? null : ((Number) rawCalibration).doubleValue())
                .reasoning(rawReasoning == null ? null : String.valueOf(rawReasoning))
                .tokenLevelConfidence(tokens)
                .metadata(Maps.asMap(rawMetadata))
                .create();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof ConfidenceEstimate c)) return false;
        return Double.compare(score, c.score) == 0
                && method.equals(c.method)
                && Objects.equals(calibration, c.calibration)
                && Objects.equals(reasoning, c.reasoning)
                && tokenLevelConfidence.equals(c.tokenLevelConfidence)
                && metadata.equals(c.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(score, method, calibration, reasoning, tokenLevelConfidence, metadata);
    }

    @Override
    public String toString() {
        return "ConfidenceEstimate{score=" + score + ", method=" + method + '}';
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private Double score;
        private String method;
        private Double calibration;
        private String reasoning;
        private List<Double> tokenLevelConfidence;
        private Map<String, Object> metadata = Map.of();

        private Builder() {}

        public Builder score(Double score) {
            this.score = score;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder calibration(Double calibration) {
            this.calibration = calibration;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder tokenLevelConfidence(List<Double> tokenLevelConfidence) {
            this.tokenLevelConfidence = tokenLevelConfidence;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        /** {@code invalid_score} when score is missing or outside [0,1]; {@code invalid_method} when method is blank. */
        public Outcome<ConfidenceEstimate> create() {
            if (score == null || !Thresholds.isUnitInterval(score)) return Outcome.failure(ErrorCode.INVALID_SCORE);
            if (method == null || method.isBlank()) return Outcome.failure(ErrorCode.INVALID_METHOD);
            if (tokenLevelConfidence != null) {
                for (Double t : tokenLevelConfidence) {
                    if (t == null) return Outcome.failure(ErrorCode.INVALID_CONFIDENCE);
                }
            }
            return Outcome.ok(new ConfidenceEstimate(this));
        }

        public ConfidenceEstimate build() {
            return create().orElseThrow(SUBJECT);
        }
    }
}
