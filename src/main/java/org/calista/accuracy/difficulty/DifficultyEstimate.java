package org.calista.accuracy.difficulty;

import org.calista.accuracy.core.Maps;
import org.calista.accuracy.core.Thresholds;
import org.calista.accuracy.error.ErrorCode;
import org.calista.accuracy.error.Outcome;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * DifficultyEstimate — immutable difficulty classification of a query.
 *
 * <p>Level reconciliation:
 * <ul>
 *   <li>level given: trusted as-is, even when it disagrees with score (human override)</li>
 *   <li>level absent, score given: {@link #toLevel(Double)}</li>
 *   <li>both absent: {@link DifficultyLevel#MEDIUM}</li>
 * </ul>
 *
 * <p>Map form: {@code {level, score, confidence, reasoning, features, metadata}};
 * null fields and empty maps are omitted.
 */
public final class DifficultyEstimate {

    private static final String SUBJECT = "DifficultyEstimate";

    public final DifficultyLevel level;

    /** Difficulty score in [0,1], or null. */
    public final Double score;

    /** Confidence of the estimate in [0,1], or null. */
    public final Double confidence;

    public final String reasoning;

    /** Contributing signals (length, complexity, domain...). Immutable. */
    public final Map<String, Object> features;

    public final Map<String, Object> metadata;

    private DifficultyEstimate(Builder b, DifficultyLevel level) {
        this.level = level;
        this.score = b.score;
        this.confidence = b.confidence;
        this.reasoning = b.reasoning;
        this.features = Maps.copyOf(b.features);
        this.metadata = Maps.copyOf(b.metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** {@code level} may be null, in which case it is derived from {@code score}. */
    public static Outcome<DifficultyEstimate> create(DifficultyLevel level, Double score, Double confidence) {
        return builder().level(level).score(score).confidence(confidence).create();
    }

    public static DifficultyEstimate of(DifficultyLevel level, Double score, Double confidence) {
        return create(level, score, confidence).orElseThrow(SUBJECT);
    }

    // ---------------------------------------------------------------------
    // Classification
    // ---------------------------------------------------------------------

    /**
     * Canonical score classifier: {@code < 0.35} easy, {@code <= 0.65} medium, otherwise hard.
     * {@code null} (or NaN) maps to medium.
     */
    public static DifficultyLevel toLevel(Double score) {
        if (score == null || score.isNaN()) return DifficultyLevel.MEDIUM;
        if (score < Thresholds.EASY) return DifficultyLevel.EASY;
        if (score <= Thresholds.HARD) return DifficultyLevel.MEDIUM;
        return DifficultyLevel.HARD;
    }

    public static double easyThreshold() {
        return Thresholds.EASY;
    }

    public static double hardThreshold() {
        return Thresholds.HARD;
    }

    public boolean isEasy() {
        return level == DifficultyLevel.EASY;
    }

    public boolean isMedium() {
        return level == DifficultyLevel.MEDIUM;
    }

    public boolean isHard() {
        return level == DifficultyLevel.HARD;
    }

    // ---------------------------------------------------------------------
    // Serialization
    // ---------------------------------------------------------------------

    public Map<String, Object> toMap() {
        LinkedHashMap<String, Object> m = new LinkedHashMap<>();
        m.put("level", level.label());
        Maps.putIfMeaningful(m, "score", score);
        Maps.putIfMeaningful(m, "confidence", confidence);
        Maps.putIfMeaningful(m, "reasoning", reasoning);
        Maps.putIfMeaningful(m, "features", features);
        Maps.putIfMeaningful(m, "metadata", metadata);
        return m;
    }

    /**
     * Inverse of {@link #toMap()}.
     *
     * <p>The level label is checked against the closed set before anything else is read,
     * so an unrecognized label never yields a partially built estimate.
     */
    public static Outcome<DifficultyEstimate> fromMap(Map<String, ?> map) {
        if (map == null) return Outcome.failure(ErrorCode.INVALID_MAP);

        Object rawLevel = map.get("level");
        DifficultyLevel level = null;
        if (rawLevel instanceof DifficultyLevel l) {
            level = l;
        } else if (rawLevel instanceof String s) {
            Optional<DifficultyLevel> parsed = DifficultyLevel.fromLabel(s);
            if (parsed.isEmpty()) return Outcome.failure(ErrorCode.INVALID_LEVEL);
            level = parsed.get();
        } else if (rawLevel != null) {
            return Outcome.failure(ErrorCode.INVALID_LEVEL);
        }

        Object rawScore = map.get("score");
        if (rawScore != null && !(rawScore instanceof Number)) return Outcome.failure(ErrorCode.INVALID_SCORE);

        Object rawConfidence = map.get("confidence");
        if (rawConfidence != null && !(rawConfidence instanceof Number)) {
            return Outcome.failure(ErrorCode.INVALID_CONFIDENCE);
        }

        Object rawFeatures = map.get("features");
        Object rawMetadata = map.get("metadata");
        if (rawFeatures != null && !(rawFeatures instanceof Map)) return Outcome.failure(ErrorCode.INVALID_MAP);
        if (rawMetadata != null && !(rawMetadata instanceof Map)) return Outcome.failure(ErrorCode.INVALID_MAP);

        Object rawReasoning = map.get("reasoning");

        return builder()
                .level(level)
                .score(rawScore == null ? null : ((Number) rawScore).doubleValue())
                .confidence(rawConfidence == null ? null : ((Number) rawConfidence).doubleValue())
                .reasoning(rawReasoning == null ? null : String.valueOf(rawReasoning))
                .features(Maps.asMap(rawFeatures))
                .metadata(Maps.asMap(rawMetadata))
                .create();
    }

    public static DifficultyEstimate fromMapOrThrow(Map<String, ?> map) {
        return fromMap(map).orElseThrow(SUBJECT);
    }

    // ---------------------------------------------------------------------
    // Copy helpers
    // ---------------------------------------------------------------------

    public DifficultyEstimate withMetadata(String key, Object value) {
        return toBuilder().metadata(Maps.with(metadata, key, value)).build();
    }

    public Builder toBuilder() {
        return builder()
                .level(level)
                .score(score)
                .confidence(confidence)
                .reasoning(reasoning)
                .features(features)
                .metadata(metadata);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof DifficultyEstimate d)) return false;
        return level == d.level
                && Objects.equals(score, d.score)
                && Objects.equals(confidence, d.confidence)
                && Objects.equals(reasoning, d.reasoning)
                && features.equals(d.features)
                && metadata.equals(d.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, score, confidence, reasoning, features, metadata);
    }

    @Override
    public String toString() {
        return "DifficultyEstimate{level=" + level.label()
                + ", score=" + score
                + ", confidence=" + confidence
                + ", features=" + features.keySet()
                + '}';
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private DifficultyLevel level;
        private Double score;
        private Double confidence;
        private String reasoning;
        private Map<String, Object> features = Map.of();
        private Map<String, Object> metadata = Map.of();

        private Builder() {}

        public Builder level(DifficultyLevel level) {
            this.level = level;
            return this;
        }

        public Builder score(Double score) {
            this.score = score;
            return this;
        }

        public Builder confidence(Double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder features(Map<String, Object> features) {
            this.features = features;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        /** Validating factory: {@code invalid_score} / {@code invalid_confidence} on out-of-range values. */
        public Outcome<DifficultyEstimate> create() {
            if (score != null && !Thresholds.isUnitInterval(score)) return Outcome.failure(ErrorCode.INVALID_SCORE);
            if (confidence != null && !Thresholds.isUnitInterval(confidence)) {
                return Outcome.failure(ErrorCode.INVALID_CONFIDENCE);
            }
            DifficultyLevel finalLevel = (level != null) ? level : toLevel(score);
            return Outcome.ok(new DifficultyEstimate(this, finalLevel));
        }

        /** Raising variant of {@link #create()}. */
        public DifficultyEstimate build() {
            return create().orElseThrow(SUBJECT);
        }
    }
}
