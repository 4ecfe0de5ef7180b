package org.calista.accuracy.calibration;

import org.calista.accuracy.candidate.Candidate;
import org.calista.accuracy.core.Maps;
import org.calista.accuracy.core.Thresholds;
import org.calista.accuracy.error.ErrorCode;
import org.calista.accuracy.error.Outcome;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * RoutingResult — externally visible outcome of {@link CalibrationGate#route}.
 *
 * <p>{@link #candidate} is what the caller should return to the user. For abstain/escalate it is
 * a newly synthesized candidate, not the one that was routed.
 */
public final class RoutingResult {

    private static final String SUBJECT = "RoutingResult";

    public final RoutingAction action;
    public final Candidate candidate;

    /** Score that drove the decision, in [0,1], or null. */
    public final Double originalScore;

    public final ConfidenceLevel confidenceLevel;
    public final String reasoning;
    public final Map<String, Object> metadata;

    private RoutingResult(Builder b) {
        this.action = b.action;
        this.candidate = b.candidate;
        this.originalScore = b.originalScore;
        this.confidenceLevel = b.confidenceLevel;
        this.reasoning = b.reasoning;
        this.metadata = Maps.copyOf(b.metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Outcome<RoutingResult> create(RoutingAction action, Candidate candidate, Double originalScore,
                                                ConfidenceLevel confidenceLevel) {
        return builder().action(action).candidate(candidate).originalScore(originalScore)
                .confidenceLevel(confidenceLevel).create();
    }

    public static RoutingResult of(RoutingAction action, Candidate candidate, Double originalScore,
                                   ConfidenceLevel confidenceLevel) {
        return create(action, candidate, originalScore, confidenceLevel).orElseThrow(SUBJECT);
    }

    // ---------------------------------------------------------------------
    // Predicates
    // ---------------------------------------------------------------------

    public boolean isDirect() {
        return action == RoutingAction.DIRECT;
    }

    public boolean isWithVerification() {
        return action == RoutingAction.WITH_VERIFICATION;
    }

    public boolean isWithCitations() {
        return action == RoutingAction.WITH_CITATIONS;
    }

    public boolean isAbstained() {
        return action == RoutingAction.ABSTAIN;
    }

    public boolean isEscalated() {
        return action == RoutingAction.ESCALATE;
    }

    /** Only a direct route returns the candidate as-is. */
    public boolean isUnmodified() {
        return isDirect();
    }

    public boolean isModified() {
        return !isUnmodified();
    }

    // ---------------------------------------------------------------------
    // Serialization
    // ---------------------------------------------------------------------

    public Map<String, Object> toMap() {
        LinkedHashMap<String, Object> m = new LinkedHashMap<>();
        m.put("action", action.label());
        Maps.putIfMeaningful(m, "candidate", candidate == null ? null : candidate.toMap());
        Maps.putIfMeaningful(m, "original_score", originalScore);
        Maps.putIfMeaningful(m, "confidence_level", confidenceLevel == null ? null : confidenceLevel.label());
        Maps.putIfMeaningful(m, "reasoning", reasoning);
        Maps.putIfMeaningful(m, "metadata", metadata);
        return m;
    }

    /**
     * Inverse of {@link #toMap()}.
     *
     * <p>Labels are converted through the closed action/level sets; an unrecognized label is
     * reported ({@code invalid_action} / {@code invalid_confidence_level}) instead of being coerced.
     */
    public static Outcome<RoutingResult> fromMap(Map<String, ?> map) {
        if (map == null) return Outcome.failure(ErrorCode.INVALID_MAP);

        Object rawAction = map.get("action");
        RoutingAction action;
        if (rawAction instanceof RoutingAction a) {
            action = a;
        } else if (rawAction instanceof String s) {
            Optional<RoutingAction> parsed = RoutingAction.fromLabel(s);
            if (parsed.isEmpty()) return Outcome.failure(ErrorCode.INVALID_ACTION);
            action = parsed.get();
        } else {
            return Outcome.failure(ErrorCode.INVALID_ACTION);
        }

        Object rawLevel = map.get("confidence_level");
        ConfidenceLevel level = null;
        if (rawLevel instanceof ConfidenceLevel l) {
            level = l;
        } else if (rawLevel instanceof String s) {
            Optional<ConfidenceLevel> parsed = ConfidenceLevel.fromLabel(s);
            if (parsed.isEmpty()) return Outcome.failure(ErrorCode.INVALID_CONFIDENCE_LEVEL);
            level = parsed.get();
        } else if (rawLevel != null) {
            return Outcome.failure(ErrorCode.INVALID_CONFIDENCE_LEVEL);
        }

        Object rawScore = map.get("original_score");
        if (rawScore != null && !(rawScore instanceof Number)) return Outcome.failure(ErrorCode.INVALID_SCORE);

        Object rawCandidate = map.get("candidate");
        Candidate candidate = null;
        if (rawCandidate instanceof Candidate c) {
            candidate = c;
        } else if (rawCandidate instanceof Map<?, ?> cm) {
            Outcome<Candidate> parsed = Candidate.fromMap(Maps.copyOf(cm));
            if (parsed.isFailure()) return Outcome.failure(ErrorCode.INVALID_CANDIDATE);
            candidate = parsed.value();
        } else if (rawCandidate != null) {
            return Outcome.failure(ErrorCode.INVALID_CANDIDATE);
        }

        Object rawMetadata = map.get("metadata");
        if (rawMetadata != null && !(rawMetadata instanceof Map)) return Outcome.failure(ErrorCode.INVALID_MAP);

        Object rawReasoning = map.get("reasoning");

        return builder()
                .action(action)
                .candidate(candidate)
                .originalScore(rawScore == null ? null : ((Number) rawScore).doubleValue())
                .confidenceLevel(level)
                .reasoning(rawReasoning == null ? null : String.valueOf(rawReasoning))
                .metadata(Maps.asMap(rawMetadata))
                .create();
    }

    public static RoutingResult fromMapOrThrow(Map<String, ?> map) {
        return fromMap(map).orElseThrow(SUBJECT);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof RoutingResult r)) return false;
        return action == r.action
                && Objects.equals(candidate, r.candidate)
                && Objects.equals(originalScore, r.originalScore)
                && confidenceLevel == r.confidenceLevel
                && Objects.equals(reasoning, r.reasoning)
                && metadata.equals(r.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, candidate, originalScore, confidenceLevel, reasoning, metadata);
    }

    @Override
    public String toString() {
        return "RoutingResult{action=" + action.label()
                + ", level=" + (confidenceLevel == null ? "null" : confidenceLevel.label())
                + ", score=" + originalScore
                + '}';
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private RoutingAction action;
        private Candidate candidate;
        private Double originalScore;
        private ConfidenceLevel confidenceLevel;
        private String reasoning;
        private Map<String, Object> metadata = Map.of();

        private Builder() {}

        public Builder action(RoutingAction action) {
            this.action = action;
            return this;
        }

        public Builder candidate(Candidate candidate) {
            this.candidate = candidate;
            return this;
        }

        public Builder originalScore(Double originalScore) {
            this.originalScore = originalScore;
            return this;
        }

        public Builder confidenceLevel(ConfidenceLevel confidenceLevel) {
            this.confidenceLevel = confidenceLevel;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        /** {@code invalid_action} when action is missing; {@code invalid_score} when the score is outside [0,1]. */
        public Outcome<RoutingResult> create() {
            if (action == null) return Outcome.failure(ErrorCode.INVALID_ACTION);
            if (originalScore != null && !Thresholds.isUnitInterval(originalScore)) {
                return Outcome.failure(ErrorCode.INVALID_SCORE);
            }
            return Outcome.ok(new RoutingResult(this));
        }

        public RoutingResult build() {
            return create().orElseThrow(SUBJECT);
        }
    }
}
