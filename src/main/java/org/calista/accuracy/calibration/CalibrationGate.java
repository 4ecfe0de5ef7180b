package org.calista.accuracy.calibration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.accuracy.candidate.Candidate;
import org.calista.accuracy.core.AccuracyConfig;
import org.calista.accuracy.core.Thresholds;
import org.calista.accuracy.error.ErrorCode;
import org.calista.accuracy.error.Outcome;
import org.calista.accuracy.telemetry.TelemetryEvent;
import org.calista.accuracy.telemetry.TelemetrySink;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * CalibrationGate — confidence-gated routing of a candidate answer.
 *
 * <pre>
 * score &gt;= high          : HIGH   -&gt; direct (fixed)
 * low &lt;= score &lt; high    : MEDIUM -&gt; mediumAction (default with_verification)
 * score &lt; low            : LOW    -&gt; lowAction    (default abstain)
 * </pre>
 *
 * Boundary scores belong to the higher band.
 *
 * <p>The action alone decides the transformation:
 * <ul>
 *   <li>direct: candidate untouched</li>
 *   <li>with_verification / with_citations: a note is appended to the content (null content passes through)</li>
 *   <li>abstain / escalate: the candidate is replaced by a canned message, score cleared,
 *       metadata stamped with {@code abstained|escalated=true} and {@code original_confidence}</li>
 * </ul>
 *
 * Immutable and stateless across calls; safe to share between threads. Telemetry is emitted after
 * the decision and a failing sink never affects the returned result.
 */
public final class CalibrationGate {

    private static final Logger log = LogManager.getLogger(CalibrationGate.class);

    private static final String SUBJECT = "CalibrationGate";

    static final String VERIFICATION_NOTE =
            "\n\n[Confidence: Medium] Please verify this information independently.";

    static final String CITATION_NOTE =
            "\n\n[Confidence: Medium] Consider verifying this with additional sources.";

    private static final String ABSTAIN_TEMPLATE =
            "I'm not confident enough to provide a definitive answer to this question (confidence: %.2f).\n"
                    + "\n"
                    + "This could be because:\n"
                    + "- The question is ambiguous or unclear\n"
                    + "- I don't have sufficient information to answer accurately\n"
                    + "- There are multiple valid interpretations\n"
                    + "\n"
                    + "Suggestions:\n"
                    + "- Try rephrasing your question with more specific details\n"
                    + "- Break the question into smaller parts\n"
                    + "- Provide additional context";

    private static final String ESCALATE_TEMPLATE =
            "I'm not confident enough to provide a definitive answer (confidence: %.2f).\n"
                    + "\n"
                    + "This question has been escalated for human review. Someone will provide assistance shortly.";

    public final double highThreshold;
    public final double lowThreshold;
    public final RoutingAction mediumAction;
    public final RoutingAction lowAction;
    public final boolean emitTelemetry;

    private final TelemetrySink telemetry;

    private CalibrationGate(Builder b) {
        this.highThreshold = b.highThreshold;
        this.lowThreshold = b.lowThreshold;
        this.mediumAction = b.mediumAction;
        this.lowAction = b.lowAction;
        this.emitTelemetry = b.emitTelemetry;
        this.telemetry = (b.telemetry == null) ? TelemetrySink.noop() : b.telemetry;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Gate with default thresholds (0.7 / 0.4) and actions (with_verification / abstain). */
    public static CalibrationGate defaults() {
        return builder().build();
    }

    public static Outcome<CalibrationGate> create(double high, double low, RoutingAction mediumAction, RoutingAction lowAction) {
        return builder().highThreshold(high).lowThreshold(low).mediumAction(mediumAction).lowAction(lowAction).create();
    }

    public static CalibrationGate of(double high, double low, RoutingAction mediumAction, RoutingAction lowAction) {
        return create(high, low, mediumAction, lowAction).orElseThrow(SUBJECT);
    }

    /**
     * Builds a gate from the {@code gate} config section. Action labels go through the closed set:
     * an unknown label is {@code invalid_action}.
     */
    public static Outcome<CalibrationGate> fromConfig(AccuracyConfig.Gate cfg, TelemetrySink telemetry) {
        Objects.requireNonNull(cfg, "cfg");

        Optional<RoutingAction> medium = RoutingAction.fromLabel(normalizeLabel(cfg.mediumAction));
        Optional<RoutingAction> low = RoutingAction.fromLabel(normalizeLabel(cfg.lowAction));
        if (medium.isEmpty() || low.isEmpty()) return Outcome.failure(ErrorCode.INVALID_ACTION);

        return builder()
                .highThreshold(cfg.highThreshold)
                .lowThreshold(cfg.lowThreshold)
                .mediumAction(medium.get())
                .lowAction(low.get())
                .emitTelemetry(cfg.emitTelemetry)
                .telemetry(telemetry)
                .create();
    }

    private static String normalizeLabel(String s) {
        return (s == null) ? null : s.trim().toLowerCase(Locale.ROOT);
    }

    // ---------------------------------------------------------------------
    // Routing
    // ---------------------------------------------------------------------

    public Outcome<RoutingResult> route(Candidate candidate, ConfidenceEstimate estimate) {
        if (estimate == null) return Outcome.failure(ErrorCode.INVALID_CONFIDENCE);
        return route(candidate, estimate.score);
    }

    /**
     * Routes {@code candidate} on a raw score.
     *
     * @return {@code invalid_candidate} for a null candidate, {@code invalid_score} for a score outside [0,1]
     */
    public Outcome<RoutingResult> route(Candidate candidate, double score) {
        if (candidate == null) return Outcome.failure(ErrorCode.INVALID_CANDIDATE);
        if (!Thresholds.isUnitInterval(score)) return Outcome.failure(ErrorCode.INVALID_SCORE);

        final long t0 = emitTelemetry ? System.nanoTime() : 0L;

        ConfidenceLevel level = confidenceLevel(score);
        RoutingAction action = actionFor(level);

        Candidate routed;
        String reasoning;
        switch (action) {
            case WITH_VERIFICATION:
                routed = appendNote(candidate, VERIFICATION_NOTE);
                reasoning = format("Medium confidence (%.3f), adding verification suggestion", score);
                break;
            case WITH_CITATIONS:
                routed = appendNote(candidate, CITATION_NOTE);
                reasoning = format("Medium confidence (%.3f), adding citations", score);
                break;
            case ABSTAIN:
                routed = replacement(format(ABSTAIN_TEMPLATE, score), "abstained", score);
                reasoning = format("Low confidence (%.3f), abstaining from answer", score);
                break;
            case ESCALATE:
                routed = replacement(format(ESCALATE_TEMPLATE, score), "escalated", score);
                reasoning = format("Low confidence (%.3f), escalating for review", score);
                break;
            case DIRECT:
            default:
                routed = candidate;
                reasoning = format("High confidence (%.3f), returning answer directly", score);
                break;
        }

        LinkedHashMap<String, Object> meta = new LinkedHashMap<>();
        meta.put("high_threshold", highThreshold);
        meta.put("low_threshold", lowThreshold);

        RoutingResult result = RoutingResult.builder()
                .action(action)
                .candidate(routed)
                .originalScore(score)
                .confidenceLevel(level)
                .reasoning(reasoning)
                .metadata(meta)
                .build();

        if (log.isDebugEnabled()) {
            log.debug("CalibrationGate: candidate={} score={} level={} action={}",
                    candidate.id, format("%.3f", score), level.label(), action.label());
        }

        if (emitTelemetry) emit(result, System.nanoTime() - t0);
        return Outcome.ok(result);
    }

    public RoutingResult routeOrThrow(Candidate candidate, double score) {
        return route(candidate, score).orElseThrow("RoutingResult");
    }

    /** Pre-flight projection: the action {@link #route} would take for this score, no side effects. */
    public RoutingAction shouldRoute(double score) {
        return actionFor(confidenceLevel(score));
    }

    public ConfidenceLevel confidenceLevel(double score) {
        return ConfidenceLevel.classify(score, highThreshold, lowThreshold);
    }

    private RoutingAction actionFor(ConfidenceLevel level) {
        switch (level) {
            case HIGH:
                return RoutingAction.DIRECT;
            case MEDIUM:
                return mediumAction;
            case LOW:
            default:
                return lowAction;
        }
    }

    private static Candidate appendNote(Candidate candidate, String note) {
        if (candidate.content == null) return candidate;
        return candidate.withContent(candidate.content + note);
    }

    private static Candidate replacement(String content, String flag, double score) {
        LinkedHashMap<String, Object> meta = new LinkedHashMap<>();
        meta.put(flag, Boolean.TRUE);
        meta.put("original_confidence", score);
        return Candidate.builder()
                .content(content)
                .score(null)
                .metadata(meta)
                .build();
    }

    private void emit(RoutingResult result, long durationNanos) {
        LinkedHashMap<String, Object> tags = new LinkedHashMap<>();
        tags.put("action", result.action.label());
        tags.put("confidence_level", result.confidenceLevel.label());
        tags.put("score", result.originalScore);
        try {
            telemetry.emit(new TelemetryEvent(TelemetryEvent.CALIBRATION_ROUTE, Map.of("duration", durationNanos), tags));
        } catch (RuntimeException e) {
            log.warn("CalibrationGate: telemetry sink failed (ignored): {}", e.toString());
        }
    }

    private static String format(String pattern, double score) {
        return String.format(Locale.ROOT, pattern, score);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof CalibrationGate g)) return false;
        return Double.compare(highThreshold, g.highThreshold) == 0
                && Double.compare(lowThreshold, g.lowThreshold) == 0
                && mediumAction == g.mediumAction
                && lowAction == g.lowAction
                && emitTelemetry == g.emitTelemetry;
    }

    @Override
    public int hashCode() {
        return Objects.hash(highThreshold, lowThreshold, mediumAction, lowAction, emitTelemetry);
    }

    @Override
    public String toString() {
        return "CalibrationGate{high=" + highThreshold
                + ", low=" + lowThreshold
                + ", medium=" + mediumAction.label()
                + ", low_action=" + lowAction.label()
                + ", telemetry=" + emitTelemetry
                + '}';
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private double highThreshold = Thresholds.CALIBRATION_HIGH;
        private double lowThreshold = Thresholds.CALIBRATION_LOW;
        private RoutingAction mediumAction = RoutingAction.WITH_VERIFICATION;
        private RoutingAction lowAction = RoutingAction.ABSTAIN;
        private boolean emitTelemetry = true;
        private TelemetrySink telemetry;

        private Builder() {}

        public Builder highThreshold(double highThreshold) {
            this.highThreshold = highThreshold;
            return this;
        }

        public Builder lowThreshold(double lowThreshold) {
            this.lowThreshold = lowThreshold;
            return this;
        }

        public Builder mediumAction(RoutingAction mediumAction) {
            this.mediumAction = mediumAction;
            return this;
        }

        public Builder lowAction(RoutingAction lowAction) {
            this.lowAction = lowAction;
            return this;
        }

        public Builder emitTelemetry(boolean emitTelemetry) {
            this.emitTelemetry = emitTelemetry;
            return this;
        }

        /** Destination for route events; null means no-op. */
        public Builder telemetry(TelemetrySink telemetry) {
            this.telemetry = telemetry;
            return this;
        }

        /**
         * {@code invalid_thresholds} unless {@code high - low > 1e-4} (both finite);
         * {@code invalid_action} when an action is missing.
         */
        public Outcome<CalibrationGate> create() {
            if (!Double.isFinite(highThreshold) || !Double.isFinite(lowThreshold)) {
                return Outcome.failure(ErrorCode.INVALID_THRESHOLDS);
            }
            if (!(highThreshold - lowThreshold > Thresholds.FLOAT_EPSILON)) {
                return Outcome.failure(ErrorCode.INVALID_THRESHOLDS);
            }
            if (mediumAction == null || lowAction == null) return Outcome.failure(ErrorCode.INVALID_ACTION);
            return Outcome.ok(new CalibrationGate(this));
        }

        public CalibrationGate build() {
            return create().orElseThrow(SUBJECT);
        }
    }
}
