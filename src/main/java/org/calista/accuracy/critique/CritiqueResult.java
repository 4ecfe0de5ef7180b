package org.calista.accuracy.critique;

import org.calista.accuracy.core.Maps;
import org.calista.accuracy.core.Thresholds;
import org.calista.accuracy.error.ErrorCode;
import org.calista.accuracy.error.Outcome;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * CritiqueResult — structured feedback on one candidate.
 *
 * <p>{@link #actionable} is derived, never supplied: true when there is at least one issue
 * or the severity exceeds {@link Thresholds#REFINE_SEVERITY}.
 */
public final class CritiqueResult {

    private static final String SUBJECT = "CritiqueResult";

    public enum SeverityLevel {
        LOW,
        MEDIUM,
        HIGH;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public final List<String> issues;
    public final List<String> suggestions;

    /** In [0,1]; 0 means nothing wrong. */
    public final double severity;

    public final String feedback;
    public final boolean actionable;
    public final Map<String, Object> metadata;

    private CritiqueResult(List<String> issues, List<String> suggestions, double severity,
                           String feedback, boolean actionable, Map<String, Object> metadata) {
        this.issues = issues;
        this.suggestions = suggestions;
        this.severity = severity;
        this.feedback = feedback;
        this.actionable = actionable;
        this.metadata = Maps.copyOf(metadata);
    }

    /**
     * Validating factory.
     *
     * @return {@code invalid_severity} when severity is missing or outside [0,1]
     */
    public static Outcome<CritiqueResult> create(Double severity, List<String> issues, List<String> suggestions,
                                                 String feedback, Map<String, Object> metadata) {
        if (severity == null || !Thresholds.isUnitInterval(severity)) return Outcome.failure(ErrorCode.INVALID_SEVERITY);
        List<String> is = copyStrings(issues);
        List<String> ss = copyStrings(suggestions);
        boolean actionable = !is.isEmpty() || severity > Thresholds.REFINE_SEVERITY;
        return Outcome.ok(new CritiqueResult(is, ss, severity, feedback, actionable, metadata));
    }

    public static CritiqueResult of(double severity, List<String> issues) {
        return create(severity, issues, List.of(), null, Map.of()).orElseThrow(SUBJECT);
    }

    public static CritiqueResult noIssues() {
        return create(0.0, List.of(), List.of(), "No issues found", Map.of()).orElseThrow(SUBJECT);
    }

    private static List<String> copyStrings(List<String> src) {
        if (src == null || src.isEmpty()) return List.of();
        ArrayList<String> out = new ArrayList<>(src.size());
        for (String s : src) if (s != null) out.add(s);
        return List.copyOf(out);
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    public boolean shouldRefine() {
        return shouldRefine(Thresholds.REFINE_SEVERITY);
    }

    /** Strictly above the threshold. */
    public boolean shouldRefine(double threshold) {
        return severity > threshold;
    }

    public SeverityLevel severityLevel() {
        if (severity < 0.3) return SeverityLevel.LOW;
        if (severity < 0.7) return SeverityLevel.MEDIUM;
        return SeverityLevel.HIGH;
    }

    // ---------------------------------------------------------------------
    // Combination
    // ---------------------------------------------------------------------

    /** Appends an issue; the result is always actionable. */
    public CritiqueResult withIssue(String issue) {
        if (issue == null) return this;
        ArrayList<String> next = new ArrayList<>(issues);
        next.add(issue);
        return new CritiqueResult(List.copyOf(next), suggestions, severity, feedback, true, metadata);
    }

    /**
     * Combines two critiques of the same candidate: lists concatenated (this first), max severity,
     * feedback joined by a newline, actionable if either is, metadata merged with {@code other} winning.
     */
    public CritiqueResult merge(CritiqueResult other) {
        Objects.requireNonNull(other, "other");

        ArrayList<String> is = new ArrayList<>(issues);
        is.addAll(other.issues);
        ArrayList<String> ss = new ArrayList<>(suggestions);
        ss.addAll(other.suggestions);

        LinkedHashMap<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putAll(other.metadata);

        return new CritiqueResult(
                List.copyOf(is),
                List.copyOf(ss),
                Math.max(severity, other.severity),
                mergeFeedback(feedback, other.feedback),
                actionable || other.actionable,
                meta);
    }

    private static String mergeFeedback(String a, String b) {
        if (a == null) return b;
        if (b == null) return a;
        return a + "\n" + b;
    }

    // ---------------------------------------------------------------------
    // Serialization
    // ---------------------------------------------------------------------

    public Map<String, Object> toMap() {
        LinkedHashMap<String, Object> m = new LinkedHashMap<>();
        m.put("issues", issues);
        m.put("suggestions", suggestions);
        m.put("severity", severity);
        Maps.putIfMeaningful(m, "feedback", feedback);
        m.put("actionable", actionable);
        Maps.putIfMeaningful(m, "metadata", metadata);
        return m;
    }

    /** {@code actionable} in the map is ignored and recomputed. */
    public static Outcome<CritiqueResult> fromMap(Map<String, ?> map) {
        if (map == null) return Outcome.failure(ErrorCode.INVALID_MAP);

        Object rawSeverity = map.get("severity");
        if (!Maps.isFiniteNumber(rawSeverity)) return Outcome.failure(ErrorCode.INVALID_SEVERITY);

        List<String> issues = stringList(map.get("issues"));
        List<String> suggestions = stringList(map.get("suggestions"));
        if (issues == null || suggestions == null) return Outcome.failure(ErrorCode.INVALID_MAP);

        Object rawMetadata = map.get("metadata");
        if (rawMetadata != null && !(rawMetadata instanceof Map)) return Outcome.failure(ErrorCode.INVALID_MAP);

        Object rawFeedback = map.get("feedback");
        return create(((Number) rawSeverity).doubleValue(), issues, suggestions,
                rawFeedback == null ? null : String.valueOf(rawFeedback),
                Maps.asMap(rawMetadata));
    }

    /** @return strings of a list value, empty for null, or null when the value is not a list */
    private static List<String> stringList(Object raw) {
        if (raw == null) return List.of();
        if (!(raw instanceof List<?> l)) return null;
        ArrayList<String> out = new ArrayList<>(l.size());
        for (Object o : l) if (o != null) out.add(String.valueOf(o));
        return out;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof CritiqueResult c)) return false;
        return Double.compare(severity, c.severity) == 0
                && actionable == c.actionable
                && issues.equals(c.issues)
                && suggestions.equals(c.suggestions)
                && Objects.equals(feedback, c.feedback)
                && metadata.equals(c.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(issues, suggestions, severity, feedback, actionable, metadata);
    }

    @Override
    public String toString() {
        return "CritiqueResult{severity=" + severity + ", issues=" + issues.size() + ", actionable=" + actionable + '}';
    }
}
