package org.calista.accuracy.candidate;

import org.calista.accuracy.core.Maps;
import org.calista.accuracy.error.ErrorCode;
import org.calista.accuracy.error.Outcome;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Candidate — one generated answer.
 *
 * Immutable value: scoring or annotation produces a new instance via {@code withX(...)}.
 * - id is generated ({@code candidate_<uuid>}) when not supplied
 * - timestamp defaults to "now" at construction
 * - score is optional; tokensUsed is optional and never negative
 */
public final class Candidate {

    private static final String SUBJECT = "Candidate";

    public final String id;

    /** Answer text, may be null (e.g. a placeholder before generation finished). */
    public final String content;

    public final String reasoning;

    /** Quality score from an external scorer, or null when not scored yet. */
    public final Double score;

    public final Integer tokensUsed;
    public final String model;
    public final Instant timestamp;
    public final Map<String, Object> metadata;

    private Candidate(Builder b) {
        this.id = (b.id == null || b.id.isBlank()) ? newId() : b.id;
        this.content = b.content;
        this.reasoning = b.reasoning;
        this.score = b.score;
        this.tokensUsed = b.tokensUsed;
        this.model = b.model;
        this.timestamp = b.timestampSet ? b.timestamp : Instant.now();
        this.metadata = Maps.copyOf(b.metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Shorthand for a plain text candidate without score. */
    public static Candidate of(String content) {
        return builder().content(content).build();
    }

    public static Candidate of(String content, Double score) {
        return builder().content(content).score(score).build();
    }

    static String newId() {
        return "candidate_" + UUID.randomUUID();
    }

    // ---------------------------------------------------------------------
    // Copy helpers
    // ---------------------------------------------------------------------

    /** Accepts any finite score; range policy belongs to whoever produced it. */
    public Candidate withScore(Double newScore) {
        return toBuilder().score(newScore).build();
    }

    public Candidate withContent(String newContent) {
        return toBuilder().content(newContent).build();
    }

    public Candidate withMetadata(String key, Object value) {
        return toBuilder().metadata(Maps.with(metadata, key, value)).build();
    }

    public Builder toBuilder() {
        return builder()
                .id(id)
                .content(content)
                .reasoning(reasoning)
                .score(score)
                .tokensUsed(tokensUsed)
                .model(model)
                .timestamp(timestamp)
                .metadata(metadata);
    }

    /** {@code tokensUsed} with missing treated as zero. */
    public int tokensOrZero() {
        return tokensUsed == null ? 0 : tokensUsed;
    }

    // ---------------------------------------------------------------------
    // Serialization
    // ---------------------------------------------------------------------

    public Map<String, Object> toMap() {
        LinkedHashMap<String, Object> m = new LinkedHashMap<>();
        m.put("id", id);
        Maps.putIfMeaningful(m, "content", content);
        Maps.putIfMeaningful(m, "reasoning", reasoning);
        Maps.putIfMeaningful(m, "score", score);
        Maps.putIfMeaningful(m, "tokens_used", tokensUsed);
        Maps.putIfMeaningful(m, "model", model);
        Maps.putIfMeaningful(m, "timestamp", timestamp == null ? null : timestamp.toString());
        Maps.putIfMeaningful(m, "metadata", metadata);
        return m;
    }

    /**
     * Inverse of {@link #toMap()}.
     *
     * <p>An unparseable timestamp becomes null rather than failing; a non-numeric score,
     * fractional or negative token count, or non-map metadata is {@code invalid_candidate}.
     */
    public static Outcome<Candidate> fromMap(Map<String, ?> map) {
        if (map == null) return Outcome.failure(ErrorCode.INVALID_MAP);

        Object rawScore = map.get("score");
        if (rawScore != null && !Maps.isFiniteNumber(rawScore)) return Outcome.failure(ErrorCode.INVALID_CANDIDATE);

        Object rawTokens = map.get("tokens_used");
        if (rawTokens != null && !Maps.isIntegral(rawTokens)) return Outcome.failure(ErrorCode.INVALID_CANDIDATE);

        Object rawMetadata = map.get("metadata");
        if (rawMetadata != null && !(rawMetadata instanceof Map)) return Outcome.failure(ErrorCode.INVALID_CANDIDATE);

        Object rawId = map.get("id");
        Object rawContent = map.get("content");
        Object rawReasoning = map.get("reasoning");
        Object rawModel = map.get("model");

        long tokens = rawTokens == null ? 0L : ((Number) rawTokens).longValue();
        if (tokens > Integer.MAX_VALUE) return Outcome.failure(ErrorCode.INVALID_CANDIDATE);

        return builder()
                .id(rawId == null ? null : String.valueOf(rawId))
                .content(rawContent == null ? null : String.valueOf(rawContent))
                .reasoning(rawReasoning == null ? null : String.valueOf(rawReasoning))
                .score(rawScore == null ? null : ((Number) rawScore).doubleValue())
                .tokensUsed(rawTokens == null ? null : (int) tokens)
                .model(rawModel == null ? null : String.valueOf(rawModel))
                .timestamp(parseTimestamp(map.get("timestamp")))
                .metadata(Maps.asMap(rawMetadata))
                .create();
    }

    public static Candidate fromMapOrThrow(Map<String, ?> map) {
        return fromMap(map).orElseThrow(SUBJECT);
    }

    static Instant parseTimestamp(Object raw) {
        if (raw instanceof Instant i) return i;
        if (!(raw instanceof String s) || s.isBlank()) return null;
        try {
            return Instant.parse(s.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Candidate c)) return false;
        return id.equals(c.id)
                && Objects.equals(content, c.content)
                && Objects.equals(reasoning, c.reasoning)
                && Objects.equals(score, c.score)
                && Objects.equals(tokensUsed, c.tokensUsed)
                && Objects.equals(model, c.model)
                && Objects.equals(timestamp, c.timestamp)
                && metadata.equals(c.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, content, reasoning, score, tokensUsed, model, timestamp, metadata);
    }

    @Override
    public String toString() {
        return "Candidate{id=" + id + ", score=" + score + ", tokens=" + tokensUsed + '}';
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private String id;
        private String content;
        private String reasoning;
        private Double score;
        private Integer tokensUsed;
        private String model;
        private Instant timestamp;
        private boolean timestampSet;
        private Map<String, Object> metadata = Map.of();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder score(Double score) {
            this.score = score;
            return this;
        }

        public Builder tokensUsed(Integer tokensUsed) {
            this.tokensUsed = tokensUsed;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        /** Explicit timestamp; passing null keeps the candidate without one. */
        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            this.timestampSet = true;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        /** Validating factory: {@code invalid_candidate} on a non-finite score or negative token count. */
        public Outcome<Candidate> create() {
            if (score != null && !Double.isFinite(score)) return Outcome.failure(ErrorCode.INVALID_CANDIDATE);
            if (tokensUsed != null && tokensUsed < 0) return Outcome.failure(ErrorCode.INVALID_CANDIDATE);
            return Outcome.ok(new Candidate(this));
        }

        public Candidate build() {
            return create().orElseThrow(SUBJECT);
        }
    }
}
