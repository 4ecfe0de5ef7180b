package org.calista.accuracy.difficulty.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.accuracy.difficulty.DifficultyEstimate;
import org.calista.accuracy.difficulty.DifficultyEstimator;
import org.calista.accuracy.difficulty.DifficultyLevel;
import org.calista.accuracy.error.ErrorCode;
import org.calista.accuracy.error.Outcome;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HeuristicDifficultyEstimator — rule-based difficulty estimation, no model call.
 *
 * <pre>
 * feature        weight  signal
 * length         0.25    character count buckets
 * complexity     0.30    average word length, special characters
 * domain         0.25    math / code / reasoning / creative indicators
 * question_type  0.20    why/how vs what/when
 * </pre>
 *
 * Feature extraction runs on an owned daemon executor and is bounded by {@link Config#timeoutMs}.
 * Close the estimator to release the executor (unless it was injected).
 */
public final class HeuristicDifficultyEstimator implements DifficultyEstimator, AutoCloseable {

    private static final Logger log = LogManager.getLogger(HeuristicDifficultyEstimator.class);

    public static final int MAX_QUERY_BYTES = 50_000;
    public static final long DEFAULT_TIMEOUT_MS = 5_000L;
    public static final long MIN_TIMEOUT_MS = 1_000L;
    public static final long MAX_TIMEOUT_MS = 30_000L;

    private static final Pattern SPECIAL = Pattern.compile("[^\\w\\s]");
    private static final Pattern NUMBER = Pattern.compile("\\b\\d+\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final List<String> MATH_INDICATORS = List.of(
            "~", "sum", "integral", "derivative", "equation", "formula",
            "+", "-", "*", "/", "^", "=", "<", ">", "≤", "≥",
            "calculate", "compute", "solve", "probability", "statistic",
            "algebra", "geometry", "trigonometry", "calculus");

    static final List<String> CODE_INDICATORS = List.of(
            "function", "class", "def ", "import", "return", "if ", "else", "for ", "while",
            "const", "let", "var", "print", "array",
            "()", "{}", "[]", "=>", "==", "!=", "&&", "||",
            "algorithm", "data structure", "recursion", "iteration", "compile", "execute", "debug");

    static final List<String> REASONING_INDICATORS = List.of(
            "explain", "why", "how", "analyze", "compare", "contrast", "evaluate", "assess",
            "justify", "reasoning", "logic", "relationship", "difference", "similarity", "cause");

    static final List<String> CREATIVE_INDICATORS = List.of(
            "write", "create", "generate", "story", "poem", "creative", "imagine", "invent",
            "design", "compose", "narrative");

    static final List<String> SIMPLE_QUESTION_WORDS = List.of(
            "what", "when", "where", "who", "which", "is", "are", "do", "does",
            "list", "name", "identify", "define", "state");

    private final Config config;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    private HeuristicDifficultyEstimator(Config config, ExecutorService executor) {
        this.config = config;
        this.ownsExecutor = (executor == null);
        this.executor = ownsExecutor ? createExecutor() : executor;
    }

    /**
     * Validating factory.
     *
     * @return {@code invalid_weights} when a weight is outside [0,1] or they do not sum to 1 (±0.01);
     *         {@code invalid_timeout} when the timeout is not in (0, 30000] ms
     */
    public static Outcome<HeuristicDifficultyEstimator> create(Config config) {
        return create(config, null);
    }

    /** Same as {@link #create(Config)} with an externally owned executor (not shut down on close). */
    public static Outcome<HeuristicDifficultyEstimator> create(Config config, ExecutorService executor) {
        Config c = (config == null) ? new Config() : config.copy();
        ErrorCode err = c.validate();
        if (err != null) return Outcome.failure(err);
        return Outcome.ok(new HeuristicDifficultyEstimator(c, executor));
    }

    public static HeuristicDifficultyEstimator of(Config config) {
        return create(config).orElseThrow("HeuristicDifficultyEstimator");
    }

    public static HeuristicDifficultyEstimator withDefaults() {
        return of(new Config());
    }

    public Config config() {
        return config.copy();
    }

    // ---------------------------------------------------------------------
    // Estimation
    // ---------------------------------------------------------------------

    @Override
    public Outcome<DifficultyEstimate> estimate(String query, Map<String, Object> context) {
        if (query == null) return Outcome.failure(ErrorCode.INVALID_QUERY);

        final String q = query.trim();
        if (q.isEmpty()) return Outcome.failure(ErrorCode.INVALID_QUERY);
        if (q.getBytes(StandardCharsets.UTF_8).length > MAX_QUERY_BYTES) return Outcome.failure(ErrorCode.QUERY_TOO_LONG);

        final long t0 = System.nanoTime();
        Future<Features> task = executor.submit(() -> extractFeatures(q));

        Features f;
        try {
            f = task.get(config.timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("HeuristicDifficulty: feature extraction timed out after {}ms (queryChars={})", config.timeoutMs, q.length());
            return Outcome.failure(ErrorCode.TIMEOUT);
        } catch (ExecutionException e) {
            log.warn("HeuristicDifficulty: feature extraction failed (queryChars={})", q.length(), e.getCause());
            return Outcome.failure(ErrorCode.FEATURE_EXTRACTION_FAILED);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            return Outcome.failure(ErrorCode.FEATURE_EXTRACTION_FAILED);
        }

        double score = score(f);
        DifficultyLevel level = DifficultyEstimate.toLevel(score);
        double confidence = confidence(f);

        LinkedHashMap<String, Object> meta = new LinkedHashMap<>();
        meta.put("method", "heuristic");
        meta.put("estimator", HeuristicDifficultyEstimator.class.getName());

        DifficultyEstimate estimate = DifficultyEstimate.builder()
                .level(level)
                .score(score)
                .confidence(confidence)
                .reasoning(reasoning(f, level))
                .features(f.toMap())
                .metadata(meta)
                .build();

        if (log.isDebugEnabled()) {
            log.debug("HeuristicDifficulty: level={} score={} conf={} len={} cx={} dom={} qt={} dtUs={}",
                    level.label(), fmt(score), fmt(confidence),
                    fmt(f.lengthScore), fmt(f.complexityScore), fmt(f.domainScore), fmt(f.questionScore),
                    (System.nanoTime() - t0) / 1_000L);
        }
        return Outcome.ok(estimate);
    }

    // ---------------------------------------------------------------------
    // Features
    // ---------------------------------------------------------------------

    Features extractFeatures(String query) {
        Features f = new Features();
        String lower = query.toLowerCase(Locale.ROOT);
        String[] words = WHITESPACE.split(query.trim());

        // length
        f.charCount = query.codePointCount(0, query.length());
        f.wordCount = words.length;
        f.lengthScore = lengthBucket(f.charCount);

        // complexity
        double avgWordLen = averageWordLength(words);
        f.avgWordLength = Math.round(avgWordLen * 100.0) / 100.0;
        f.specialCharCount = count(SPECIAL, query);
        f.numberCount = count(NUMBER, query);
        f.complexityScore = complexityBucket(avgWordLen, f.specialCharCount);

        // domain
        int math = countIndicators(lower, MATH_INDICATORS);
        int code = countIndicators(lower, CODE_INDICATORS);
        int reasoning = countIndicators(lower, REASONING_INDICATORS);
        int creative = countIndicators(lower, CREATIVE_INDICATORS);

        int max = Math.max(Math.max(math, code), Math.max(reasoning, creative));
        if (max >= 3) f.domainScore = 1.0;
        else if (max >= 2) f.domainScore = 0.7;
        else if (max >= 1) f.domainScore = 0.4;
        else f.domainScore = 0.0;

        if (math > 0) f.domains.add("math");
        if (code > 0) f.domains.add("code");
        if (reasoning > 0) f.domains.add("reasoning");
        if (creative > 0) f.domains.add("creative");

        for (Map.Entry<String, List<String>> e : config.customIndicators.entrySet()) {
            f.customDomains.put(e.getKey(), countIndicators(lower, e.getValue()));
        }

        // question type
        f.hasQuestionMark = query.endsWith("?");
        f.simpleIndicatorCount = countIndicators(lower, SIMPLE_QUESTION_WORDS);
        f.reasoningIndicatorCount = reasoning;

        if (f.reasoningIndicatorCount >= 2) f.questionScore = 1.0;
        else if (f.reasoningIndicatorCount >= 1) f.questionScore = 0.6;
        else if (f.simpleIndicatorCount >= 2) f.questionScore = 0.2;
        else if (f.hasQuestionMark) f.questionScore = 0.3;
        else f.questionScore = 0.5;

        return f;
    }

    private static double lengthBucket(int chars) {
        if (chars < 50) return 0.0;
        if (chars < 100) return 0.2;
        if (chars < 200) return 0.5;
        if (chars < 300) return 0.7;
        return 1.0;
    }

    private static double complexityBucket(double avgWordLen, int special) {
        if (avgWordLen < 4 && special < 2) return 0.0;
        if (avgWordLen < 5 && special < 5) return 0.3;
        if (avgWordLen < 6 && special < 10) return 0.5;
        if (avgWordLen < 7 || special < 15) return 0.7;
        return 1.0;
    }

    private static double averageWordLength(String[] words) {
        int n = 0;
        long total = 0;
        for (String w : words) {
            if (w.isEmpty()) continue;
            n++;
            total += w.codePointCount(0, w.length());
        }
        return (n == 0) ? 0.0 : (double) total / (double) n;
    }

    private static int count(Pattern p, String text) {
        Matcher m = p.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    private static int countIndicators(String lowerQuery, List<String> indicators) {
        if (indicators == null) return 0;
        int n = 0;
        for (String ind : indicators) {
            if (ind != null && !ind.isEmpty() && lowerQuery.contains(ind.toLowerCase(Locale.ROOT))) n++;
        }
        return n;
    }

    // ---------------------------------------------------------------------
    // Scoring
    // ---------------------------------------------------------------------

    private double score(Features f) {
        double total = f.lengthScore * config.lengthWeight
                + f.complexityScore * config.complexityWeight
                + f.domainScore * config.domainWeight
                + f.questionScore * config.questionWeight;
        return Math.min(Math.max(total, 0.0), 1.0);
    }

    /** Agreement between features: low variance means the signals point the same way. */
    static double confidence(Features f) {
        double[] s = {f.lengthScore, f.complexityScore, f.domainScore, f.questionScore};
        double avg = 0.0;
        for (double x : s) avg += x;
        avg /= s.length;

        double var = 0.0;
        for (double x : s) var += (x - avg) * (x - avg);
        var /= s.length;

        if (var < 0.05) return 0.95;
        if (var < 0.1) return 0.85;
        if (var < 0.2) return 0.7;
        return 0.6;
    }

    static String reasoning(Features f, DifficultyLevel level) {
        String domain = f.domains.isEmpty() ? "general domain" : String.join("/", f.domains) + " domain";
        String length = f.lengthScore < 0.3 ? "short query" : (f.lengthScore < 0.7 ? "medium-length query" : "long query");
        String question = f.questionScore < 0.3 ? "simple question" : (f.questionScore < 0.7 ? "moderate question" : "complex question");
        String base = domain + ", " + length + ", " + question;

        switch (level) {
            case EASY:
                return "Simple: " + base;
            case HARD:
                return "Complex: " + base + " with multiple factors";
            default:
                return "Moderate difficulty: " + base;
        }
    }

    private static String fmt(double x) {
        return String.format(Locale.ROOT, "%.3f", x);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    private static ExecutorService createExecutor() {
        final AtomicLong tid = new AtomicLong(1);
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "difficulty-heuristic-" + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        return Executors.newCachedThreadPool(tf);
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            log.debug("HeuristicDifficulty.close(): executor is externally owned; skipping shutdown");
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1_000L, TimeUnit.MILLISECONDS)) executor.shutdownNow();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    // ---------------------------------------------------------------------
    // Types
    // ---------------------------------------------------------------------

    /** Mutable while extracting, converted to an immutable map for the estimate. */
    static final class Features {
        int charCount;
        int wordCount;
        double lengthScore;

        double avgWordLength;
        int specialCharCount;
        int numberCount;
        double complexityScore;

        final List<String> domains = new ArrayList<>(4);
        final Map<String, Object> customDomains = new LinkedHashMap<>();
        double domainScore;

        boolean hasQuestionMark;
        int simpleIndicatorCount;
        int reasoningIndicatorCount;
        double questionScore;

        Map<String, Object> toMap() {
            LinkedHashMap<String, Object> length = new LinkedHashMap<>();
            length.put("score", lengthScore);
            length.put("char_count", charCount);
            length.put("word_count", wordCount);

            LinkedHashMap<String, Object> complexity = new LinkedHashMap<>();
            complexity.put("score", complexityScore);
            complexity.put("avg_word_length", avgWordLength);
            complexity.put("special_char_count", specialCharCount);
            complexity.put("number_count", numberCount);

            LinkedHashMap<String, Object> domain = new LinkedHashMap<>();
            domain.put("score", domainScore);
            domain.put("domains", List.copyOf(domains));
            domain.put("custom", Map.copyOf(customDomains));

            LinkedHashMap<String, Object> question = new LinkedHashMap<>();
            question.put("score", questionScore);
            question.put("has_question_mark", hasQuestionMark);
            question.put("simple_indicator_count", simpleIndicatorCount);
            question.put("reasoning_indicator_count", reasoningIndicatorCount);

            LinkedHashMap<String, Object> m = new LinkedHashMap<>();
            m.put("length", length);
            m.put("complexity", complexity);
            m.put("domain", domain);
            m.put("question_type", question);
            return m;
        }
    }

    /**
     * Estimator knobs. Weights must each lie in [0,1] and sum to 1 (±0.01).
     */
    public static final class Config {
        public double lengthWeight = 0.25;
        public double complexityWeight = 0.30;
        public double domainWeight = 0.25;
        public double questionWeight = 0.20;

        /** Extra domains: name -> indicator substrings. Counted and reported, not scored. */
        public Map<String, List<String>> customIndicators = Map.of();

        public long timeoutMs = DEFAULT_TIMEOUT_MS;

        ErrorCode validate() {
            double[] w = {lengthWeight, complexityWeight, domainWeight, questionWeight};
            double sum = 0.0;
            for (double x : w) {
                if (!Double.isFinite(x) || x < 0.0 || x > 1.0) return ErrorCode.INVALID_WEIGHTS;
                sum += x;
            }
            if (Math.abs(sum - 1.0) > 0.01) return ErrorCode.INVALID_WEIGHTS;
            if (timeoutMs < MIN_TIMEOUT_MS || timeoutMs > MAX_TIMEOUT_MS) return ErrorCode.INVALID_TIMEOUT;
            if (customIndicators == null) customIndicators = Map.of();
            return null;
        }

        Config copy() {
            Config c = new Config();
            c.lengthWeight = lengthWeight;
            c.complexityWeight = complexityWeight;
            c.domainWeight = domainWeight;
            c.questionWeight = questionWeight;
            c.timeoutMs = timeoutMs;

            LinkedHashMap<String, List<String>> ci = new LinkedHashMap<>();
            if (customIndicators != null) {
                for (Map.Entry<String, List<String>> e : customIndicators.entrySet()) {
                    if (e.getKey() == null || e.getValue() == null) continue;
                    ci.put(e.getKey(), List.copyOf(e.getValue()));
                }
            }
            c.customIndicators = ci;
            return c;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) return true;
            if (!(other instanceof Config c)) return false;
            return Double.compare(lengthWeight, c.lengthWeight) == 0
                    && Double.compare(complexityWeight, c.complexityWeight) == 0
                    && Double.compare(domainWeight, c.domainWeight) == 0
                    && Double.compare(questionWeight, c.questionWeight) == 0
                    && timeoutMs == c.timeoutMs
                    && Objects.equals(customIndicators, c.customIndicators);
        }

        @Override
        public int hashCode() {
            return Objects.hash(lengthWeight, complexityWeight, domainWeight, questionWeight, timeoutMs, customIndicators);
        }
    }
}
