package org.calista.accuracy.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.accuracy.calibration.RoutingAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * AccuracyConfig — plain POJO config:
 * - defaults live in field initializers
 * - loadOrCreate() writes a default file when it is missing or blank
 * - validate() normalizes out-of-range values back to defaults
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AccuracyConfig {

    private static final Logger log = LoggerFactory.getLogger(AccuracyConfig.class);

    /** Classpath resource consulted by {@link #defaults()}. */
    public static final String DEFAULTS_RESOURCE = "accuracy-defaults.json";

    public Gate gate = new Gate();
    public Difficulty difficulty = new Difficulty();
    public Similarity similarity = new Similarity();
    public Telemetry telemetry = new Telemetry();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Gate {
        public double highThreshold = Thresholds.CALIBRATION_HIGH;
        public double lowThreshold = Thresholds.CALIBRATION_LOW;

        /** Action label for the medium band (with_verification, with_citations, abstain, escalate, direct). */
        public String mediumAction = "with_verification";

        /** Action label for the low band. */
        public String lowAction = "abstain";

        public boolean emitTelemetry = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Difficulty {
        public double lengthWeight = 0.25;
        public double complexityWeight = 0.30;
        public double domainWeight = 0.25;
        public double questionWeight = 0.20;

        /** Feature extraction budget per query, 1 000 to 30 000 ms. */
        public long timeoutMs = 5_000L;

        /** Extra domain name -> indicator substrings. */
        public Map<String, List<String>> customIndicators = new LinkedHashMap<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Similarity {
        public double jaccardWeight = 0.5;
        public double editWeight = 0.5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Telemetry {
        /** "logging" or "noop". */
        public String sink = "logging";

        /** Log4j level name used by the logging sink. */
        public String level = "DEBUG";
    }

    // -------------------- Load / Create --------------------

    /**
     * Loads config. If the file is missing (or blank) a default one is created and written to disk.
     */
    public static AccuracyConfig loadOrCreate(Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = Files.readString(configFile, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            AccuracyConfig created = new AccuracyConfig();
            created.validate();
            writePretty(configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            AccuracyConfig created = new AccuracyConfig();
            created.validate();
            writePretty(configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        AccuracyConfig cfg = mapper.readValue(json, AccuracyConfig.class);
        if (cfg == null) cfg = new AccuracyConfig();

        cfg.validate();
        return cfg;
    }

    /** Reads and validates a config from a stream (not closed). */
    public static AccuracyConfig load(InputStream in, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(mapper, "mapper");

        AccuracyConfig cfg = mapper.readValue(in, AccuracyConfig.class);
        if (cfg == null) cfg = new AccuracyConfig();
        cfg.validate();
        return cfg;
    }

    /**
     * Classpath defaults ({@value #DEFAULTS_RESOURCE}); falls back to field defaults when the resource
     * is absent or unreadable.
     */
    public static AccuracyConfig defaults() {
        ObjectMapper mapper = AccuracyJson.defaultMapper();
        try (InputStream in = AccuracyConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) return load(in, mapper);
            log.debug("No {} on classpath, using built-in defaults", DEFAULTS_RESOURCE);
        } catch (IOException e) {
            log.warn("Failed to read {} from classpath, using built-in defaults: {}", DEFAULTS_RESOURCE, e.toString());
        }
        AccuracyConfig cfg = new AccuracyConfig();
        cfg.validate();
        return cfg;
    }

    /** Rewrites the config on disk (pretty JSON). */
    public static void save(Path configFile, ObjectMapper mapper, AccuracyConfig cfg) throws IOException {
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(configFile, mapper, cfg);
    }

    private static void writePretty(Path configFile, ObjectMapper mapper, AccuracyConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(configFile, out + System.lineSeparator(), StandardCharsets.UTF_8);
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (gate == null) gate = new Gate();
        if (!Thresholds.isUnitInterval(gate.highThreshold)) gate.highThreshold = Thresholds.CALIBRATION_HIGH;
        if (!Thresholds.isUnitInterval(gate.lowThreshold)) gate.lowThreshold = Thresholds.CALIBRATION_LOW;
        if (!(gate.highThreshold - gate.lowThreshold > Thresholds.FLOAT_EPSILON)) {
            log.warn("gate thresholds high={} low={} are not ordered. Falling back to {}/{}",
                    gate.highThreshold, gate.lowThreshold, Thresholds.CALIBRATION_HIGH, Thresholds.CALIBRATION_LOW);
            gate.highThreshold = Thresholds.CALIBRATION_HIGH;
            gate.lowThreshold = Thresholds.CALIBRATION_LOW;
        }
        gate.mediumAction = normalizeAction(gate.mediumAction, "with_verification", "gate.mediumAction");
        gate.lowAction = normalizeAction(gate.lowAction, "abstain", "gate.lowAction");

        if (difficulty == null) difficulty = new Difficulty();
        if (!weightsValid(difficulty)) {
            log.warn("difficulty weights {}/{}/{}/{} must lie in [0,1] and sum to 1. Falling back to defaults",
                    difficulty.lengthWeight, difficulty.complexityWeight, difficulty.domainWeight, difficulty.questionWeight);
            Difficulty d = new Difficulty();
            difficulty.lengthWeight = d.lengthWeight;
            difficulty.complexityWeight = d.complexityWeight;
            difficulty.domainWeight = d.domainWeight;
            difficulty.questionWeight = d.questionWeight;
        }
        if (difficulty.timeoutMs < 1_000L || difficulty.timeoutMs > 30_000L) difficulty.timeoutMs = 5_000L;
        if (difficulty.customIndicators == null) difficulty.customIndicators = new LinkedHashMap<>();

        if (similarity == null) similarity = new Similarity();
        if (!Double.isFinite(similarity.jaccardWeight) || similarity.jaccardWeight < 0.0) similarity.jaccardWeight = 0.5;
        if (!Double.isFinite(similarity.editWeight) || similarity.editWeight < 0.0) similarity.editWeight = 0.5;
        if (!(similarity.jaccardWeight + similarity.editWeight > 0.0)) {
            similarity.jaccardWeight = 0.5;
            similarity.editWeight = 0.5;
        }

        if (telemetry == null) telemetry = new Telemetry();
        if (telemetry.sink == null || telemetry.sink.isBlank()) telemetry.sink = "logging";
        telemetry.sink = telemetry.sink.trim().toLowerCase(Locale.ROOT);
        if (!"logging".equals(telemetry.sink) && !"noop".equals(telemetry.sink)) {
            log.warn("Unknown telemetry.sink '{}'. Falling back to logging", telemetry.sink);
            telemetry.sink = "logging";
        }
        if (telemetry.level == null || telemetry.level.isBlank()) telemetry.level = "DEBUG";
    }

    private static String normalizeAction(String raw, String def, String field) {
        if (raw == null || raw.isBlank()) return def;
        String s = raw.trim().toLowerCase(Locale.ROOT);
        if (RoutingAction.fromLabel(s).isEmpty()) {
            log.warn("Unknown {} '{}'. Falling back to {}", field, raw, def);
            return def;
        }
        return s;
    }

    private static boolean weightsValid(Difficulty d) {
        double[] w = {d.lengthWeight, d.complexityWeight, d.domainWeight, d.questionWeight};
        double sum = 0.0;
        for (double x : w) {
            if (!Thresholds.isUnitInterval(x)) return false;
            sum += x;
        }
        return Math.abs(sum - 1.0) <= 0.01;
    }
}
