package org.calista.accuracy.core;

import org.calista.accuracy.calibration.CalibrationGate;
import org.calista.accuracy.difficulty.impl.HeuristicDifficultyEstimator;
import org.calista.accuracy.similarity.Similarity;
import org.calista.accuracy.telemetry.LogFmt;
import org.calista.accuracy.telemetry.LoggingTelemetrySink;
import org.calista.accuracy.telemetry.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * AccuracyComposer — wires an {@link AccuracyConfig} into ready-to-use components.
 *
 * Components are built eagerly so config mistakes surface at startup. The composer owns the
 * heuristic estimator (and its executor): close the composer on shutdown.
 */
public final class AccuracyComposer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AccuracyComposer.class);

    private final AccuracyConfig config;
    private final TelemetrySink telemetry;
    private final CalibrationGate gate;
    private final HeuristicDifficultyEstimator difficultyEstimator;
    private final Similarity.Weights similarityWeights;

    public AccuracyComposer(AccuracyConfig config) {
        this(config, null);
    }

    /**
     * @param telemetryOverride sink to use instead of the configured one (tests, custom backends); may be null
     * @throws org.calista.accuracy.error.AccuracyException when the config cannot produce a valid gate or estimator
     */
    public AccuracyComposer(AccuracyConfig config, TelemetrySink telemetryOverride) {
        this.config = Objects.requireNonNull(config, "config");
        config.validate();

        this.telemetry = (telemetryOverride != null) ? telemetryOverride : buildTelemetry(config.telemetry);
        this.gate = CalibrationGate.fromConfig(config.gate, telemetry).orElseThrow("CalibrationGate");
        this.difficultyEstimator = HeuristicDifficultyEstimator.create(estimatorConfig(config.difficulty))
                .orElseThrow("HeuristicDifficultyEstimator");
        this.similarityWeights = Similarity.Weights.of(config.similarity.jaccardWeight, config.similarity.editWeight);

        logComposed();
    }

    public static AccuracyComposer withDefaults() {
        return new AccuracyComposer(AccuracyConfig.defaults());
    }

    private static TelemetrySink buildTelemetry(AccuracyConfig.Telemetry t) {
        if ("noop".equals(t.sink)) return TelemetrySink.noop();
        return LoggingTelemetrySink.atLevel(t.level);
    }

    private static HeuristicDifficultyEstimator.Config estimatorConfig(AccuracyConfig.Difficulty d) {
        HeuristicDifficultyEstimator.Config c = new HeuristicDifficultyEstimator.Config();
        c.lengthWeight = d.lengthWeight;
        c.complexityWeight = d.complexityWeight;
        c.domainWeight = d.domainWeight;
        c.questionWeight = d.questionWeight;
        c.timeoutMs = d.timeoutMs;

        LinkedHashMap<String, List<String>> custom = new LinkedHashMap<>();
        if (d.customIndicators != null) {
            for (Map.Entry<String, List<String>> e : d.customIndicators.entrySet()) {
                if (e.getKey() != null && e.getValue() != null) custom.put(e.getKey(), List.copyOf(e.getValue()));
            }
        }
        c.customIndicators = custom;
        return c;
    }

    private void logComposed() {
        if (!log.isInfoEnabled()) return;
        log.info("\n{}", LogFmt.box("Accuracy components", b -> b
                .kv("gate.high", gate.highThreshold)
                .kv("gate.low", gate.lowThreshold)
                .kv("gate.medium", gate.mediumAction.label())
                .kv("gate.lowAction", gate.lowAction.label())
                .kv("gate.telemetry", gate.emitTelemetry)
                .sep()
                .kv("difficulty.timeoutMs", config.difficulty.timeoutMs)
                .kv("difficulty.customDomains", config.difficulty.customIndicators.keySet())
                .sep()
                .kv("similarity", similarityWeights)
                .kv("telemetry.sink", telemetry.getClass().getSimpleName())));
    }

    public AccuracyConfig config() {
        return config;
    }

    public CalibrationGate gate() {
        return gate;
    }

    public HeuristicDifficultyEstimator difficultyEstimator() {
        return difficultyEstimator;
    }

    public TelemetrySink telemetry() {
        return telemetry;
    }

    public Similarity.Weights similarityWeights() {
        return similarityWeights;
    }

    @Override
    public void close() {
        difficultyEstimator.close();
        log.debug("AccuracyComposer closed");
    }
}
