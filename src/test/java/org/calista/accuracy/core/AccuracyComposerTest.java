package org.calista.accuracy.core;

import org.calista.accuracy.calibration.RoutingAction;
import org.calista.accuracy.calibration.RoutingResult;
import org.calista.accuracy.candidate.Candidate;
import org.calista.accuracy.difficulty.DifficultyLevel;
import org.calista.accuracy.similarity.Similarity;
import org.calista.accuracy.telemetry.LoggingTelemetrySink;
import org.calista.accuracy.telemetry.TelemetryEvent;
import org.calista.accuracy.telemetry.TelemetrySink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AccuracyComposerTest {

    @Test
    @DisplayName("defaults wire the logging sink and the default gate")
    void defaults() {
        try (AccuracyComposer composer = AccuracyComposer.withDefaults()) {
            assertThat(composer.telemetry()).isInstanceOf(LoggingTelemetrySink.class);
            assertThat(composer.gate().mediumAction).isEqualTo(RoutingAction.WITH_VERIFICATION);
            assertThat(composer.similarityWeights()).isEqualTo(Similarity.Weights.EQUAL);
        }
    }

    @Test
    @DisplayName("configured gate routes through the override sink")
    void configuredGate() {
        AccuracyConfig cfg = new AccuracyConfig();
        cfg.gate.highThreshold = 0.8;
        cfg.gate.lowThreshold = 0.5;
        cfg.gate.lowAction = "escalate";
        List<TelemetryEvent> events = new ArrayList<>();
        TelemetrySink sink = events::add;

        try (AccuracyComposer composer = new AccuracyComposer(cfg, sink)) {
            RoutingResult r = composer.gate().route(Candidate.of("maybe"), 0.45).value();

            assertThat(r.isEscalated()).isTrue();
            assertThat(events).hasSize(1);
            assertThat(events.get(0).tags).containsEntry("action", "escalate");
        }
    }

    @Test
    @DisplayName("noop sink and difficulty settings come from config")
    void difficulty() {
        AccuracyConfig cfg = new AccuracyConfig();
        cfg.telemetry.sink = "noop";
        cfg.difficulty.timeoutMs = 2_000L;
        cfg.difficulty.customIndicators.put("legal", List.of("contract"));

        try (AccuracyComposer composer = new AccuracyComposer(cfg)) {
            assertThat(composer.telemetry()).isNotInstanceOf(LoggingTelemetrySink.class);
            assertThat(composer.difficultyEstimator().config().timeoutMs).isEqualTo(2_000L);
            assertThat(composer.difficultyEstimator().config().customIndicators).containsKey("legal");
            assertThat(composer.difficultyEstimator().estimate("What is 2+2?", Map.of()).value().level)
                    .isEqualTo(DifficultyLevel.EASY);
        }
    }

    @Test
    @DisplayName("invalid values are normalized before wiring")
    void normalized() {
        AccuracyConfig cfg = new AccuracyConfig();
        cfg.gate.highThreshold = 0.2;
        cfg.gate.mediumAction = "bogus";

        try (AccuracyComposer composer = new AccuracyComposer(cfg)) {
            assertThat(composer.gate().highThreshold).isEqualTo(0.7);
            assertThat(composer.gate().mediumAction).isEqualTo(RoutingAction.WITH_VERIFICATION);
        }
    }
}
