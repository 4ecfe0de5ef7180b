package org.calista.accuracy.telemetry;

import org.calista.accuracy.core.Maps;

import java.util.Map;
import java.util.Objects;

/**
 * One observability record: a dotted event name, numeric measurements and descriptive tags.
 */
public final class TelemetryEvent {

    /** Emitted once per {@code CalibrationGate.route} call. */
    public static final String CALIBRATION_ROUTE = "accuracy.calibration.route";

    public final String name;
    public final Map<String, Object> measurements;
    public final Map<String, Object> tags;

    public TelemetryEvent(String name, Map<String, ?> measurements, Map<String, ?> tags) {
        this.name = Objects.requireNonNull(name, "name");
        this.measurements = Maps.copyOf(measurements);
        this.tags = Maps.copyOf(tags);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof TelemetryEvent e)) return false;
        return name.equals(e.name) && measurements.equals(e.measurements) && tags.equals(e.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, measurements, tags);
    }

    @Override
    public String toString() {
        return LogFmt.line(name, measurements, tags);
    }
}
