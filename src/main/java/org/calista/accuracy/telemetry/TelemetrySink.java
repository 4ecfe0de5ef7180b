package org.calista.accuracy.telemetry;

/**
 * Fire-and-forget observability hook.
 *
 * Contracts:
 *  - emit must not block the caller for long (hand off to a queue if the backend is slow)
 *  - callers treat any exception from emit as a sink failure and swallow it
 */
@FunctionalInterface
public interface TelemetrySink {

    void emit(TelemetryEvent event);

    static TelemetrySink noop() {
        return event -> { };
    }
}
