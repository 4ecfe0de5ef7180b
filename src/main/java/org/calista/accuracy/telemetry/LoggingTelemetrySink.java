package org.calista.accuracy.telemetry;

import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Writes each event as one logfmt line through Log4j 2.
 *
 * The event name is pushed into the thread context ({@code event}) while the record is written,
 * so layouts can route or filter on it.
 */
public final class LoggingTelemetrySink implements TelemetrySink {

    private static final Logger log = LogManager.getLogger(LoggingTelemetrySink.class);

    private final Level level;

    public LoggingTelemetrySink() {
        this(Level.DEBUG);
    }

    public LoggingTelemetrySink(Level level) {
        this.level = Objects.requireNonNull(level, "level");
    }

    /** Parses a level name; unknown names mean DEBUG. */
    public static LoggingTelemetrySink atLevel(String levelName) {
        return new LoggingTelemetrySink(Level.toLevel(levelName, Level.DEBUG));
    }

    public Level level() {
        return level;
    }

    @Override
    public void emit(TelemetryEvent event) {
        if (event == null || !log.isEnabled(level)) return;
        try (final CloseableThreadContext.Instance ctc = CloseableThreadContext.put("event", event.name)) {
            log.log(level, LogFmt.line(event.name, event.measurements, event.tags));
        }
    }
}
