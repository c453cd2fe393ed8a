package io.suitelog.api.record;

import java.util.Objects;

/**
 * A single console message captured from the browser test harness.
 *
 * @param kind     console category as reported by the harness (log, warning, error...), may be null
 * @param text     message body
 * @param location origin reference for display, may be null
 */
public record LogRecord(
        String kind,
        String text,
        String location
) {

    public LogRecord {
        Objects.requireNonNull(text, "text");
    }

    public static LogRecord of(String kind, String text) {
        return new LogRecord(kind, text, null);
    }
}
