package io.suitelog.api.diagnostics;

import java.util.Objects;

/**
 * A recoverable problem reported by one of the pipeline stages.
 */
public record Diagnostic(DiagnosticKind kind, String message) {

    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
