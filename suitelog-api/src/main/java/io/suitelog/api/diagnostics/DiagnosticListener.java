package io.suitelog.api.diagnostics;

/**
 * Receives diagnostics from the pipeline stages.
 * Default implementation logs and counts them with Micrometer.
 */
@FunctionalInterface
public interface DiagnosticListener {

    /**
     * A listener that drops everything.
     */
    DiagnosticListener NONE = diagnostic -> {};

    void report(Diagnostic diagnostic);

    default void report(DiagnosticKind kind, String message) {
        report(new Diagnostic(kind, message));
    }
}
