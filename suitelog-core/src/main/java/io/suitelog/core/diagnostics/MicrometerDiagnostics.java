package io.suitelog.core.diagnostics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.suitelog.api.diagnostics.Diagnostic;
import io.suitelog.api.diagnostics.DiagnosticKind;
import io.suitelog.api.diagnostics.DiagnosticListener;
import io.suitelog.api.suite.SuiteOutcome;
import io.suitelog.api.suite.SuiteReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Default diagnostic listener using Micrometer.
 * Logs each diagnostic, keeps it for the final result and counts it per kind.
 */
public class MicrometerDiagnostics implements DiagnosticListener {

    private static final Logger log = LoggerFactory.getLogger(MicrometerDiagnostics.class);

    static final String DIAGNOSTICS_METRIC = "suitelog.diagnostics";
    static final String SUITES_METRIC = "suitelog.suites";

    private final MeterRegistry registry;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public MicrometerDiagnostics() {
        this(new SimpleMeterRegistry());
    }

    public MicrometerDiagnostics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void report(Diagnostic diagnostic) {
        log.warn("{}", diagnostic);
        diagnostics.add(diagnostic);
        Counter.builder(DIAGNOSTICS_METRIC)
                .tag("kind", diagnostic.kind().name())
                .register(registry)
                .increment();
    }

    /**
     * Count the finalized suites of a report by status.
     */
    public void recordReport(SuiteReport report) {
        for (SuiteOutcome suite : report.suites()) {
            Counter.builder(SUITES_METRIC)
                    .tag("status", suite.status().name())
                    .register(registry)
                    .increment();
        }
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public long count(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).count();
    }

    public MeterRegistry registry() {
        return registry;
    }
}
