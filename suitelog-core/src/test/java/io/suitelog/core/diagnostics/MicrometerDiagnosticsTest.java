package io.suitelog.core.diagnostics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.suitelog.api.diagnostics.Diagnostic;
import io.suitelog.api.diagnostics.DiagnosticKind;
import io.suitelog.api.suite.SuiteOutcome;
import io.suitelog.api.suite.SuiteReport;
import io.suitelog.api.suite.SuiteStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MicrometerDiagnosticsTest {

    private SimpleMeterRegistry registry;
    private MicrometerDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        diagnostics = new MicrometerDiagnostics(registry);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    // --- Construction ---

    @Test
    void shouldCreateWithDefaultRegistry() {
        assertThat(new MicrometerDiagnostics().registry()).isNotNull();
    }

    @Test
    void shouldExposeProvidedRegistry() {
        assertThat(diagnostics.registry()).isSameAs(registry);
    }

    // --- report ---

    @Test
    void shouldKeepDiagnosticsInOrder() {
        diagnostics.report(DiagnosticKind.RECORD_PARSE_ERROR, "Line 3 skipped");
        diagnostics.report(DiagnosticKind.STRUCTURAL_ANOMALY, "Suite 'X' finished but was never started");

        assertThat(diagnostics.diagnostics()).containsExactly(
                new Diagnostic(DiagnosticKind.RECORD_PARSE_ERROR, "Line 3 skipped"),
                new Diagnostic(DiagnosticKind.STRUCTURAL_ANOMALY, "Suite 'X' finished but was never started"));
    }

    @Test
    void shouldCountDiagnosticsPerKind() {
        diagnostics.report(DiagnosticKind.RECORD_PARSE_ERROR, "Line 1 skipped");
        diagnostics.report(DiagnosticKind.RECORD_PARSE_ERROR, "Line 2 skipped");
        diagnostics.report(DiagnosticKind.NO_RESULTS, "nothing");

        Counter parseErrors = registry.find("suitelog.diagnostics")
                .tag("kind", "RECORD_PARSE_ERROR")
                .counter();
        assertThat(parseErrors).isNotNull();
        assertThat(parseErrors.count()).isEqualTo(2.0);
        assertThat(diagnostics.count(DiagnosticKind.RECORD_PARSE_ERROR)).isEqualTo(2);
        assertThat(diagnostics.count(DiagnosticKind.NO_RESULTS)).isEqualTo(1);
        assertThat(diagnostics.count(DiagnosticKind.SINK_WRITE_ERROR)).isZero();
    }

    @Test
    void diagnosticsViewShouldBeReadOnly() {
        diagnostics.report(DiagnosticKind.NO_RESULTS, "nothing");

        assertThatThrownBy(() -> diagnostics.diagnostics().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    // --- recordReport ---

    @Test
    void shouldCountSuitesByStatus() {
        Map<String, SuiteOutcome> suites = new LinkedHashMap<>();
        suites.put("A", new SuiteOutcome("A", SuiteStatus.PASSED, "Passed (1/1)", null, Map.of(), List.of()));
        suites.put("B", new SuiteOutcome("B", SuiteStatus.PASSED, "Passed (1/1)", null, Map.of(), List.of()));
        suites.put("C", new SuiteOutcome("C", SuiteStatus.INCOMPLETE, null, null, Map.of(), List.of()));

        diagnostics.recordReport(new SuiteReport(suites));

        assertThat(registry.find("suitelog.suites").tag("status", "PASSED").counter().count()).isEqualTo(2.0);
        assertThat(registry.find("suitelog.suites").tag("status", "INCOMPLETE").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("suitelog.suites").tag("status", "FAILED").counter()).isNull();
    }
}
