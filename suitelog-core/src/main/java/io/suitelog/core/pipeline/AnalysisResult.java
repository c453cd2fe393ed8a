package io.suitelog.core.pipeline;

import io.suitelog.api.diagnostics.Diagnostic;
import io.suitelog.api.suite.SuiteReport;
import io.suitelog.core.render.RenderedReport;

import java.util.List;

/**
 * Outcome of one {@link LogAnalysis} run.
 */
public record AnalysisResult(
        SuiteReport report,
        RenderedReport rendered,
        List<Diagnostic> diagnostics
) {

    public AnalysisResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public int exitCode() {
        return rendered.exitCode();
    }

    public boolean success() {
        return rendered.success();
    }
}
