package io.suitelog.core.pipeline;

import io.suitelog.api.config.AnalyzerConfig;
import io.suitelog.api.diagnostics.DiagnosticKind;
import io.suitelog.api.output.OutputSink;
import io.suitelog.api.record.RecordBatch;
import io.suitelog.api.record.RecordReader;
import io.suitelog.api.report.ReportGenerationException;
import io.suitelog.api.report.ReportGenerator;
import io.suitelog.api.suite.SuiteReport;
import io.suitelog.core.aggregate.SuiteAggregator;
import io.suitelog.core.diagnostics.MicrometerDiagnostics;
import io.suitelog.core.output.ConsoleReporter;
import io.suitelog.core.output.GithubOutputSink;
import io.suitelog.core.reader.JsonLinesRecordReader;
import io.suitelog.core.render.RenderedReport;
import io.suitelog.core.render.ReportRenderer;
import io.suitelog.core.report.HtmlReportGenerator;
import io.suitelog.core.report.JsonReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Runs one complete analysis: read the harness log, aggregate suites, render the
 * verdict, and publish it to the console, the CI sink and any configured report files.
 * <p>
 * Usage:
 * <pre>{@code
 * var config = AnalyzerConfig.fromEnvironment(System.getenv())
 *     .inputPath("post_data.log");
 *
 * AnalysisResult result = new LogAnalysis(config).run();
 * System.exit(result.exitCode());
 * }</pre>
 * Every problem along the way becomes a diagnostic. The exit code depends on the
 * suites found, and a log that could not be read to its end always fails the run.
 */
public class LogAnalysis {

    private static final Logger log = LoggerFactory.getLogger(LogAnalysis.class);

    private final AnalyzerConfig config;
    private final MicrometerDiagnostics diagnostics;
    private final PrintStream console;

    public LogAnalysis(AnalyzerConfig config) {
        this(config, new MicrometerDiagnostics(), System.out);
    }

    public LogAnalysis(AnalyzerConfig config, MicrometerDiagnostics diagnostics, PrintStream console) {
        this.config = config;
        this.diagnostics = diagnostics;
        this.console = console;
    }

    public AnalysisResult run() {
        log.info("Analysing test log {}", config.inputPath().toAbsolutePath());

        RecordReader reader = new JsonLinesRecordReader(diagnostics);
        RecordBatch batch = reader.read(config.inputPath());

        SuiteReport report = SuiteAggregator.aggregate(batch, diagnostics);
        if (report.isEmpty()) {
            diagnostics.report(DiagnosticKind.NO_RESULTS, ReportRenderer.NO_RESULTS + " in " + config.inputPath());
        }
        diagnostics.recordReport(report);

        RenderedReport rendered = ReportRenderer.render(report, batch.sourceFound());
        new ConsoleReporter(console, config.groupTitle()).print(report, rendered.success());

        try (OutputSink sink = new GithubOutputSink(config.outputPath(), diagnostics)) {
            rendered.emitTo(sink);
        }

        if (config.htmlReportPath() != null) {
            writeReport(new HtmlReportGenerator(), report, rendered, config.htmlReportPath());
        }
        if (config.jsonReportPath() != null) {
            writeReport(new JsonReportGenerator(), report, rendered, config.jsonReportPath());
        }

        log.info("{} suites analysed, run {}", report.size(), rendered.success() ? "passed" : "failed");
        return new AnalysisResult(report, rendered, diagnostics.diagnostics());
    }

    public MicrometerDiagnostics diagnostics() {
        return diagnostics;
    }

    private void writeReport(ReportGenerator generator, SuiteReport report, RenderedReport rendered, Path path) {
        try {
            generator.generate(report, rendered.success(), path);
        } catch (ReportGenerationException e) {
            log.debug("{} report failed", generator.format(), e);
            diagnostics.report(DiagnosticKind.REPORT_WRITE_ERROR,
                    generator.format() + " report not written: " + e.getMessage());
        }
    }
}
