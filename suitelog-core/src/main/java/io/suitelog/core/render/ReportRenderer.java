package io.suitelog.core.render;

import io.suitelog.api.record.LogRecord;
import io.suitelog.api.suite.SuiteOutcome;
import io.suitelog.api.suite.SuiteReport;
import io.suitelog.api.suite.TestStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns aggregated suites into CI text and decides the verdict.
 * <p>
 * A run succeeds only if at least one suite was found and every suite passed. Input
 * that could not be read to its end always fails.
 * Output is a pure function of the report, so rendering the same report twice
 * produces identical text.
 */
public final class ReportRenderer {

    public static final String NO_RESULTS = "No test results found";

    private static final Pattern NON_KEY_CHAR = Pattern.compile("[^A-Za-z0-9_]");

    private ReportRenderer() {}

    public static RenderedReport render(SuiteReport report) {
        return render(report, true);
    }

    /**
     * @param sourceComplete false when the input could not be read to its end; the run
     *                       then fails whatever the suites found so far say
     */
    public static RenderedReport render(SuiteReport report, boolean sourceComplete) {
        if (report.isEmpty()) {
            return new RenderedReport(NO_RESULTS, List.of(), false);
        }

        List<SuiteDetail> details = new ArrayList<>();
        for (SuiteOutcome suite : report.suites()) {
            if (!suite.passed()) {
                details.add(detail(suite));
            }
        }
        boolean success = sourceComplete && details.isEmpty();
        return new RenderedReport(summary(report), details, success);
    }

    public static String summary(SuiteReport report) {
        return report.suites().stream()
                .map(ReportRenderer::summaryLine)
                .collect(Collectors.joining("\n"));
    }

    /**
     * {@code <name>: <Status>[ (<resultSummary>)]}
     */
    public static String summaryLine(SuiteOutcome suite) {
        String line = suite.name() + ": " + suite.status().label();
        if (suite.resultSummary() != null && !suite.resultSummary().isEmpty()) {
            line += " (" + suite.resultSummary() + ")";
        }
        return line;
    }

    /**
     * Replace every character outside {@code [A-Za-z0-9_]} with {@code _}.
     * Distinct names may map to the same key.
     */
    public static String sanitizeKey(String name) {
        return NON_KEY_CHAR.matcher(name).replaceAll("_");
    }

    public static String testListing(Map<String, TestStatus> tests) {
        return new TreeMap<>(tests).entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue().label())
                .collect(Collectors.joining("\n"));
    }

    public static String logDump(List<LogRecord> logs) {
        return logs.stream()
                .map(ReportRenderer::logLine)
                .collect(Collectors.joining("\n"));
    }

    public static String logLine(LogRecord record) {
        String kind = record.kind() == null ? "UNKNOWN" : record.kind().toUpperCase(Locale.ROOT);
        String location = record.location() == null || record.location().isBlank() ? "N/A" : record.location();
        String line = "Type: " + kind + " | Location: " + location + " | Text:";
        // text is kept verbatim, including trailing pipes
        return record.text().isBlank() ? line : line + " " + record.text();
    }

    private static SuiteDetail detail(SuiteOutcome suite) {
        return new SuiteDetail(
                sanitizeKey(suite.name()),
                suite.name(),
                suite.status(),
                suite.resultSummary() == null ? "" : suite.resultSummary(),
                testListing(suite.individualTests()),
                logDump(suite.logs()));
    }
}
