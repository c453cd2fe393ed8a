package io.suitelog.core.output;

import io.suitelog.api.suite.SuiteOutcome;
import io.suitelog.api.suite.SuiteReport;
import io.suitelog.core.render.ReportRenderer;

import java.io.PrintStream;

/**
 * Prints suite results in GitHub Actions workflow command format:
 * a collapsible {@code ::group::} with one block per suite, followed by an
 * {@code ::error::} annotation when the run failed.
 */
public class ConsoleReporter {

    static final String SEPARATOR = "-".repeat(30);

    private final PrintStream out;
    private final String groupTitle;

    public ConsoleReporter(PrintStream out, String groupTitle) {
        this.out = out;
        this.groupTitle = groupTitle;
    }

    public void print(SuiteReport report, boolean success) {
        out.println("::group::" + groupTitle);
        if (report.isEmpty()) {
            out.println(ReportRenderer.NO_RESULTS);
        }
        for (SuiteOutcome suite : report.suites()) {
            out.println("Suite: " + suite.name());
            out.println("Status: " + suite.status().label());
            if (suite.counts() != null) {
                out.println("Result: " + suite.counts());
            }

            if (!suite.passed()) {
                var failedTests = suite.failedTests();
                if (!failedTests.isEmpty()) {
                    out.println("Failed Tests:");
                    failedTests.forEach(t -> out.println("- " + t));
                }
                out.println("Logs:");
                suite.logs().forEach(r -> out.println("  " + ReportRenderer.logLine(r)));
            }
            out.println(SEPARATOR);
        }
        out.println("::endgroup::");

        if (!success) {
            out.println(report.isEmpty() ? "::error::" + ReportRenderer.NO_RESULTS : "::error::Some tests failed!");
        }
        out.flush();
    }
}
