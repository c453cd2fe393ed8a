package io.suitelog.api.report;

import io.suitelog.api.suite.SuiteReport;

import java.nio.file.Path;

/**
 * Generates a report file from an analysed test log.
 * Implementations can produce HTML, JSON, or any other format.
 */
public interface ReportGenerator {

    /**
     * Generate a report file.
     *
     * @param report     the aggregated suites
     * @param success    whether the run is considered successful
     * @param outputPath path where the report file should be written
     * @return the path to the generated report
     * @throws ReportGenerationException if the file cannot be written
     */
    Path generate(SuiteReport report, boolean success, Path outputPath);

    /**
     * @return the format name (e.g., "HTML", "JSON")
     */
    String format();
}
