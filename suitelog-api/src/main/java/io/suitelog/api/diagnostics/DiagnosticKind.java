package io.suitelog.api.diagnostics;

/**
 * Categories of recoverable problems found while analysing a log.
 * None of them abort the run.
 */
public enum DiagnosticKind {

    /** Input file absent or unreadable. Treated as zero suites. */
    SOURCE_NOT_FOUND,
    /** One input line was not a well-formed record and was dropped. */
    RECORD_PARSE_ERROR,
    /** Overlapping suites, an end without a matching start, or a duplicate suite name. */
    STRUCTURAL_ANOMALY,
    /** The CI output sink could not be opened or written. */
    SINK_WRITE_ERROR,
    /** The log produced no suites at all. */
    NO_RESULTS,
    /** An optional file report could not be written. */
    REPORT_WRITE_ERROR
}
