package io.suitelog.core.render;

import io.suitelog.api.output.OutputSink;

import java.util.List;

/**
 * Everything the CI needs from one analysis: the summary text, details of the suites
 * that did not pass, and the overall verdict.
 */
public record RenderedReport(
        String summary,
        List<SuiteDetail> details,
        boolean success
) {

    public static final String SUMMARY_OUTPUT = "summary";
    public static final String SUCCESS_OUTPUT = "success";

    public RenderedReport {
        details = List.copyOf(details);
    }

    /**
     * @return 0 when every suite passed, 1 otherwise
     */
    public int exitCode() {
        return success ? 0 : 1;
    }

    /**
     * Emit the summary, the verdict and each failing suite's detail, in that order.
     */
    public void emitTo(OutputSink sink) {
        sink.emit(SUMMARY_OUTPUT, summary);
        sink.emit(SUCCESS_OUTPUT, String.valueOf(success));
        for (SuiteDetail detail : details) {
            sink.emit(detail.key() + "_status", detail.status().label());
            sink.emit(detail.key() + "_result", detail.resultSummary());
            sink.emit(detail.key() + "_tests", detail.tests());
            sink.emit(detail.key() + "_logs", detail.logDump());
        }
    }
}
