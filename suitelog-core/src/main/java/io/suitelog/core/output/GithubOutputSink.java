package io.suitelog.core.output;

import io.suitelog.api.diagnostics.DiagnosticKind;
import io.suitelog.api.diagnostics.DiagnosticListener;
import io.suitelog.api.output.OutputSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends {@code name=value} lines to the file named by {@code GITHUB_OUTPUT}.
 * <p>
 * The file is opened on the first write. Writes are best effort: once opening or
 * writing fails, a {@link DiagnosticKind#SINK_WRITE_ERROR} is reported and later
 * writes are skipped.
 */
public class GithubOutputSink implements OutputSink {

    private static final Logger log = LoggerFactory.getLogger(GithubOutputSink.class);

    private final Path outputPath;
    private final DiagnosticListener diagnostics;
    private BufferedWriter writer;
    private boolean failed;
    private int emitted;

    /**
     * @param outputPath  destination file, null when no sink is configured
     * @param diagnostics receives write failures
     */
    public GithubOutputSink(Path outputPath, DiagnosticListener diagnostics) {
        this.outputPath = outputPath;
        this.diagnostics = diagnostics;
    }

    /**
     * Escape a value so it fits on one sink line.
     */
    public static String escape(String value) {
        return value.replace("%", "%25")
                .replace("\n", "%0A")
                .replace("\r", "%0D");
    }

    @Override
    public void emit(String name, String value) {
        if (failed) {
            return;
        }
        if (outputPath == null) {
            failed = true;
            diagnostics.report(DiagnosticKind.SINK_WRITE_ERROR, "No output file configured; CI outputs not written");
            return;
        }
        try {
            if (writer == null) {
                writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            }
            writer.write(name + "=" + escape(value == null ? "" : value));
            writer.newLine();
            emitted++;
        } catch (IOException e) {
            failed = true;
            log.debug("Failed to write output '{}' to {}", name, outputPath, e);
            diagnostics.report(DiagnosticKind.SINK_WRITE_ERROR,
                    "Could not write outputs to " + outputPath + " (" + e.getMessage() + ")");
            closeQuietly();
        }
    }

    @Override
    public void close() {
        if (writer != null) {
            try {
                writer.flush();
                log.info("Wrote {} outputs to {}", emitted, outputPath);
            } catch (IOException e) {
                diagnostics.report(DiagnosticKind.SINK_WRITE_ERROR,
                        "Could not flush outputs to " + outputPath + " (" + e.getMessage() + ")");
            }
            closeQuietly();
        }
    }

    public boolean failed() {
        return failed;
    }

    private void closeQuietly() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.error("Failed to close output writer", e);
        } finally {
            writer = null;
        }
    }
}
