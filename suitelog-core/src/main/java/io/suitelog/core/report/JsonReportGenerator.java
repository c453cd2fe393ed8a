package io.suitelog.core.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.suitelog.api.report.ReportGenerationException;
import io.suitelog.api.report.ReportGenerator;
import io.suitelog.api.suite.SuiteOutcome;
import io.suitelog.api.suite.SuiteReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Writes the analysed suites to a JSON document for archiving or further tooling.
 */
public class JsonReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonReportGenerator.class);

    /**
     * Top-level JSON document.
     */
    public record JsonReport(
            Instant generatedAt,
            boolean success,
            int exitCode,
            List<SuiteOutcome> suites
    ) {}

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonReportGenerator() {
        this(Clock.systemUTC());
    }

    public JsonReportGenerator(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Path generate(SuiteReport report, boolean success, Path outputPath) {
        var document = new JsonReport(clock.instant(), success, success ? 0 : 1, report.suites());
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(outputPath.toFile(), document);
            log.info("Test results written to: {}", outputPath.toAbsolutePath());
            return outputPath;
        } catch (IOException e) {
            throw new ReportGenerationException("Failed to write JSON report to " + outputPath, e);
        }
    }

    @Override
    public String format() {
        return "JSON";
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}
