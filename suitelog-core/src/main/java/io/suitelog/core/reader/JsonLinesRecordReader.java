package io.suitelog.core.reader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.suitelog.api.diagnostics.DiagnosticKind;
import io.suitelog.api.diagnostics.DiagnosticListener;
import io.suitelog.api.record.LogRecord;
import io.suitelog.api.record.RecordBatch;
import io.suitelog.api.record.RecordReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads harness console output stored as JSON lines, one object per line.
 * <p>
 * Each object must carry a string {@code text} field. {@code type} and {@code location}
 * are optional and kept for display. Lines that do not fit, including lines that are not
 * valid UTF-8 or carry content after the object, are dropped with a
 * {@link DiagnosticKind#RECORD_PARSE_ERROR}; blank lines are skipped silently.
 * <p>
 * Files are split into lines as bytes and each line is decoded on its own, so one
 * undecodable line never costs its neighbours.
 */
public class JsonLinesRecordReader implements RecordReader {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesRecordReader.class);

    private final ObjectReader lineReader;
    private final DiagnosticListener diagnostics;

    public JsonLinesRecordReader(DiagnosticListener diagnostics) {
        this(new ObjectMapper(), diagnostics);
    }

    public JsonLinesRecordReader(ObjectMapper objectMapper, DiagnosticListener diagnostics) {
        this.lineReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.diagnostics = diagnostics;
    }

    @Override
    public RecordBatch read(Path path) {
        if (!Files.isRegularFile(path)) {
            diagnostics.report(DiagnosticKind.SOURCE_NOT_FOUND, "Log file not found: " + path.toAbsolutePath());
            return RecordBatch.missing();
        }
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            RecordBatch batch = read(in);
            log.info("Read {} records from {} ({} malformed lines skipped)",
                    batch.size(), path, batch.malformedLines());
            return batch;
        } catch (NoSuchFileException e) {
            diagnostics.report(DiagnosticKind.SOURCE_NOT_FOUND, "Log file not found: " + path.toAbsolutePath());
            return RecordBatch.missing();
        } catch (IOException e) {
            log.debug("Failed to open {}", path, e);
            diagnostics.report(DiagnosticKind.SOURCE_NOT_FOUND,
                    "Log file could not be read: " + path.toAbsolutePath() + " (" + e.getMessage() + ")");
            return RecordBatch.missing();
        }
    }

    /**
     * Read UTF-8 encoded JSON lines from a byte stream. The stream is not closed.
     * Lines end at {@code \n}; a trailing {@code \r} is dropped.
     */
    public RecordBatch read(InputStream in) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        Batch batch = new Batch();
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        try {
            int b;
            while ((b = in.read()) != -1) {
                if (b == '\n') {
                    acceptBytes(batch, line.toByteArray(), decoder);
                    line.reset();
                } else {
                    line.write(b);
                }
            }
            if (line.size() > 0) {
                acceptBytes(batch, line.toByteArray(), decoder);
            }
        } catch (IOException e) {
            return aborted(batch, e);
        }
        return batch.complete();
    }

    @Override
    public RecordBatch read(Reader reader) {
        BufferedReader buffered = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        Batch batch = new Batch();
        try {
            String line;
            while ((line = buffered.readLine()) != null) {
                acceptLine(batch, line);
            }
        } catch (IOException e) {
            return aborted(batch, e);
        }
        return batch.complete();
    }

    private void acceptBytes(Batch batch, byte[] bytes, CharsetDecoder decoder) {
        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == '\r') {
            length--;
        }
        String line;
        try {
            line = decoder.decode(ByteBuffer.wrap(bytes, 0, length)).toString();
        } catch (CharacterCodingException e) {
            batch.lineNumber++;
            batch.malformed++;
            rejected(batch.lineNumber, "not valid UTF-8");
            return;
        }
        acceptLine(batch, line);
    }

    private void acceptLine(Batch batch, String line) {
        batch.lineNumber++;
        if (line.isBlank()) return;

        Optional<LogRecord> parsed = parseLine(line, batch.lineNumber);
        if (parsed.isPresent()) {
            batch.records.add(parsed.get());
        } else {
            batch.malformed++;
        }
    }

    private RecordBatch aborted(Batch batch, IOException e) {
        log.debug("Read aborted after line {}", batch.lineNumber, e);
        diagnostics.report(DiagnosticKind.SOURCE_NOT_FOUND,
                "Log stream could not be read past line " + batch.lineNumber + " (" + e.getMessage() + ")");
        return new RecordBatch(batch.records, batch.malformed, false);
    }

    private Optional<LogRecord> parseLine(String line, int lineNumber) {
        JsonNode node;
        try {
            node = lineReader.readTree(line);
        } catch (JsonProcessingException e) {
            return rejected(lineNumber, "not valid JSON (" + e.getOriginalMessage() + ")");
        }
        if (node == null || !node.isObject()) {
            return rejected(lineNumber, "not a JSON object");
        }
        JsonNode text = node.get("text");
        if (text == null || !text.isTextual()) {
            return rejected(lineNumber, "missing string field 'text'");
        }
        return Optional.of(new LogRecord(kindOf(node.get("type")), text.asText(), locationOf(node.get("location"))));
    }

    private Optional<LogRecord> rejected(int lineNumber, String reason) {
        diagnostics.report(DiagnosticKind.RECORD_PARSE_ERROR, "Line " + lineNumber + " skipped: " + reason);
        return Optional.empty();
    }

    private static String kindOf(JsonNode type) {
        if (type == null || type.isNull()) {
            return null;
        }
        return type.isValueNode() ? type.asText() : type.toString();
    }

    // Playwright reports locations as {url, lineNumber, columnNumber}
    private static String locationOf(JsonNode location) {
        if (location == null || location.isNull()) {
            return null;
        }
        if (location.isTextual()) {
            return location.asText();
        }
        if (location.isObject() && location.hasNonNull("url")) {
            String url = location.get("url").asText();
            if (url.isEmpty()) {
                return null;
            }
            StringBuilder sb = new StringBuilder(url);
            if (location.hasNonNull("lineNumber")) {
                sb.append(':').append(location.get("lineNumber").asText());
                if (location.hasNonNull("columnNumber")) {
                    sb.append(':').append(location.get("columnNumber").asText());
                }
            }
            return sb.toString();
        }
        return location.toString();
    }

    private static final class Batch {
        final List<LogRecord> records = new ArrayList<>();
        int malformed;
        int lineNumber;

        RecordBatch complete() {
            return new RecordBatch(records, malformed, true);
        }
    }
}
