package io.suitelog.core.reader;

import io.suitelog.api.diagnostics.Diagnostic;
import io.suitelog.api.diagnostics.DiagnosticKind;
import io.suitelog.api.record.LogRecord;
import io.suitelog.api.record.RecordBatch;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonLinesRecordReaderTest {

    @TempDir
    Path tempDir;

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final JsonLinesRecordReader reader = new JsonLinesRecordReader(diagnostics::add);

    @Test
    void shouldReadRecordsInInputOrder() {
        RecordBatch batch = reader.read(new StringReader("""
                {"type": "log", "text": "first"}
                {"type": "error", "text": "second", "location": "app.js:12"}
                {"text": "third"}
                """));

        assertThat(batch.sourceFound()).isTrue();
        assertThat(batch.malformedLines()).isZero();
        assertThat(batch.records()).containsExactly(
                new LogRecord("log", "first", null),
                new LogRecord("error", "second", "app.js:12"),
                new LogRecord(null, "third", null));
        assertThat(diagnostics).isEmpty();
    }

    @Test
    void shouldSkipBlankLinesSilently() {
        RecordBatch batch = reader.read(new StringReader("\n   \n{\"text\": \"only\"}\n\n"));

        assertThat(batch.size()).isEqualTo(1);
        assertThat(diagnostics).isEmpty();
    }

    @Test
    void shouldDropMalformedLinesAndKeepReading() {
        RecordBatch batch = reader.read(new StringReader("""
                {"text": "before"}
                not json at all
                ["an", "array"]
                {"type": "log"}
                {"text": 42}
                {"text": "after"}
                """));

        assertThat(batch.records()).extracting(LogRecord::text).containsExactly("before", "after");
        assertThat(batch.malformedLines()).isEqualTo(4);
        assertThat(diagnostics).hasSize(4)
                .allMatch(d -> d.kind() == DiagnosticKind.RECORD_PARSE_ERROR);
        assertThat(diagnostics.get(0).message()).contains("Line 2");
        assertThat(diagnostics.get(2).message()).contains("'text'");
    }

    @Test
    void shouldRejectContentAfterTheObject() {
        RecordBatch batch = reader.read(new StringReader("""
                {"text": "Starting test suite: A"} }garbage
                {"text": "kept"}
                """));

        assertThat(batch.records()).extracting(LogRecord::text).containsExactly("kept");
        assertThat(batch.malformedLines()).isEqualTo(1);
        assertThat(diagnostics).singleElement()
                .satisfies(d -> assertThat(d.kind()).isEqualTo(DiagnosticKind.RECORD_PARSE_ERROR))
                .satisfies(d -> assertThat(d.message()).contains("Line 1"));
    }

    @Test
    void shouldDropOnlyTheLineWithInvalidUtf8() throws IOException {
        var content = new ByteArrayOutputStream();
        content.write(utf8("{\"text\": \"Starting test suite: A\"}\n"));
        for (int i = 0; i < 400; i++) {
            content.write(utf8("{\"text\": \"padding " + i + "\"}\n"));
        }
        content.write(utf8("{\"text\": \"bad "));
        content.write(0xFF);
        content.write(utf8("\"}\n"));
        content.write(utf8("{\"text\": \"Expect Test: load Failed\"}\n"));
        Path file = Files.write(tempDir.resolve("binary.log"), content.toByteArray());

        RecordBatch batch = reader.read(file);

        assertThat(batch.sourceFound()).isTrue();
        assertThat(batch.size()).isEqualTo(402);
        assertThat(batch.records().get(0).text()).isEqualTo("Starting test suite: A");
        assertThat(batch.records().get(401).text()).isEqualTo("Expect Test: load Failed");
        assertThat(batch.malformedLines()).isEqualTo(1);
        assertThat(diagnostics).singleElement()
                .satisfies(d -> assertThat(d.kind()).isEqualTo(DiagnosticKind.RECORD_PARSE_ERROR))
                .satisfies(d -> assertThat(d.message()).contains("Line 402", "UTF-8"));
    }

    @Test
    void shouldDecodeMultibyteTextAndDropCarriageReturns() throws IOException {
        Path file = Files.write(tempDir.resolve("crlf.log"),
                utf8("{\"text\": \"caf\u00e9\"}\r\n{\"text\": \"end\"}"));

        RecordBatch batch = reader.read(file);

        assertThat(batch.records()).extracting(LogRecord::text).containsExactly("caf\u00e9", "end");
        assertThat(diagnostics).isEmpty();
    }

    @Test
    void shouldKeepRecordsReadBeforeStreamFailure() {
        InputStream failing = new SequenceInputStream(
                new ByteArrayInputStream(utf8("{\"text\": \"first\"}\n{\"text\": \"second\"}\n")),
                new InputStream() {
                    @Override
                    public int read() throws IOException {
                        throw new IOException("disk gone");
                    }
                });

        RecordBatch batch = reader.read(failing);

        assertThat(batch.sourceFound()).isFalse();
        assertThat(batch.records()).extracting(LogRecord::text).containsExactly("first", "second");
        assertThat(diagnostics).singleElement()
                .satisfies(d -> assertThat(d.kind()).isEqualTo(DiagnosticKind.SOURCE_NOT_FOUND))
                .satisfies(d -> assertThat(d.message()).contains("line 2", "disk gone"));
    }

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void shouldKeepNumericKindAsText() {
        RecordBatch batch = reader.read(new StringReader("{\"type\": 4, \"text\": \"Test results:\"}"));

        assertThat(batch.records().get(0).kind()).isEqualTo("4");
    }

    @Test
    void shouldFormatStructuredLocation() {
        RecordBatch batch = reader.read(new StringReader("""
                {"text": "a", "location": {"url": "http://localhost/tests.js", "lineNumber": 7, "columnNumber": 3}}
                {"text": "b", "location": {"url": ""}}
                {"text": "c", "location": {"file": "x"}}
                """));

        assertThat(batch.records()).extracting(LogRecord::location)
                .containsExactly("http://localhost/tests.js:7:3", null, "{\"file\":\"x\"}");
    }

    @Test
    void shouldReportMissingSource() {
        RecordBatch batch = reader.read(tempDir.resolve("does-not-exist.log"));

        assertThat(batch.sourceFound()).isFalse();
        assertThat(batch.isEmpty()).isTrue();
        assertThat(diagnostics).singleElement()
                .extracting(Diagnostic::kind).isEqualTo(DiagnosticKind.SOURCE_NOT_FOUND);
    }

    @Test
    void shouldTreatEmptyFileAsFoundButEmpty() throws IOException {
        Path empty = Files.createFile(tempDir.resolve("empty.log"));

        RecordBatch batch = reader.read(empty);

        assertThat(batch.sourceFound()).isTrue();
        assertThat(batch.isEmpty()).isTrue();
        assertThat(diagnostics).isEmpty();
    }

    @Test
    void shouldReadFixtureFile() throws URISyntaxException {
        Path fixture = Path.of(getClass().getResource("/logs/mixed-suites.log").toURI());

        RecordBatch batch = reader.read(fixture);

        assertThat(batch.size()).isEqualTo(6);
        assertThat(batch.malformedLines()).isEqualTo(1);
        assertThat(batch.records().get(5).location()).isEqualTo("search.ts:40");
    }

    @Test
    void batchShouldBeRestartable() {
        RecordBatch batch = reader.read(new StringReader("{\"text\": \"a\"}\n{\"text\": \"b\"}"));

        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        batch.forEach(r -> first.add(r.text()));
        batch.forEach(r -> second.add(r.text()));

        assertThat(first).containsExactly("a", "b").isEqualTo(second);
    }
}
