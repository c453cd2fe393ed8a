package io.suitelog.api.record;

import java.io.Reader;
import java.nio.file.Path;

/**
 * Turns raw harness output into an ordered batch of {@link LogRecord}s.
 * <p>
 * Implementations never throw for bad input. Malformed lines are dropped and
 * reported as diagnostics, a missing source yields {@link RecordBatch#missing()}.
 */
public interface RecordReader {

    /**
     * Read all records from a file.
     *
     * @param path the log file
     * @return the records, empty if the file does not exist
     */
    RecordBatch read(Path path);

    /**
     * Read all records from an open character stream. The caller owns the reader.
     */
    RecordBatch read(Reader reader);
}
