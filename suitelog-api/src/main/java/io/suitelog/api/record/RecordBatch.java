package io.suitelog.api.record;

import java.util.Iterator;
import java.util.List;

/**
 * The records read from one input source, in input order.
 * Can be iterated any number of times.
 *
 * @param records        the well-formed records
 * @param malformedLines number of lines dropped because they did not parse
 * @param sourceFound    false when the input source was missing or unreadable
 */
public record RecordBatch(
        List<LogRecord> records,
        int malformedLines,
        boolean sourceFound
) implements Iterable<LogRecord> {

    public RecordBatch {
        records = List.copyOf(records);
    }

    public static RecordBatch missing() {
        return new RecordBatch(List.of(), 0, false);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public Iterator<LogRecord> iterator() {
        return records.iterator();
    }
}
