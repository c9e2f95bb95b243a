package io.dataload.datasets.handle;

import io.dataload.core.ColumnarBatch;
import io.dataload.datasets.format.RowIterator;
import io.dataload.error.SchemaViolationException;
import io.dataload.error.SourceException;
import io.dataload.error.SourceUnavailableException;
import io.dataload.error.UnsupportedModeException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lazily read dataset. Columns are taken from the first row, which is buffered and delivered with
 * the first read. Reads move forward; a read before the current row restarts the stream from the
 * beginning. Row count and truncation are not available.
 */
public final class StreamingDataset implements DatasetHandle {

    /** Opens the row stream; called on first use and again for every restart. */
    @FunctionalInterface
    public interface Opener {
        RowIterator open() throws IOException;
    }

    private final String location;
    private final Opener opener;
    private RowIterator rows;
    private List<String> columns;
    private Map<String, Object> peeked;
    private long position = 0;

    public StreamingDataset(String location, Opener opener) {
        this.location = location;
        this.opener = opener;
    }

    private RowIterator rows() {
        if (rows == null) {
            try {
                rows = opener.open();
            } catch (IOException e) {
                throw new SourceUnavailableException("cannot open " + location, e);
            }
        }
        return rows;
    }

    private Map<String, Object> nextRow() {
        if (peeked != null) {
            Map<String, Object> r = peeked;
            peeked = null;
            return r;
        }
        try {
            return rows().hasNext() ? rows().next() : null;
        } catch (UncheckedIOException e) {
            throw new SourceException("failed reading " + location + " at row " + position, e.getCause());
        }
    }

    @Override
    public List<String> columnNames() {
        if (columns == null) {
            if (position > 0) throw new IllegalStateException("columns resolved after reading started");
            peeked = nextRow();
            columns = peeked == null ? List.of() : List.copyOf(peeked.keySet());
        }
        return columns;
    }

    @Override
    public long numRows() {
        throw new UnsupportedModeException(location + ": a streaming dataset has no row count without a full pass");
    }

    @Override
    public DatasetHandle select(long n) {
        throw new UnsupportedModeException(location + ": a streaming dataset cannot be truncated");
    }

    @Override
    public ColumnarBatch read(long startRow, int count) {
        List<String> names = columnNames();
        if (startRow < position) restart();
        while (position < startRow) {
            if (nextRow() == null) return ColumnarBatch.empty(names);
            position++;
        }
        Map<String, List<Object>> out = new LinkedHashMap<>();
        for (String c : names) out.put(c, new ArrayList<>(count));
        for (int i = 0; i < count; i++) {
            Map<String, Object> row = nextRow();
            if (row == null) break;
            for (String key : row.keySet()) {
                if (!out.containsKey(key)) {
                    throw new SchemaViolationException(location + ": row " + position + " has column '" + key
                            + "' outside the schema " + names);
                }
            }
            for (Map.Entry<String, List<Object>> e : out.entrySet()) e.getValue().add(row.get(e.getKey()));
            position++;
        }
        return new ColumnarBatch(out);
    }

    private void restart() {
        close();
        peeked = null;
        position = 0;
    }

    @Override
    public void close() {
        if (rows != null) {
            try {
                rows.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            } finally {
                rows = null;
            }
        }
    }
}
