package io.dataload.datasets.handle;

import io.dataload.core.ColumnarBatch;
import io.dataload.error.SchemaViolationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fully materialized, column-major dataset. select() returns views sharing the same column storage.
 */
public final class InMemoryDataset implements DatasetHandle {
    private final Map<String, List<Object>> columns;
    private final long rows;

    public InMemoryDataset(Map<String, List<Object>> columns) {
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        long length = -1;
        for (Map.Entry<String, List<Object>> e : columns.entrySet()) {
            if (length >= 0 && e.getValue().size() != length) {
                throw new SchemaViolationException("column '" + e.getKey() + "' has " + e.getValue().size()
                        + " values, expected " + length);
            }
            length = e.getValue().size();
            copy.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
        }
        this.columns = Collections.unmodifiableMap(copy);
        this.rows = Math.max(0, length);
    }

    private InMemoryDataset(Map<String, List<Object>> columns, long rows) {
        this.columns = columns;
        this.rows = rows;
    }

    /**
     * Builds a dataset from row maps. The column set is the union of all keys in order of first
     * appearance; rows lacking a column hold null for it.
     */
    public static InMemoryDataset fromRows(Iterator<? extends Map<String, ?>> rows) {
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        int count = 0;
        while (rows.hasNext()) {
            Map<String, ?> row = rows.next();
            for (String key : row.keySet()) {
                if (!columns.containsKey(key)) {
                    columns.put(key, new ArrayList<>(Collections.nCopies(count, null)));
                }
            }
            for (Map.Entry<String, List<Object>> e : columns.entrySet()) {
                e.getValue().add(row.get(e.getKey()));
            }
            count++;
        }
        return new InMemoryDataset(columns);
    }

    /** Reorders columns to {@code order}; columns not listed keep their relative order at the end. */
    public InMemoryDataset withColumnOrder(List<String> order) {
        Map<String, List<Object>> reordered = new LinkedHashMap<>();
        for (String c : order) {
            List<Object> values = columns.get(c);
            reordered.put(c, values != null ? values : Collections.nCopies((int) rows, null));
        }
        for (Map.Entry<String, List<Object>> e : columns.entrySet()) reordered.putIfAbsent(e.getKey(), e.getValue());
        return new InMemoryDataset(Collections.unmodifiableMap(reordered), rows);
    }

    @Override
    public List<String> columnNames() { return new ArrayList<>(columns.keySet()); }

    @Override
    public long numRows() { return rows; }

    @Override
    public InMemoryDataset select(long n) {
        if (n < 0) throw new IllegalArgumentException("cannot select " + n + " rows");
        return new InMemoryDataset(columns, Math.min(n, rows));
    }

    @Override
    public ColumnarBatch read(long startRow, int count) {
        int from = (int) Math.min(startRow, rows);
        int to = (int) Math.min(rows, startRow + count);
        Map<String, List<Object>> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> e : columns.entrySet()) {
            out.put(e.getKey(), e.getValue().subList(from, to));
        }
        return new ColumnarBatch(out);
    }
}
