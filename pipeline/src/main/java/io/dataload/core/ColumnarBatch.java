package io.dataload.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column-major block of rows as delivered by a dataset: one value list per column, in column order.
 * Lists are expected to share one length; {@link io.dataload.batch.Transposer} enforces it.
 */
public final class ColumnarBatch {
    private final Map<String, List<Object>> columns;

    public ColumnarBatch(Map<String, List<Object>> columns) {
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public static ColumnarBatch empty(List<String> columnNames) {
        Map<String, List<Object>> cols = new LinkedHashMap<>();
        for (String c : columnNames) cols.put(c, List.of());
        return new ColumnarBatch(cols);
    }

    public Map<String, List<Object>> columns() { return columns; }

    public List<String> columnNames() { return new ArrayList<>(columns.keySet()); }

    public List<Object> column(String name) { return columns.get(name); }

    /** Row count as seen by the first column; 0 when there are no columns. */
    public int numRows() {
        if (columns.isEmpty()) return 0;
        return columns.values().iterator().next().size();
    }

    public boolean isEmpty() { return numRows() == 0; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnarBatch that)) return false;
        return columns.equals(that.columns) && columnNames().equals(that.columnNames());
    }

    @Override
    public int hashCode() { return columns.hashCode(); }

    @Override
    public String toString() {
        return "ColumnarBatch{columns=" + columns.keySet() + ", rows=" + numRows() + '}';
    }
}
