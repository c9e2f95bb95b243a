package io.dataload.batch;

import io.dataload.core.ColumnarBatch;
import io.dataload.error.SchemaViolationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between column-major and row-major batches. Index alignment across columns is preserved;
 * columns of different lengths are rejected rather than truncated or padded.
 */
public final class Transposer {
    private Transposer() {}

    public static List<Map<String, Object>> toRows(ColumnarBatch batch) {
        Map<String, List<Object>> columns = batch.columns();
        int length = batch.numRows();
        for (Map.Entry<String, List<Object>> e : columns.entrySet()) {
            if (e.getValue().size() != length) {
                throw new SchemaViolationException("column '" + e.getKey() + "' has " + e.getValue().size()
                        + " values but the batch has " + length + " rows (columns " + columns.keySet() + ")");
            }
        }
        List<Map<String, Object>> rows = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (Map.Entry<String, List<Object>> e : columns.entrySet()) {
                row.put(e.getKey(), e.getValue().get(i));
            }
            rows.add(row);
        }
        return rows;
    }

    public static ColumnarBatch toColumns(List<Map<String, Object>> rows, List<String> columnNames) {
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        for (String c : columnNames) columns.put(c, new ArrayList<>(rows.size()));
        int index = 0;
        for (Map<String, Object> row : rows) {
            if (!row.keySet().equals(columns.keySet())) {
                throw new SchemaViolationException("row " + index + " has columns " + row.keySet()
                        + ", expected " + columns.keySet());
            }
            for (Map.Entry<String, List<Object>> e : columns.entrySet()) {
                e.getValue().add(row.get(e.getKey()));
            }
            index++;
        }
        return new ColumnarBatch(columns);
    }
}
