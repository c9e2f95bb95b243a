package io.dataload.core;

import java.util.List;
import java.util.Map;

/**
 * Row-major batch handed to the pipeline. last is set on the batch that completes the row budget.
 */
public record RowBatch(List<Map<String, Object>> rows, boolean last) {
    public RowBatch {
        rows = List.copyOf(rows);
    }

    public int size() { return rows.size(); }
}
