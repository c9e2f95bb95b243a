package io.dataload.datasets.handle;

import io.dataload.core.ColumnarBatch;

import java.io.Closeable;
import java.util.List;

/**
 * Backing dataset owned by a source adapter: exposes its columns, its size and column-major reads.
 */
public interface DatasetHandle extends Closeable {
    List<String> columnNames();

    /**
     * Exact row count.
     *
     * @throws io.dataload.error.UnsupportedModeException for handles that cannot count without a full pass
     */
    long numRows();

    /** View over the first {@code n} rows (all rows when {@code n} exceeds the size). */
    DatasetHandle select(long n);

    /** Up to {@code count} rows from {@code startRow}; fewer only at the end of the dataset. */
    ColumnarBatch read(long startRow, int count);

    @Override
    default void close() {}
}
