package io.dataload.core;

import java.io.Closeable;
import java.util.List;

/**
 * Owns exactly one backing dataset and exposes it to a {@link io.dataload.batch.BatchProducer}.
 *
 * <p>Adapters are driven by a single executor thread: {@link #open()} once, then any number of
 * reads in increasing row order. They are not required to be thread safe.
 */
public interface SourceAdapter extends Closeable {

    /**
     * Acquires the backing handle, resolves the row budget and the output columns. Calling it
     * again after a successful open is a no-op.
     *
     * @throws io.dataload.error.SourceUnavailableException if the location cannot be reached or opened
     * @throws io.dataload.error.EmptySourceException if no columns can be resolved
     */
    void open();

    /** Number of rows this source will deliver in one run. Only valid after {@link #open()}. */
    long rowCount();

    /** Output columns, stable for the lifetime of the adapter. Only valid after {@link #open()}. */
    List<String> columns();

    /**
     * Reads up to {@code batchSize} rows starting at {@code startRow}, in source order. Fewer rows
     * are returned only at the end of the source. May block on disk or network I/O.
     */
    ColumnarBatch readColumnar(long startRow, int batchSize);

    /** Identifies the dataset behind this adapter, for diagnostics. */
    SourceDescriptor descriptor();

    @Override
    default void close() {}
}
