package io.dataload.batch;

import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.dataload.core.ColumnarBatch;
import io.dataload.core.RowBatch;
import io.dataload.core.SourceAdapter;
import io.dataload.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Turns an opened {@link SourceAdapter} into a stream of fixed-size row batches that can be resumed
 * from a row offset.
 *
 * <p>Resumption is logical: rows before the offset are read from the adapter in batch-size steps and
 * dropped, never delivered. Discard steps stop exactly at the offset, so the first yielded batch
 * starts there. The batch that brings the consumed row count to the adapter's row budget carries
 * {@code last = true} and ends the stream.
 */
public class BatchProducer {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchProducer.class);

    private final SourceAdapter adapter;
    private final int batchSize;
    private final Meter batchMeter;
    private final Meter rowMeter;
    private final Meter discardMeter;
    private final Timer readTimer;
    private final Histogram batchSizes;

    public BatchProducer(SourceAdapter adapter, int batchSize) {
        this(adapter, batchSize, Metrics.detached());
    }

    public BatchProducer(SourceAdapter adapter, int batchSize, Metrics metrics) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        this.batchSize = batchSize;
        Objects.requireNonNull(metrics, "metrics");
        this.batchMeter = metrics.meter("producer.batches");
        this.rowMeter = metrics.meter("producer.rows");
        this.discardMeter = metrics.meter("producer.rows.discarded");
        this.readTimer = metrics.timer("producer.read.time");
        this.batchSizes = metrics.histogram("producer.batch.size");
    }

    public int batchSize() { return batchSize; }

    /**
     * Starts a fresh pass over the adapter. The returned iterator is lazy, finite and single use.
     *
     * @param offset rows already consumed by a previous run
     */
    public Iterator<RowBatch> produce(long offset) {
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0, got " + offset);
        return new BatchIterator(offset, adapter.rowCount());
    }

    private ColumnarBatch read(long startRow, int count) {
        try (Timer.Context ignored = readTimer.time()) {
            ColumnarBatch batch = adapter.readColumnar(startRow, count);
            if (batch.numRows() > count) {
                throw new IllegalStateException(adapter.descriptor() + " returned " + batch.numRows()
                        + " rows for a read of " + count + " at row " + startRow);
            }
            return batch;
        }
    }

    private final class BatchIterator implements Iterator<RowBatch> {
        private final long offset;
        private final long budget;
        private long cursor = 0;
        private long emitted = 0;
        private boolean done;
        private RowBatch next;

        BatchIterator(long offset, long budget) {
            this.offset = offset;
            this.budget = budget;
            this.done = budget <= 0 || offset >= budget;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !done) next = advance();
            return next != null;
        }

        @Override
        public RowBatch next() {
            if (!hasNext()) throw new NoSuchElementException();
            RowBatch b = next;
            next = null;
            return b;
        }

        private RowBatch advance() {
            while (cursor < offset) {
                int want = (int) Math.min(batchSize, offset - cursor);
                ColumnarBatch skipped = read(cursor, want);
                if (skipped.isEmpty()) return endEarly();
                cursor += skipped.numRows();
                discardMeter.mark(skipped.numRows());
            }
            int want = (int) Math.min(batchSize, budget - cursor);
            ColumnarBatch columnar = read(cursor, want);
            List<Map<String, Object>> rows = Transposer.toRows(columnar);
            if (rows.isEmpty()) return endEarly();
            cursor += rows.size();
            emitted += rows.size();
            boolean last = cursor >= budget;
            if (last) {
                done = true;
                LOGGER.debug("{}: emitted {} rows after offset {}, budget {} reached", adapter.descriptor(), emitted, offset, budget);
            }
            batchMeter.mark();
            rowMeter.mark(rows.size());
            batchSizes.update(rows.size());
            return new RowBatch(rows, last);
        }

        private RowBatch endEarly() {
            done = true;
            LOGGER.warn("{} ran out of rows at row {} before reaching its budget of {} rows", adapter.descriptor(), cursor, budget);
            return null;
        }
    }
}
