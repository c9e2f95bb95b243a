package io.dataload.batch;

import io.dataload.core.Record;
import io.dataload.core.RowBatch;
import io.dataload.core.Source;

import java.util.Iterator;
import java.util.Optional;

/**
 * Exposes one {@link BatchProducer#produce(long)} pass as a pipeline {@link Source}. Record seq is the
 * absolute batch number, so a resumed pass continues the numbering of the run it resumes.
 */
public class ProducerSource implements Source<RowBatch> {
    private final Iterator<RowBatch> batches;
    private long seq;
    private boolean sawLast;

    public ProducerSource(BatchProducer producer, long offset) {
        this.batches = producer.produce(offset);
        this.seq = offset / producer.batchSize();
    }

    @Override
    public Optional<Record<RowBatch>> poll() {
        if (!batches.hasNext()) return Optional.empty();
        RowBatch batch = batches.next();
        if (batch.last()) sawLast = true;
        return Optional.of(new Record<>(seq++, batch));
    }

    @Override
    public boolean isFinished() {
        return !batches.hasNext();
    }

    /** Whether the batch flagged as last has been handed out. False if the source ended early. */
    public boolean reachedLast() { return sawLast; }
}
