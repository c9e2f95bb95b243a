package io.dataload.batch;

import io.dataload.core.Record;
import io.dataload.core.RowBatch;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProducerSourceTest {
    @Test
    void numbers_batches_from_resume_point() {
        var src = new ProducerSource(new BatchProducer(new ListSourceAdapter(10), 4), 4);
        Record<RowBatch> r1 = src.poll().orElseThrow();
        Record<RowBatch> r2 = src.poll().orElseThrow();
        assertEquals(1, r1.seq());
        assertEquals(2, r2.seq());
        assertEquals(4, r1.payload().size());
        assertEquals(2, r2.payload().size());
        assertTrue(r2.payload().last());
        assertTrue(src.isFinished());
        assertTrue(src.poll().isEmpty());
        assertTrue(src.reachedLast());
    }

    @Test
    void empty_budget_is_finished_immediately() {
        var src = new ProducerSource(new BatchProducer(new ListSourceAdapter(0), 4), 0);
        assertTrue(src.isFinished());
        assertTrue(src.poll().isEmpty());
        assertFalse(src.reachedLast());
    }
}
