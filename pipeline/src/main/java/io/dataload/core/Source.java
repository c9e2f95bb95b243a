package io.dataload.core;

import java.io.Closeable;
import java.util.Optional;

/**
 * A Source produces records in seq order.
 */
public interface Source<T> extends Closeable {
    /**
     * Fetch the next record if any. Finite sources return empty once exhausted and report
     * completion through {@link #isFinished()}.
     */
    Optional<Record<T>> poll();

    /**
     * Whether the source has reached a terminal state and will produce no more records.
     */
    boolean isFinished();

    @Override
    default void close() {}
}
