package io.dataload.core;

import java.io.Closeable;

/**
 * Sink consumes records in the order they are handed over.
 */
public interface Sink<T> extends Closeable {
    void accept(Record<T> record) throws Exception;

    @Override
    default void close() {}
}
