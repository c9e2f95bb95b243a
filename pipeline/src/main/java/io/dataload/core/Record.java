package io.dataload.core;

/**
 * Envelope for a payload travelling through a pipeline. seq is the position of the payload
 * in its source (the batch index for batch sources) and orders records deterministically.
 */
public record Record<T>(long seq, T payload) implements Comparable<Record<?>> {
    @Override
    public int compareTo(Record<?> o) {
        return Long.compare(this.seq, o.seq);
    }
}
