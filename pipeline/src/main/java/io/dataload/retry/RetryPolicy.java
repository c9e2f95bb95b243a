package io.dataload.retry;

/**
 * Decides whether a failed transport call is attempted again and how long to wait before it.
 * attempt is 1-based and counts the call that just failed.
 */
public interface RetryPolicy {
    boolean shouldRetry(int attempt, Exception e);
    long backoffMillis(int attempt);

    static RetryPolicy never() {
        return new RetryPolicy() {
            @Override public boolean shouldRetry(int attempt, Exception e) { return false; }
            @Override public long backoffMillis(int attempt) { return 0; }
        };
    }
}
