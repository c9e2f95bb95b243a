package io.dataload.datasets;

/**
 * Number of rows a source delivers in one run: the requested limit capped by the rows available.
 */
public final class RowBudget {
    private RowBudget() {}

    /** @return the limit itself, for callers that accept it without a cap */
    public static Long checkLimit(Long limit) {
        if (limit != null && limit < 0) throw new IllegalArgumentException("row limit must be >= 0, got " + limit);
        return limit;
    }

    public static long resolve(Long limit, long available) {
        return limit == null ? available : Math.min(limit, available);
    }
}
