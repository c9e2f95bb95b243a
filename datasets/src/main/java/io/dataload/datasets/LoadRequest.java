package io.dataload.datasets;

import java.util.Map;
import java.util.Objects;

/**
 * Parameters of one load: what to read, how much of it, and where to resume.
 *
 * @param location repository id for {@link SourceKind#HUB}, a path or URI otherwise
 * @param config config name; hub datasets and distiset snapshots only
 * @param split split name; null selects {@code train} for hub and filesystem sources and the whole
 *              snapshot for snapshots
 * @param rowLimit maximum rows to deliver, null for all
 * @param batchSize rows per batch
 * @param filetype filetype override for filesystem sources, null to infer from extensions
 * @param storageOptions options handed uninterpreted to the filesystem provider
 * @param offset rows to skip before the first batch
 */
public record LoadRequest(
        SourceKind kind,
        String location,
        String config,
        String split,
        boolean streaming,
        Long rowLimit,
        int batchSize,
        String filetype,
        Map<String, String> storageOptions,
        boolean distiset,
        long offset
) {
    public LoadRequest {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(location, "location");
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0, got " + offset);
        RowBudget.checkLimit(rowLimit);
        storageOptions = storageOptions == null ? Map.of() : Map.copyOf(storageOptions);
    }

    public static Builder builder(SourceKind kind, String location) { return new Builder(kind, location); }

    public static final class Builder {
        private final SourceKind kind;
        private final String location;
        private String config;
        private String split;
        private boolean streaming;
        private Long rowLimit;
        private int batchSize = 50;
        private String filetype;
        private Map<String, String> storageOptions = Map.of();
        private boolean distiset;
        private long offset;

        private Builder(SourceKind kind, String location) {
            this.kind = kind;
            this.location = location;
        }

        public Builder config(String config) { this.config = config; return this; }
        public Builder split(String split) { this.split = split; return this; }
        public Builder streaming(boolean streaming) { this.streaming = streaming; return this; }
        public Builder rowLimit(Long rowLimit) { this.rowLimit = rowLimit; return this; }
        public Builder batchSize(int batchSize) { this.batchSize = batchSize; return this; }
        public Builder filetype(String filetype) { this.filetype = filetype; return this; }
        public Builder storageOptions(Map<String, String> storageOptions) { this.storageOptions = storageOptions; return this; }
        public Builder distiset(boolean distiset) { this.distiset = distiset; return this; }
        public Builder offset(long offset) { this.offset = offset; return this; }

        public LoadRequest build() {
            return new LoadRequest(kind, location, config, split, streaming, rowLimit, batchSize, filetype, storageOptions, distiset, offset);
        }
    }
}
