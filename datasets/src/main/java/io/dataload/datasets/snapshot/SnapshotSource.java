package io.dataload.datasets.snapshot;

import io.dataload.core.ColumnarBatch;
import io.dataload.core.SourceAdapter;
import io.dataload.core.SourceDescriptor;
import io.dataload.datasets.RowBudget;
import io.dataload.datasets.SchemaResolver;
import io.dataload.datasets.fs.StorageProvider;
import io.dataload.datasets.handle.InMemoryDataset;
import io.dataload.error.SourceUnavailableException;
import io.dataload.error.UnsupportedModeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;

/**
 * Dataset previously saved to disk. Streaming is not supported; snapshots are always read whole.
 */
public class SnapshotSource implements SourceAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotSource.class);

    private final StorageProvider storage;
    private final String path;
    private final String config;
    private final String split;
    private final boolean distiset;
    private final boolean streaming;
    private final Long rowLimit;
    private final SourceDescriptor descriptor;

    private InMemoryDataset handle;
    private long rowBudget = -1;
    private List<String> columns;

    public SnapshotSource(StorageProvider storage, String path, String config, String split,
                          boolean distiset, boolean streaming, Long rowLimit) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.path = Objects.requireNonNull(path, "path");
        this.config = config;
        this.split = split;
        this.distiset = distiset;
        this.streaming = streaming;
        this.rowLimit = RowBudget.checkLimit(rowLimit);
        this.descriptor = new SourceDescriptor.Snapshot(path, config, split);
    }

    @Override
    public void open() {
        if (handle != null) return;
        if (streaming) throw new UnsupportedModeException(descriptor + ": snapshots cannot be streamed");
        InMemoryDataset full;
        try {
            DiskSnapshot node = DiskSnapshot.load(storage, path, distiset);
            if (config != null) {
                if (distiset) {
                    node = index(node, config, "config");
                } else {
                    LOGGER.warn("Ignoring config '{}' of {}, it is not a distiset", config, descriptor);
                }
            }
            if (split != null) node = index(node, split, "split");
            if (!node.isDataset()) {
                throw new SourceUnavailableException(descriptor + " holds " + node.keys() + ", select one with a split");
            }
            full = node.dataset();
        } catch (IOException | UncheckedIOException e) {
            throw new SourceUnavailableException("cannot load " + descriptor + ": " + e.getMessage(), e);
        }
        long budget = RowBudget.resolve(rowLimit, full.numRows());
        InMemoryDataset truncated = full.select(budget);
        columns = SchemaResolver.resolve(truncated, descriptor);
        rowBudget = budget;
        handle = truncated;
        LOGGER.info("Opened {} with {} rows, columns {}", descriptor, rowBudget, columns);
    }

    private DiskSnapshot index(DiskSnapshot node, String key, String what) throws IOException {
        DiskSnapshot child = node.isDataset() ? null : node.get(key);
        if (child == null) {
            throw new SourceUnavailableException(descriptor + ": unknown " + what + " '" + key + "', available: " + node.keys());
        }
        return child;
    }

    @Override
    public long rowCount() {
        requireOpen();
        return rowBudget;
    }

    @Override
    public List<String> columns() {
        requireOpen();
        return columns;
    }

    @Override
    public ColumnarBatch readColumnar(long startRow, int batchSize) {
        requireOpen();
        return handle.read(startRow, batchSize);
    }

    @Override
    public SourceDescriptor descriptor() { return descriptor; }

    private void requireOpen() {
        if (handle == null) throw new IllegalStateException(descriptor + " is not open");
    }

    @Override
    public void close() {
        try {
            storage.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
