package io.dataload.datasets.hub;

import io.dataload.core.ColumnarBatch;
import io.dataload.core.SourceAdapter;
import io.dataload.core.SourceDescriptor;
import io.dataload.datasets.DatasetInfo;
import io.dataload.datasets.RowBudget;
import io.dataload.datasets.SchemaResolver;
import io.dataload.datasets.handle.DatasetHandle;
import io.dataload.error.SourceException;
import io.dataload.error.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dataset published on a hub, addressed by repository id, config and split.
 *
 * <p>Columns and row counts come from the hub metadata. When the metadata query fails the source
 * falls back to what the opened handle reports about itself.
 */
public class HubSource implements SourceAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(HubSource.class);
    private static final String DEFAULT_CONFIG = "default";

    private final HubClient client;
    private final String repoId;
    private final String config;
    private final String split;
    private final boolean streaming;
    private final Long rowLimit;
    private final SourceDescriptor descriptor;

    private DatasetHandle handle;
    private long rowBudget = -1;
    private List<String> columns;

    public HubSource(HubClient client, String repoId, String config, String split, boolean streaming, Long rowLimit) {
        this.client = Objects.requireNonNull(client, "client");
        this.repoId = Objects.requireNonNull(repoId, "repoId");
        this.config = config;
        this.split = split == null ? "train" : split;
        this.streaming = streaming;
        this.rowLimit = RowBudget.checkLimit(rowLimit);
        this.descriptor = new SourceDescriptor.Hub(repoId, config, this.split);
    }

    @Override
    public void open() {
        if (handle != null) return;
        DatasetHandle opened;
        try {
            opened = client.open(repoId, config, split, streaming);
        } catch (IOException | UncheckedIOException e) {
            throw new SourceUnavailableException("cannot open " + descriptor + ": " + e.getMessage(), e);
        }
        try {
            DatasetInfo info = datasetInfo(opened);
            long splitRows = splitRows(info);
            rowBudget = RowBudget.resolve(rowLimit, splitRows);
            columns = SchemaResolver.resolve(info, descriptor);
            handle = streaming ? opened : opened.select(rowBudget);
        } catch (RuntimeException e) {
            opened.close();
            throw e;
        }
        LOGGER.info("Opened {} (streaming={}) with {} rows, columns {}", descriptor, streaming, rowBudget, columns);
    }

    private DatasetInfo datasetInfo(DatasetHandle opened) {
        Map<String, DatasetInfo> infos;
        try {
            infos = client.datasetInfos(repoId);
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Metadata query for {} failed, using the info of the opened dataset: {}", descriptor, e.toString());
            return fallbackInfo(opened, e);
        }
        String key = config == null ? DEFAULT_CONFIG : config;
        DatasetInfo info = infos.get(key);
        if (info == null) {
            throw new SourceUnavailableException(descriptor + ": unknown config '" + key + "', available: " + infos.keySet());
        }
        return info;
    }

    private DatasetInfo fallbackInfo(DatasetHandle opened, Exception metadataFailure) {
        try {
            return new DatasetInfo(config == null ? DEFAULT_CONFIG : config, opened.columnNames(), Map.of(split, opened.numRows()));
        } catch (RuntimeException e) {
            SourceException failure = new SourceUnavailableException(
                    descriptor + ": metadata unavailable and the dataset cannot describe itself: " + e.getMessage(), e);
            failure.addSuppressed(metadataFailure);
            throw failure;
        }
    }

    private long splitRows(DatasetInfo info) {
        Long rows = info.splits().get(split);
        if (rows == null) {
            throw new SourceUnavailableException(descriptor + ": unknown split '" + split + "', available: " + info.splits().keySet());
        }
        return rows;
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
        if (handle != null) handle.close();
    }
}
