package io.dataload.datasets.fs;

import io.dataload.core.ColumnarBatch;
import io.dataload.core.SourceAdapter;
import io.dataload.core.SourceDescriptor;
import io.dataload.datasets.RowBudget;
import io.dataload.datasets.SchemaResolver;
import io.dataload.datasets.format.FileFormat;
import io.dataload.datasets.format.FileFormats;
import io.dataload.datasets.format.FileRows;
import io.dataload.datasets.format.RowIterator;
import io.dataload.datasets.handle.DatasetHandle;
import io.dataload.datasets.handle.InMemoryDataset;
import io.dataload.datasets.handle.StreamingDataset;
import io.dataload.error.SourceException;
import io.dataload.error.SourceUnavailableException;
import io.dataload.error.UnresolvableFiletypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads a file, the files of a directory, or the files of the sub-directory named after the split.
 *
 * <p>Non-streaming sources are read fully on open. Streaming sources are read lazily; without a row
 * limit their row budget costs one extra pass over the files, since none of the supported formats
 * records a row count.
 */
public class FilesystemSource implements SourceAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(FilesystemSource.class);

    private final StorageProvider storage;
    private final String path;
    private final String filetype;
    private final String split;
    private final boolean streaming;
    private final Long rowLimit;

    private SourceDescriptor descriptor;
    private DatasetHandle handle;
    private long rowBudget = -1;
    private List<String> columns;

    public FilesystemSource(StorageProvider storage, String path, String filetype, String split, boolean streaming, Long rowLimit) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.path = Objects.requireNonNull(path, "path");
        this.filetype = filetype;
        this.split = split == null ? "train" : split;
        this.streaming = streaming;
        this.rowLimit = RowBudget.checkLimit(rowLimit);
        this.descriptor = new SourceDescriptor.Files(path, filetype);
    }

    @Override
    public void open() {
        if (handle != null) return;
        PathClassifier.Classification classification = new PathClassifier(storage).classify(path);
        String type = filetype != null && !filetype.isBlank() ? filetype : classification.filetype();
        if (type.isEmpty()) {
            throw new UnresolvableFiletypeException(path + ": cannot infer a filetype from the file extension, set one explicitly");
        }
        FileFormat format = FileFormats.forType(type);
        descriptor = new SourceDescriptor.Files(path, format.name());
        List<String> files = filesToLoad(classification.files());

        DatasetHandle opened = streaming
                ? new StreamingDataset(descriptor.toString(), () -> FileRows.open(storage, files, format))
                : readAll(files, format);
        long budget;
        List<String> resolved;
        try {
            if (streaming) {
                budget = rowLimit != null ? rowLimit : countRows(files, format);
            } else {
                budget = RowBudget.resolve(rowLimit, opened.numRows());
                opened = opened.select(budget);
            }
            resolved = SchemaResolver.resolve(opened, descriptor);
        } catch (RuntimeException e) {
            opened.close();
            throw e;
        }
        rowBudget = budget;
        columns = resolved;
        handle = opened;
        LOGGER.info("Opened {} ({} files, streaming={}) with {} rows, columns {}", descriptor, files.size(), streaming, rowBudget, columns);
    }

    private List<String> filesToLoad(DataFiles dataFiles) {
        if (dataFiles.kind() != DataFiles.Kind.GROUPED) return dataFiles.sequence();
        List<String> names = new ArrayList<>();
        try {
            for (Map.Entry<String, List<String>> group : dataFiles.groups().entrySet()) {
                String name = storage.name(group.getKey());
                if (name.equals(split)) return group.getValue();
                names.add(name);
            }
        } catch (IOException e) {
            throw new SourceUnavailableException(descriptor + ": cannot resolve split directories", e);
        }
        throw new SourceUnavailableException(descriptor + ": no sub-directory for split '" + split + "', available: " + names);
    }

    private InMemoryDataset readAll(List<String> files, FileFormat format) {
        try (RowIterator rows = FileRows.open(storage, files, format)) {
            return InMemoryDataset.fromRows(rows);
        } catch (IOException | UncheckedIOException e) {
            throw failure("cannot read", e);
        }
    }

    private long countRows(List<String> files, FileFormat format) {
        LOGGER.info("Counting rows of {} with a separate pass", descriptor);
        try {
            return FileRows.count(storage, files, format);
        } catch (IOException | UncheckedIOException e) {
            throw failure("cannot count rows of", e);
        }
    }

    private SourceException failure(String what, Exception e) {
        Throwable cause = e instanceof UncheckedIOException u ? u.getCause() : e;
        return new SourceUnavailableException(what + " " + descriptor + ": " + cause.getMessage(), cause);
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
            if (handle != null) handle.close();
        } finally {
            try {
                storage.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
