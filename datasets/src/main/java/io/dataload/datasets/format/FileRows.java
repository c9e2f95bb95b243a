package io.dataload.datasets.format;

import io.dataload.datasets.fs.StorageProvider;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Concatenates the rows of several files of one format, opening each file only when the previous
 * one is exhausted.
 */
public final class FileRows implements RowIterator {
    private final StorageProvider storage;
    private final List<String> files;
    private final FileFormat format;
    private int fileIdx = 0;
    private RowIterator current;

    private FileRows(StorageProvider storage, List<String> files, FileFormat format) {
        this.storage = storage;
        this.files = List.copyOf(files);
        this.format = format;
    }

    public static RowIterator open(StorageProvider storage, List<String> files, FileFormat format) {
        return new FileRows(storage, files, format);
    }

    /** Full pass over the files that only counts rows. */
    public static long count(StorageProvider storage, List<String> files, FileFormat format) throws IOException {
        long n = 0;
        try (RowIterator rows = open(storage, files, format)) {
            while (rows.hasNext()) {
                rows.next();
                n++;
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return n;
    }

    @Override
    public boolean hasNext() {
        while (true) {
            if (current != null && current.hasNext()) return true;
            if (fileIdx >= files.size()) return false;
            try {
                if (current != null) current.close();
                current = null;
                current = format.open(storage, files.get(fileIdx++));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    @Override
    public Map<String, Object> next() {
        if (!hasNext()) throw new NoSuchElementException();
        return current.next();
    }

    @Override
    public void close() throws IOException {
        if (current != null) current.close();
        current = null;
        fileIdx = files.size();
    }
}
