package io.dataload.datasets.format;

import io.dataload.datasets.fs.StorageProvider;

import java.io.IOException;

/**
 * Parses the contents of one file into rows.
 */
public interface FileFormat {
    /** Canonical filetype, e.g. "json". */
    String name();

    /**
     * Opens {@code file} for reading; the file stays open until the returned iterator is closed.
     *
     * @param file path understood by {@code storage}, also used in error messages
     */
    RowIterator open(StorageProvider storage, String file) throws IOException;
}
