package io.dataload.datasets.format;

import io.dataload.datasets.fs.StorageProvider;

import java.io.IOException;
import java.io.Reader;

/** Format of UTF-8 text files, parsed from a character stream. */
public abstract class TextFileFormat implements FileFormat {

    @Override
    public RowIterator open(StorageProvider storage, String file) throws IOException {
        return open(storage.openReader(file), file);
    }

    /**
     * @param reader   file contents; closed together with the returned iterator
     * @param location file path for error messages
     */
    public abstract RowIterator open(Reader reader, String location) throws IOException;
}
