package io.dataload.datasets.fs;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.channels.SeekableByteChannel;
import java.util.List;

/**
 * Storage abstraction over local and remote filesystems. Paths are plain strings as understood by
 * the implementation (file paths or URIs).
 */
public interface StorageProvider extends Closeable {

    boolean exists(String path) throws IOException;

    boolean isFile(String path) throws IOException;

    boolean isDirectory(String path) throws IOException;

    /**
     * Lists the immediate children of a directory, sorted by name.
     *
     * @param directory The directory path
     * @return Child paths, usable with every other method of this provider
     * @throws IOException If the directory cannot be listed
     */
    List<String> list(String directory) throws IOException;

    /** Opens a UTF-8 reader over a file. */
    Reader openReader(String path) throws IOException;

    InputStream openInputStream(String path) throws IOException;

    /** Opens a file for random-access reads, as columnar formats need to jump to their footer. */
    SeekableByteChannel openChannel(String path) throws IOException;

    /** Path of {@code name} inside {@code directory}. */
    String child(String directory, String name) throws IOException;

    /** Last segment of a path, e.g. the split name of a split directory. */
    String name(String path) throws IOException;

    @Override
    default void close() throws IOException {}
}
