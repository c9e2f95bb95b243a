package io.dataload.datasets.format;

import io.dataload.datasets.fs.StorageProvider;
import org.apache.parquet.io.DelegatingSeekableInputStream;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.SeekableInputStream;

import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;

/**
 * Parquet {@link InputFile} reading through a {@link StorageProvider}, so Parquet files on any
 * supported filesystem can be read without a Hadoop filesystem.
 */
final class StorageInputFile implements InputFile {
    private final StorageProvider storage;
    private final String path;
    private long length = -1;

    StorageInputFile(StorageProvider storage, String path) {
        this.storage = storage;
        this.path = path;
    }

    @Override
    public long getLength() throws IOException {
        if (length < 0) {
            try (SeekableByteChannel channel = storage.openChannel(path)) {
                length = channel.size();
            }
        }
        return length;
    }

    @Override
    public SeekableInputStream newStream() throws IOException {
        return new ChannelSeekableInputStream(storage.openChannel(path));
    }

    @Override
    public String toString() { return path; }

    private static final class ChannelSeekableInputStream extends DelegatingSeekableInputStream {
        private final SeekableByteChannel channel;

        ChannelSeekableInputStream(SeekableByteChannel channel) {
            super(Channels.newInputStream(channel));
            this.channel = channel;
        }

        @Override
        public long getPos() throws IOException { return channel.position(); }

        @Override
        public void seek(long newPos) throws IOException { channel.position(newPos); }
    }
}
