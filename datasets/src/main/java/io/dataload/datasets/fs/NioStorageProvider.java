package io.dataload.datasets.fs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.net.URI;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.FileSystemAlreadyExistsException;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.ProviderNotFoundException;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * {@link StorageProvider} on top of java.nio. Plain paths and {@code file:} URIs use the default
 * filesystem; any other URI scheme is served by the installed {@link java.nio.file.spi.FileSystemProvider}
 * for it, created with the storage options as its environment. The options are passed through as is.
 */
public class NioStorageProvider implements StorageProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(NioStorageProvider.class);
    private static final Pattern URI_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:");

    private final Map<String, ?> storageOptions;
    private final List<FileSystem> opened = new ArrayList<>();

    public NioStorageProvider() { this(Map.of()); }

    public NioStorageProvider(Map<String, ?> storageOptions) {
        this.storageOptions = storageOptions == null ? Map.of() : Map.copyOf(storageOptions);
    }

    Path resolve(String location) throws IOException {
        // a drive letter such as C: is not a scheme
        if (!URI_SCHEME.matcher(location).find() || location.matches("^[a-zA-Z]:[\\\\/].*")) {
            return Path.of(location);
        }
        URI uri = URI.create(location);
        if ("file".equalsIgnoreCase(uri.getScheme())) return Path.of(uri);
        try {
            return Path.of(uri);
        } catch (FileSystemNotFoundException e) {
            newFileSystem(uri);
            return Path.of(uri);
        } catch (IllegalArgumentException e) {
            throw new IOException("unsupported location " + location, e);
        }
    }

    private void newFileSystem(URI uri) throws IOException {
        try {
            FileSystem fs = FileSystems.newFileSystem(uri, storageOptions);
            opened.add(fs);
            LOGGER.debug("Created {} filesystem for {}", uri.getScheme(), uri);
        } catch (FileSystemAlreadyExistsException e) {
            LOGGER.debug("Filesystem for {} already exists", uri);
        } catch (ProviderNotFoundException e) {
            throw new IOException("no filesystem provider installed for scheme '" + uri.getScheme()
                    + "', add an NIO FileSystemProvider for it to the classpath", e);
        }
    }

    private static String asString(Path p) {
        if (p.getFileSystem() == FileSystems.getDefault()) return p.toString();
        return p.toUri().toString();
    }

    @Override
    public boolean exists(String path) throws IOException { return Files.exists(resolve(path)); }

    @Override
    public boolean isFile(String path) throws IOException { return Files.isRegularFile(resolve(path)); }

    @Override
    public boolean isDirectory(String path) throws IOException { return Files.isDirectory(resolve(path)); }

    @Override
    public List<String> list(String directory) throws IOException {
        try (Stream<Path> children = Files.list(resolve(directory))) {
            return children
                    .sorted(Comparator.comparing(p -> String.valueOf(p.getFileName())))
                    .map(NioStorageProvider::asString)
                    .toList();
        }
    }

    @Override
    public Reader openReader(String path) throws IOException {
        return Files.newBufferedReader(resolve(path), StandardCharsets.UTF_8);
    }

    @Override
    public InputStream openInputStream(String path) throws IOException {
        return Files.newInputStream(resolve(path));
    }

    @Override
    public SeekableByteChannel openChannel(String path) throws IOException {
        return Files.newByteChannel(resolve(path), StandardOpenOption.READ);
    }

    @Override
    public String child(String directory, String name) throws IOException {
        return asString(resolve(directory).resolve(name));
    }

    @Override
    public String name(String path) throws IOException {
        Path fileName = resolve(path).getFileName();
        if (fileName == null) return "";
        String n = fileName.toString();
        return n.endsWith("/") ? n.substring(0, n.length() - 1) : n;
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (FileSystem fs : opened) {
            try {
                fs.close();
            } catch (IOException e) {
                if (failure == null) failure = e; else failure.addSuppressed(e);
            }
        }
        opened.clear();
        if (failure != null) throw failure;
    }
}
