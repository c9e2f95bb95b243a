package io.dataload.datasets.fs;

import io.dataload.datasets.format.FileFormats;
import io.dataload.error.SourceUnavailableException;
import io.dataload.error.UnresolvableFiletypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides how a path is loaded: a single file, a flat collection of the files in a directory, or
 * one collection per sub-directory (used to express per-split file sets). The filetype comes from
 * the extension of the first file found.
 */
public class PathClassifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(PathClassifier.class);

    /** Grouping plus the inferred filetype; the filetype is empty for files without an extension. */
    public record Classification(DataFiles files, String filetype) {}

    private final StorageProvider storage;

    public PathClassifier(StorageProvider storage) {
        this.storage = storage;
    }

    public Classification classify(String path) {
        try {
            if (storage.isFile(path)) {
                return new Classification(DataFiles.single(path), filetypeOf(storage.name(path)));
            }
            if (!storage.isDirectory(path)) {
                throw new SourceUnavailableException("path does not exist or is not a file or directory: " + path);
            }
            List<String> sequence = new ArrayList<>();
            Map<String, List<String>> groups = new LinkedHashMap<>();
            for (String child : storage.list(path)) {
                if (storage.isFile(child)) {
                    sequence.add(child);
                } else if (storage.isDirectory(child)) {
                    List<String> files = new ArrayList<>();
                    for (String f : storage.list(child)) {
                        if (storage.isFile(f)) files.add(f);
                    }
                    if (!files.isEmpty()) groups.put(child, files);
                }
            }
            if (sequence.isEmpty() && groups.isEmpty()) {
                throw new UnresolvableFiletypeException("no files under " + path + " to infer a filetype from");
            }
            DataFiles files = DataFiles.of(sequence, groups);
            String filetype = filetypeOf(storage.name(files.firstFile()));
            LOGGER.debug("Classified {} as {} with filetype '{}'", path, files, filetype);
            return new Classification(files, filetype);
        } catch (IOException e) {
            throw new SourceUnavailableException("cannot inspect " + path, e);
        }
    }

    static String filetypeOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) return "";
        return FileFormats.filetypeOf(fileName.substring(dot + 1));
    }
}
