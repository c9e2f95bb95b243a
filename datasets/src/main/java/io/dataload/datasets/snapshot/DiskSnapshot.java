package io.dataload.datasets.snapshot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dataload.datasets.format.FileFormats;
import io.dataload.datasets.format.FileRows;
import io.dataload.datasets.format.RowIterator;
import io.dataload.datasets.fs.StorageProvider;
import io.dataload.datasets.handle.InMemoryDataset;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A dataset saved to disk, or a dictionary of them: a dataset dict keyed by split, or a distiset
 * keyed by config. Children are loaded on first access.
 *
 * <p>A dataset directory holds {@code state.json} listing its data files, each an Arrow IPC stream,
 * and an optional {@code dataset_info.json} giving the column order. A dataset dict holds
 * {@code dataset_dict.json} and one dataset directory per split. A distiset holds one entry per config next to a
 * {@code distiset_configs} metadata directory.
 */
public final class DiskSnapshot {
    static final String STATE = "state.json";
    static final String INFO = "dataset_info.json";
    static final String DICT = "dataset_dict.json";
    static final String DISTISET_CONFIGS = "distiset_configs";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final StorageProvider storage;
    private final String path;
    private final Map<String, String> children;
    private InMemoryDataset dataset;

    private DiskSnapshot(StorageProvider storage, String path, Map<String, String> children) {
        this.storage = storage;
        this.path = path;
        this.children = children;
    }

    /**
     * Inspects the directory at {@code path}. Only the top level is read as a distiset when
     * {@code distiset} is set.
     *
     * @throws IOException if the directory is missing or is not a saved dataset
     */
    public static DiskSnapshot load(StorageProvider storage, String path, boolean distiset) throws IOException {
        if (!storage.isDirectory(path)) throw new IOException("no snapshot directory at " + path);
        if (storage.exists(storage.child(path, STATE))) return new DiskSnapshot(storage, path, null);
        if (storage.exists(storage.child(path, DICT))) {
            Map<String, String> splits = new LinkedHashMap<>();
            for (JsonNode split : readJson(storage, storage.child(path, DICT)).path("splits")) {
                splits.put(split.asText(), storage.child(path, split.asText()));
            }
            return new DiskSnapshot(storage, path, splits);
        }
        if (distiset) {
            Map<String, String> configs = new LinkedHashMap<>();
            for (String child : storage.list(path)) {
                String name = storage.name(child);
                if (storage.isDirectory(child) && !name.equals(DISTISET_CONFIGS)) configs.put(name, child);
            }
            return new DiskSnapshot(storage, path, configs);
        }
        throw new IOException(path + " has neither " + STATE + " nor " + DICT);
    }

    public String path() { return path; }

    public boolean isDataset() { return children == null; }

    /** Child names: splits of a dataset dict, configs of a distiset. Empty for a dataset. */
    public List<String> keys() { return children == null ? List.of() : new ArrayList<>(children.keySet()); }

    /** The child under {@code key}, or null when there is none. */
    public DiskSnapshot get(String key) throws IOException {
        if (children == null) return null;
        String child = children.get(key);
        return child == null ? null : load(storage, child, false);
    }

    /** Reads the data files of a dataset snapshot, once. */
    public InMemoryDataset dataset() throws IOException {
        if (!isDataset()) throw new IllegalStateException(path + " is a dictionary of " + keys() + ", not a dataset");
        if (dataset == null) {
            List<String> files = new ArrayList<>();
            for (JsonNode f : readJson(storage, storage.child(path, STATE)).path("_data_files")) {
                files.add(storage.child(path, f.path("filename").asText()));
            }
            try (RowIterator rows = FileRows.open(storage, files, FileFormats.forType("arrow"))) {
                dataset = InMemoryDataset.fromRows(rows);
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }
            List<String> order = featureOrder();
            if (!order.isEmpty()) dataset = dataset.withColumnOrder(order);
        }
        return dataset;
    }

    private List<String> featureOrder() throws IOException {
        String info = storage.child(path, INFO);
        if (!storage.exists(info)) return List.of();
        List<String> order = new ArrayList<>();
        readJson(storage, info).path("features").fieldNames().forEachRemaining(order::add);
        return order;
    }

    private static JsonNode readJson(StorageProvider storage, String file) throws IOException {
        try (Reader in = storage.openReader(file)) {
            return MAPPER.readTree(in);
        }
    }

    @Override
    public String toString() {
        return isDataset() ? "DiskSnapshot[dataset " + path + "]" : "DiskSnapshot[" + path + " " + keys() + "]";
    }
}
