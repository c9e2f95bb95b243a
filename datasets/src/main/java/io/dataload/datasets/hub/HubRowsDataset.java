package io.dataload.datasets.hub;

import io.dataload.core.ColumnarBatch;
import io.dataload.datasets.handle.DatasetHandle;
import io.dataload.error.SchemaViolationException;
import io.dataload.error.SourceUnavailableException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Remote split served page by page from the rows endpoint. Reads seek directly to the requested row.
 */
final class HubRowsDataset implements DatasetHandle {
    private final HttpHubClient client;
    private final String repoId;
    private final String config;
    private final String split;
    private final List<String> features;
    private final long total;
    private final long limit;

    HubRowsDataset(HttpHubClient client, String repoId, String config, String split, List<String> features, long total, long limit) {
        this.client = client;
        this.repoId = repoId;
        this.config = config;
        this.split = split;
        this.features = List.copyOf(features);
        this.total = total;
        this.limit = Math.min(limit, total);
    }

    @Override
    public List<String> columnNames() { return features; }

    @Override
    public long numRows() { return limit; }

    @Override
    public DatasetHandle select(long n) {
        if (n < 0) throw new IllegalArgumentException("cannot select " + n + " rows");
        return new HubRowsDataset(client, repoId, config, split, features, total, Math.min(n, limit));
    }

    @Override
    public ColumnarBatch read(long startRow, int count) {
        Map<String, List<Object>> out = new LinkedHashMap<>();
        for (String f : features) out.put(f, new ArrayList<>(count));
        long end = Math.min(limit, startRow + count);
        long offset = startRow;
        while (offset < end) {
            int length = (int) Math.min(HttpHubClient.MAX_PAGE, end - offset);
            HttpHubClient.RowsPage page;
            try {
                page = client.rows(repoId, config, split, offset, length);
            } catch (IOException e) {
                throw new SourceUnavailableException("cannot read rows " + offset + ".." + (offset + length)
                        + " of " + repoId + "/" + config + "[" + split + "]", e);
            }
            for (Map<String, Object> row : page.rows()) {
                for (String key : row.keySet()) {
                    if (!out.containsKey(key)) {
                        throw new SchemaViolationException(repoId + "/" + config + "[" + split + "]: row " + offset
                                + " has column '" + key + "' outside the features " + features);
                    }
                }
                for (Map.Entry<String, List<Object>> e : out.entrySet()) e.getValue().add(row.get(e.getKey()));
            }
            if (page.rows().isEmpty()) break;
            offset += page.rows().size();
        }
        return new ColumnarBatch(out);
    }
}
