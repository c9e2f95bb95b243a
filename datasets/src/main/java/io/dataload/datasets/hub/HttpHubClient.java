package io.dataload.datasets.hub;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dataload.datasets.DatasetInfo;
import io.dataload.datasets.handle.DatasetHandle;
import io.dataload.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link HubClient} for the datasets-server HTTP API: {@code /info} for metadata and paged
 * {@code /rows} for data. Non-200 answers of 429 and 5xx, and I/O failures, are retried per the
 * {@link RetryPolicy}.
 */
public class HttpHubClient implements HubClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpHubClient.class);
    private static final TypeReference<LinkedHashMap<String, Object>> ROW = new TypeReference<>() {};

    /** Largest page the rows endpoint serves. */
    static final int MAX_PAGE = 100;

    private final HttpClient http = HttpClient.newHttpClient();
    private final ObjectMapper mapper = new ObjectMapper().enable(DeserializationFeature.USE_LONG_FOR_INTS);
    private final String endpoint;
    private final Duration timeout;
    private final RetryPolicy retry;

    public HttpHubClient(URI endpoint, Duration timeout, RetryPolicy retry) {
        String e = endpoint.toString();
        this.endpoint = e.endsWith("/") ? e.substring(0, e.length() - 1) : e;
        this.timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        this.retry = retry == null ? RetryPolicy.never() : retry;
    }

    /** One page of the rows endpoint. */
    record RowsPage(List<String> features, List<Map<String, Object>> rows, long numRowsTotal) {}

    @Override
    public Map<String, DatasetInfo> datasetInfos(String repoId) throws IOException {
        JsonNode root = mapper.readTree(get("/info?dataset=" + encode(repoId)));
        JsonNode infos = root.path("dataset_info");
        if (!infos.isObject()) throw new IOException("no dataset_info in metadata of " + repoId);
        Map<String, DatasetInfo> out = new LinkedHashMap<>();
        // a config-scoped answer carries the info directly instead of a map of configs
        if (infos.has("features") || infos.has("splits")) {
            DatasetInfo info = parseInfo(infos.path("config_name").asText("default"), infos);
            out.put(info.configName(), info);
            return out;
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = infos.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), parseInfo(e.getKey(), e.getValue()));
        }
        return out;
    }

    private static DatasetInfo parseInfo(String config, JsonNode node) {
        List<String> features = new ArrayList<>();
        node.path("features").fieldNames().forEachRemaining(features::add);
        Map<String, Long> splits = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.path("splits").fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            splits.put(e.getKey(), e.getValue().path("num_examples").asLong());
        }
        return new DatasetInfo(config, features, splits);
    }

    /** Rows are always paged from the server, so streaming and non-streaming handles are the same. */
    @Override
    public DatasetHandle open(String repoId, String config, String split, boolean streaming) throws IOException {
        String cfg = config == null ? "default" : config;
        RowsPage firstPage = rows(repoId, cfg, split, 0, 1);
        LOGGER.debug("Opened {}/{}[{}]: {} rows, features {}", repoId, cfg, split, firstPage.numRowsTotal(), firstPage.features());
        return new HubRowsDataset(this, repoId, cfg, split, firstPage.features(), firstPage.numRowsTotal(), firstPage.numRowsTotal());
    }

    RowsPage rows(String repoId, String config, String split, long offset, int length) throws IOException {
        String query = "/rows?dataset=" + encode(repoId) + "&config=" + encode(config) + "&split=" + encode(split)
                + "&offset=" + offset + "&length=" + Math.min(length, MAX_PAGE);
        JsonNode root = mapper.readTree(get(query));
        List<String> features = new ArrayList<>();
        for (JsonNode f : root.path("features")) features.add(f.path("name").asText());
        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode r : root.path("rows")) rows.add(mapper.convertValue(r.path("row"), ROW));
        return new RowsPage(features, rows, root.path("num_rows_total").asLong(rows.size()));
    }

    private String get(String pathAndQuery) throws IOException {
        URI uri = URI.create(endpoint + pathAndQuery);
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        int attempt = 0;
        while (true) {
            attempt++;
            HttpResponse<String> resp;
            try {
                resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                if (!retry.shouldRetry(attempt, e)) throw e;
                LOGGER.debug("GET {} failed on attempt {}: {}", uri, attempt, e.toString());
                backoff(attempt);
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("interrupted while calling " + uri);
            }
            if (resp.statusCode() == 200) return resp.body();
            IOException failure = new IOException("GET " + uri + " returned HTTP " + resp.statusCode() + ": " + abbreviate(resp.body()));
            boolean transientStatus = resp.statusCode() == 429 || resp.statusCode() >= 500;
            if (!transientStatus || !retry.shouldRetry(attempt, failure)) throw failure;
            LOGGER.debug("GET {} returned HTTP {} on attempt {}", uri, resp.statusCode(), attempt);
            backoff(attempt);
        }
    }

    private void backoff(int attempt) throws InterruptedIOException {
        try {
            Thread.sleep(retry.backoffMillis(attempt));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted during retry backoff");
        }
    }

    private static String encode(String s) { return URLEncoder.encode(s, StandardCharsets.UTF_8); }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
