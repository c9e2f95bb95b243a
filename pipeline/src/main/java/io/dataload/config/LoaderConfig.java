package io.dataload.config;

import java.net.URI;
import java.time.Duration;

/**
 * Process-wide loader settings. Each value is read from a system property, then an environment
 * variable, then a default.
 */
public record LoaderConfig(
        URI hubEndpoint,
        Duration hubTimeout,
        int hubRetries,
        int defaultBatchSize
) {
    public static final String DEFAULT_HUB_ENDPOINT = "https://datasets-server.huggingface.co";

    public LoaderConfig {
        if (hubRetries < 1) throw new IllegalArgumentException("hubRetries must be >= 1, got " + hubRetries);
        if (defaultBatchSize < 1) throw new IllegalArgumentException("defaultBatchSize must be >= 1, got " + defaultBatchSize);
    }

    public static LoaderConfig defaults() {
        return new LoaderConfig(URI.create(DEFAULT_HUB_ENDPOINT), Duration.ofSeconds(30), 3, 50);
    }

    public static LoaderConfig fromEnv() {
        URI endpoint = URI.create(setting("dataload.hub.endpoint", "DATALOAD_HUB_ENDPOINT", DEFAULT_HUB_ENDPOINT));
        long timeoutMs = Long.parseLong(setting("dataload.hub.timeout.ms", "DATALOAD_HUB_TIMEOUT_MS", "30000"));
        int retries = Integer.parseInt(setting("dataload.hub.retries", "DATALOAD_HUB_RETRIES", "3"));
        int batch = Integer.parseInt(setting("dataload.batch.size", "DATALOAD_BATCH_SIZE", "50"));
        return new LoaderConfig(endpoint, Duration.ofMillis(timeoutMs), retries, batch);
    }

    private static String setting(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }
}
