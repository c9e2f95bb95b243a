package io.dataload.datasets;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.dataload.config.LoaderConfig;
import io.dataload.datasets.hub.HttpHubClient;
import io.dataload.datasets.hub.HubClient;
import io.dataload.metrics.Metrics;
import io.dataload.retry.ExponentialBackoffRetryPolicy;
import io.dataload.retry.RetryPolicy;

public class DatasetsModule extends AbstractModule {
    private final LoaderConfig config;

    public DatasetsModule(LoaderConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(LoaderConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton RetryPolicy retryPolicy() { return new ExponentialBackoffRetryPolicy(config.hubRetries(), 200, 5_000); }

    @Provides @Singleton HubClient hubClient(RetryPolicy retry) { return new HttpHubClient(config.hubEndpoint(), config.hubTimeout(), retry); }
}
