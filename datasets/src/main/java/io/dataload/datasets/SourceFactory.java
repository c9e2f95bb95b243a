package io.dataload.datasets;

import com.google.inject.Inject;
import io.dataload.batch.BatchProducer;
import io.dataload.core.SourceAdapter;
import io.dataload.datasets.fs.FilesystemSource;
import io.dataload.datasets.fs.NioStorageProvider;
import io.dataload.datasets.hub.HubClient;
import io.dataload.datasets.hub.HubSource;
import io.dataload.datasets.snapshot.SnapshotSource;
import io.dataload.metrics.Metrics;

/**
 * Builds the source adapter and batch producer for a {@link LoadRequest}.
 */
public class SourceFactory {
    private final HubClient hubClient;
    private final Metrics metrics;

    @Inject
    public SourceFactory(HubClient hubClient, Metrics metrics) {
        this.hubClient = hubClient;
        this.metrics = metrics;
    }

    /** Unopened adapter for the request; the caller owns and closes it. */
    public SourceAdapter adapter(LoadRequest request) {
        return switch (request.kind()) {
            case HUB -> new HubSource(hubClient, request.location(), request.config(), request.split(),
                    request.streaming(), request.rowLimit());
            case FILESYSTEM -> new FilesystemSource(new NioStorageProvider(request.storageOptions()), request.location(),
                    request.filetype(), request.split(), request.streaming(), request.rowLimit());
            case SNAPSHOT -> new SnapshotSource(new NioStorageProvider(request.storageOptions()), request.location(),
                    request.config(), request.split(), request.distiset(), request.streaming(), request.rowLimit());
        };
    }

    public BatchProducer producer(SourceAdapter adapter, LoadRequest request) {
        return new BatchProducer(adapter, request.batchSize(), metrics);
    }
}
