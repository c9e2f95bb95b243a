package io.dataload.datasets;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.dataload.batch.BatchProducer;
import io.dataload.config.LoaderConfig;
import io.dataload.core.SourceAdapter;
import io.dataload.datasets.fs.FilesystemSource;
import io.dataload.datasets.hub.HttpHubClient;
import io.dataload.datasets.hub.HubClient;
import io.dataload.datasets.hub.HubSource;
import io.dataload.datasets.snapshot.SnapshotSource;
import io.dataload.retry.ExponentialBackoffRetryPolicy;
import io.dataload.retry.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DatasetsModuleTest {

    @Test
    void wires_singletons_from_config() {
        LoaderConfig config = LoaderConfig.defaults();
        Injector injector = Guice.createInjector(new DatasetsModule(config));
        assertSame(config, injector.getInstance(LoaderConfig.class));
        assertInstanceOf(HttpHubClient.class, injector.getInstance(HubClient.class));
        assertSame(injector.getInstance(HubClient.class), injector.getInstance(HubClient.class));
        RetryPolicy retry = injector.getInstance(RetryPolicy.class);
        assertEquals(config.hubRetries(), ((ExponentialBackoffRetryPolicy) retry).maxAttempts());
    }

    @Test
    void factory_builds_the_adapter_for_each_kind() {
        SourceFactory factory = Guice.createInjector(new DatasetsModule(LoaderConfig.defaults())).getInstance(SourceFactory.class);
        assertInstanceOf(HubSource.class, factory.adapter(LoadRequest.builder(SourceKind.HUB, "org/ds").build()));
        assertInstanceOf(FilesystemSource.class, factory.adapter(LoadRequest.builder(SourceKind.FILESYSTEM, "/data").build()));
        assertInstanceOf(SnapshotSource.class, factory.adapter(LoadRequest.builder(SourceKind.SNAPSHOT, "/snap").build()));
    }

    @Test
    void producer_reports_into_the_shared_registry() throws Exception {
        Injector injector = Guice.createInjector(new DatasetsModule(LoaderConfig.defaults()));
        SourceFactory factory = injector.getInstance(SourceFactory.class);
        Path file = Files.writeString(Files.createTempDirectory("module").resolve("lines.txt"), "a\nb\nc\n");
        LoadRequest request = LoadRequest.builder(SourceKind.FILESYSTEM, file.toString()).batchSize(2).offset(1).build();
        try (SourceAdapter adapter = factory.adapter(request)) {
            adapter.open();
            BatchProducer producer = factory.producer(adapter, request);
            List<Object> rows = new ArrayList<>();
            producer.produce(request.offset()).forEachRemaining(b -> b.rows().forEach(r -> rows.add(r.get("text"))));
            assertEquals(List.of("b", "c"), rows);
        }
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);
        assertEquals(2, registry.meter("producer.rows").getCount());
        assertEquals(1, registry.meter("producer.rows.discarded").getCount());
    }

    @Test
    void request_rejects_invalid_values() {
        assertThrows(IllegalArgumentException.class, () -> LoadRequest.builder(SourceKind.HUB, "x").batchSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> LoadRequest.builder(SourceKind.HUB, "x").offset(-1).build());
        assertThrows(IllegalArgumentException.class, () -> LoadRequest.builder(SourceKind.HUB, "x").rowLimit(-1L).build());
    }
}
