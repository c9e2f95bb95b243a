package io.dataload.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class LoaderConfigTest {
    @AfterEach
    void clear() {
        System.clearProperty("dataload.hub.endpoint");
        System.clearProperty("dataload.batch.size");
    }

    @Test
    void system_properties_override_defaults() {
        System.setProperty("dataload.hub.endpoint", "http://127.0.0.1:9999");
        System.setProperty("dataload.batch.size", "7");
        LoaderConfig cfg = LoaderConfig.fromEnv();
        assertEquals("http://127.0.0.1:9999", cfg.hubEndpoint().toString());
        assertEquals(7, cfg.defaultBatchSize());
    }

    @Test
    void defaults_are_valid() {
        LoaderConfig cfg = LoaderConfig.defaults();
        assertEquals(LoaderConfig.DEFAULT_HUB_ENDPOINT, cfg.hubEndpoint().toString());
        assertEquals(Duration.ofSeconds(30), cfg.hubTimeout());
        assertThrows(IllegalArgumentException.class, () -> new LoaderConfig(cfg.hubEndpoint(), cfg.hubTimeout(), 3, 0));
    }
}
