package io.dataload.datasets.hub;

import io.dataload.datasets.DatasetInfo;
import io.dataload.datasets.handle.DatasetHandle;

import java.io.IOException;
import java.util.Map;

/**
 * Access to datasets published on a hub: a lightweight metadata query and the dataset rows themselves.
 */
public interface HubClient {
    /**
     * Metadata of every configuration of a dataset, keyed by config name ("default" for datasets
     * without named configs). Transfers no row data.
     */
    Map<String, DatasetInfo> datasetInfos(String repoId) throws IOException;

    /**
     * Opens one split of one configuration for reading.
     *
     * @param config config name, or null for the default one
     * @param streaming whether rows are read lazily; streaming handles need not know their size
     */
    DatasetHandle open(String repoId, String config, String split, boolean streaming) throws IOException;
}
