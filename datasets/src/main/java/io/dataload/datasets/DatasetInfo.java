package io.dataload.datasets;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadata of one dataset configuration: its feature (column) names in order and the row count of
 * each split.
 */
public record DatasetInfo(String configName, List<String> features, Map<String, Long> splits) {
    public DatasetInfo {
        features = List.copyOf(features);
        splits = Collections.unmodifiableMap(new LinkedHashMap<>(splits));
    }
}
