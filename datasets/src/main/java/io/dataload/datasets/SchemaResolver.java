package io.dataload.datasets;

import io.dataload.core.SourceDescriptor;
import io.dataload.datasets.handle.DatasetHandle;
import io.dataload.error.EmptySourceException;

import java.util.List;

/**
 * Resolves the output columns of a source, from metadata when the source has it (hub datasets)
 * and from the opened handle otherwise.
 */
public final class SchemaResolver {
    private SchemaResolver() {}

    public static List<String> resolve(DatasetInfo info, SourceDescriptor descriptor) {
        return nonEmpty(info.features(), descriptor);
    }

    public static List<String> resolve(DatasetHandle handle, SourceDescriptor descriptor) {
        return nonEmpty(handle.columnNames(), descriptor);
    }

    private static List<String> nonEmpty(List<String> columns, SourceDescriptor descriptor) {
        if (columns.isEmpty()) throw new EmptySourceException(descriptor + ": no columns could be resolved");
        return List.copyOf(columns);
    }
}
