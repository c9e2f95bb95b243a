package io.dataload.datasets;

/** Where a dataset is loaded from. */
public enum SourceKind {
    HUB,
    FILESYSTEM,
    SNAPSHOT
}
