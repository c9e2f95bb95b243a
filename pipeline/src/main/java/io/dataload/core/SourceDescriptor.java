package io.dataload.core;

import java.util.Objects;

/**
 * Identifies one dataset instance. Immutable once resolved; used as context in error messages.
 */
public interface SourceDescriptor {

    /** Dataset published on a hub, addressed by repository id. */
    record Hub(String repoId, String config, String split) implements SourceDescriptor {
        public Hub {
            Objects.requireNonNull(repoId, "repoId");
        }

        @Override
        public String toString() {
            return "hub:" + repoId + (config == null ? "" : "/" + config) + "[" + split + "]";
        }
    }

    /** File, flat file collection or directory tree; filetype is null until inferred. */
    record Files(String path, String filetype) implements SourceDescriptor {
        public Files {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public String toString() {
            return "files:" + path + (filetype == null ? "" : " (" + filetype + ")");
        }
    }

    /** Previously saved dataset, dataset dict or distiset. */
    record Snapshot(String path, String config, String split) implements SourceDescriptor {
        public Snapshot {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public String toString() {
            return "snapshot:" + path + (config == null ? "" : "/" + config) + (split == null ? "" : "[" + split + "]");
        }
    }
}
