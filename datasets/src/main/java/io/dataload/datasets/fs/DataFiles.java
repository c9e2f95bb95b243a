package io.dataload.datasets.fs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How the files under a path are grouped: one file, a flat sequence, or per-subdirectory groups.
 * A directory holding both files and sub-directories keeps both; {@link #kind()} then prefers the
 * sequence.
 */
public final class DataFiles {
    public enum Kind { SINGLE, SEQUENCE, GROUPED }

    private final Kind kind;
    private final List<String> sequence;
    private final Map<String, List<String>> groups;

    private DataFiles(Kind kind, List<String> sequence, Map<String, List<String>> groups) {
        this.kind = kind;
        this.sequence = List.copyOf(sequence);
        Map<String, List<String>> g = new LinkedHashMap<>();
        groups.forEach((dir, files) -> g.put(dir, List.copyOf(files)));
        this.groups = Collections.unmodifiableMap(g);
    }

    public static DataFiles single(String file) {
        return new DataFiles(Kind.SINGLE, List.of(file), Map.of());
    }

    public static DataFiles of(List<String> sequence, Map<String, List<String>> groups) {
        if (sequence.isEmpty() && groups.isEmpty()) throw new IllegalArgumentException("no files");
        return new DataFiles(sequence.isEmpty() ? Kind.GROUPED : Kind.SEQUENCE, sequence, groups);
    }

    public Kind kind() { return kind; }

    /** Direct files (or the single file), in name order. */
    public List<String> sequence() { return sequence; }

    /** Sub-directory path to the files directly inside it. */
    public Map<String, List<String>> groups() { return groups; }

    /** First file in depth-first order: the sequence before the groups. */
    public String firstFile() {
        if (!sequence.isEmpty()) return sequence.get(0);
        return groups.values().stream().flatMap(List::stream).findFirst().orElseThrow();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataFiles that)) return false;
        return kind == that.kind && sequence.equals(that.sequence) && groups.equals(that.groups);
    }

    @Override
    public int hashCode() { return sequence.hashCode() * 31 + groups.hashCode(); }

    @Override
    public String toString() {
        return switch (kind) {
            case SINGLE -> "single" + sequence;
            case SEQUENCE -> "sequence" + sequence + (groups.isEmpty() ? "" : " + groups" + groups.keySet());
            case GROUPED -> "grouped" + groups;
        };
    }
}
