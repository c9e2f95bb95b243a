package io.dataload.datasets.fs;

import io.dataload.error.SourceUnavailableException;
import io.dataload.error.UnresolvableFiletypeException;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PathClassifierTest {
    private final PathClassifier classifier = new PathClassifier(new NioStorageProvider());

    @Test
    void single_file_with_jsonl_extension_reads_as_json() throws Exception {
        Path dir = Files.createTempDirectory("cls-single");
        Path file = Files.writeString(dir.resolve("data.jsonl"), "{\"a\":1}\n");
        PathClassifier.Classification c = classifier.classify(file.toString());
        assertEquals(DataFiles.Kind.SINGLE, c.files().kind());
        assertEquals(List.of(file.toString()), c.files().sequence());
        assertEquals("json", c.filetype());
    }

    @Test
    void flat_directory_is_a_sequence_in_name_order() throws Exception {
        Path dir = Files.createTempDirectory("cls-flat");
        Path b = Files.writeString(dir.resolve("b.csv"), "x\n2\n");
        Path a = Files.writeString(dir.resolve("a.csv"), "x\n1\n");
        PathClassifier.Classification c = classifier.classify(dir.toString());
        assertEquals(DataFiles.Kind.SEQUENCE, c.files().kind());
        assertEquals(List.of(a.toString(), b.toString()), c.files().sequence());
        assertTrue(c.files().groups().isEmpty());
        assertEquals("csv", c.filetype());
    }

    @Test
    void split_directories_are_grouped() throws Exception {
        Path dir = Files.createTempDirectory("cls-grouped");
        Files.createDirectories(dir.resolve("train"));
        Files.createDirectories(dir.resolve("test"));
        Path train = Files.writeString(dir.resolve("train").resolve("part-0.txt"), "hello\n");
        Path test = Files.writeString(dir.resolve("test").resolve("part-0.txt"), "bye\n");
        PathClassifier.Classification c = classifier.classify(dir.toString());
        assertEquals(DataFiles.Kind.GROUPED, c.files().kind());
        assertEquals(List.of(dir.resolve("test").toString(), dir.resolve("train").toString()),
                List.copyOf(c.files().groups().keySet()));
        assertEquals(List.of(train.toString()), c.files().groups().get(dir.resolve("train").toString()));
        assertEquals(List.of(test.toString()), c.files().groups().get(dir.resolve("test").toString()));
        assertEquals("text", c.filetype());
    }

    @Test
    void files_next_to_subdirectories_prefer_the_sequence() throws Exception {
        Path dir = Files.createTempDirectory("cls-mixed");
        Files.createDirectories(dir.resolve("extra"));
        Files.writeString(dir.resolve("extra").resolve("x.csv"), "x\n1\n");
        Path top = Files.writeString(dir.resolve("top.tsv"), "x\n1\n");
        PathClassifier.Classification c = classifier.classify(dir.toString());
        assertEquals(DataFiles.Kind.SEQUENCE, c.files().kind());
        assertEquals(List.of(top.toString()), c.files().sequence());
        assertEquals(1, c.files().groups().size());
        assertEquals("tsv", c.filetype());
    }

    @Test
    void empty_directory_cannot_be_classified() throws Exception {
        Path dir = Files.createTempDirectory("cls-empty");
        Files.createDirectories(dir.resolve("nothing-here"));
        assertThrows(UnresolvableFiletypeException.class, () -> classifier.classify(dir.toString()));
    }

    @Test
    void missing_path_is_unavailable() throws Exception {
        Path dir = Files.createTempDirectory("cls-missing");
        var ex = assertThrows(SourceUnavailableException.class, () -> classifier.classify(dir.resolve("nope").toString()));
        assertTrue(ex.getMessage().contains("nope"));
    }

    @Test
    void file_without_extension_has_empty_filetype() throws Exception {
        Path dir = Files.createTempDirectory("cls-noext");
        Path file = Files.writeString(dir.resolve("README"), "hi\n");
        assertEquals("", classifier.classify(file.toString()).filetype());
    }
}
