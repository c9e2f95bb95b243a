package io.dataload.datasets.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dataload.config.LoaderConfig;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LoadDatasetMainTest {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        LoadDatasetMain main = new LoadDatasetMain(LoaderConfig.defaults(),
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
        return LoadDatasetMain.commandLine(main).execute(args);
    }

    private static Path csvFile(int rows) throws Exception {
        StringBuilder sb = new StringBuilder("id,name\n");
        for (int i = 0; i < rows; i++) sb.append(i).append(",name-").append(i).append('\n');
        return Files.writeString(Files.createTempDirectory("cli-in").resolve("people.csv"), sb.toString());
    }

    @Test
    void loads_files_into_jsonl_output() throws Exception {
        Path in = csvFile(7);
        Path target = Files.createTempDirectory("cli-out").resolve("rows.jsonl");
        int code = run(in.toString(), "--kind", "filesystem", "--batch-size", "3", "--limit", "5", "-o", target.toString());
        assertEquals(0, code, err.toString(StandardCharsets.UTF_8));
        List<String> lines = Files.readAllLines(target);
        assertEquals(5, lines.size());
        assertEquals(Map.of("id", 0, "name", "name-0"), new ObjectMapper().readValue(lines.get(0), Map.class));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("batches=2 rows=5"));
    }

    @Test
    void offset_resumes_and_appends() throws Exception {
        Path in = csvFile(6);
        Path target = Files.createTempDirectory("cli-resume").resolve("rows.jsonl");
        Files.writeString(target, "{\"id\":0,\"name\":\"name-0\"}\n{\"id\":1,\"name\":\"name-1\"}\n");
        int code = run(in.toString(), "-k", "FILESYSTEM", "-b", "2", "--offset", "2", "--out", target.toString());
        assertEquals(0, code);
        List<String> lines = Files.readAllLines(target);
        assertEquals(6, lines.size());
        assertTrue(lines.get(2).contains("\"name-2\""));
    }

    @Test
    void writes_to_stdout_without_out_option() throws Exception {
        Path in = csvFile(2);
        int code = run(in.toString(), "--kind", "filesystem", "--streaming");
        assertEquals(0, code);
        String stdout = out.toString(StandardCharsets.UTF_8);
        assertTrue(stdout.contains("{\"id\":1,\"name\":\"name-1\"}"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("rows=2"));
    }

    @Test
    void source_errors_exit_with_two() throws Exception {
        Path missing = Files.createTempDirectory("cli-missing").resolve("nothing.csv");
        int code = run(missing.toString(), "--kind", "filesystem");
        assertEquals(2, code);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("nothing.csv"));
    }

    @Test
    void unwritable_output_exits_with_two() throws Exception {
        Path in = csvFile(3);
        Path underFile = in.resolve("rows.jsonl");
        int code = run(in.toString(), "--kind", "filesystem", "--out", underFile.toString());
        assertEquals(2, code);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Cannot write"));
    }

    @Test
    void invalid_limit_exits_with_two() throws Exception {
        Path in = csvFile(1);
        assertEquals(2, run(in.toString(), "--kind", "filesystem", "--limit=-3"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("row limit"));
    }
}
