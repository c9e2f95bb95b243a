package io.dataload.datasets.format;

import io.dataload.datasets.fs.NioStorageProvider;
import io.dataload.error.SchemaViolationException;
import io.dataload.error.UnresolvableFiletypeException;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FileFormatsTest {

    private static List<Map<String, Object>> readFile(String filetype, Path file) throws Exception {
        List<Map<String, Object>> out = new ArrayList<>();
        try (RowIterator rows = FileFormats.forType(filetype).open(new NioStorageProvider(), file.toString())) {
            rows.forEachRemaining(out::add);
        }
        return out;
    }

    private static List<Map<String, Object>> readAll(TextFileFormat format, String content) throws Exception {
        List<Map<String, Object>> out = new ArrayList<>();
        try (RowIterator rows = format.open(new StringReader(content), "test-input")) {
            rows.forEachRemaining(out::add);
        }
        return out;
    }

    @Test
    void synonyms_resolve_to_formats() {
        assertEquals("json", FileFormats.forType("jsonl").name());
        assertEquals("json", FileFormats.forType("JSON").name());
        assertEquals("text", FileFormats.forType("txt").name());
        assertEquals("tsv", FileFormats.forType("tsv").name());
        assertEquals("parquet", FileFormats.forType("Parquet").name());
        assertEquals("arrow", FileFormats.forType("arrow").name());
        var ex = assertThrows(UnresolvableFiletypeException.class, () -> FileFormats.forType("orc"));
        assertTrue(ex.getMessage().contains("orc"));
        assertTrue(ex.getMessage().contains("parquet"));
    }

    @Test
    void json_lines_keep_key_order_and_read_ints_as_long() throws Exception {
        List<Map<String, Object>> rows = readAll(new JsonFormat(), "{\"b\":1,\"a\":\"x\"}\n{\"b\":2.5,\"a\":null}\n");
        assertEquals(2, rows.size());
        assertEquals(List.of("b", "a"), new ArrayList<>(rows.get(0).keySet()));
        assertEquals(1L, rows.get(0).get("b"));
        assertEquals(2.5, rows.get(1).get("b"));
        assertNull(rows.get(1).get("a"));
    }

    @Test
    void json_top_level_array_is_unwrapped() throws Exception {
        List<Map<String, Object>> rows = readAll(new JsonFormat(), "[{\"id\":1},{\"id\":2},{\"id\":3}]");
        assertEquals(List.of(1L, 2L, 3L), rows.stream().map(r -> r.get("id")).toList());
    }

    @Test
    void invalid_json_surfaces_as_io_failure() {
        assertThrows(UncheckedIOException.class, () -> readAll(new JsonFormat(), "{\"id\":1}\n{oops\n"));
    }

    @Test
    void csv_cells_are_typed() throws Exception {
        List<Map<String, Object>> rows = readAll(CsvFormat.csv(), "name,n,score,ok,note\n\"Smith, J\",3,0.5,True,\n");
        Map<String, Object> row = rows.get(0);
        assertEquals("Smith, J", row.get("name"));
        assertEquals(3L, row.get("n"));
        assertEquals(0.5, row.get("score"));
        assertEquals(Boolean.TRUE, row.get("ok"));
        assertNull(row.get("note"));
    }

    @Test
    void tsv_uses_tabs() throws Exception {
        List<Map<String, Object>> rows = readAll(CsvFormat.tsv(), "a\tb\nx,y\t2\n");
        assertEquals("x,y", rows.get(0).get("a"));
        assertEquals(2L, rows.get(0).get("b"));
    }

    @Test
    void csv_record_with_wrong_field_count_is_a_schema_violation() {
        var ex = assertThrows(SchemaViolationException.class, () -> readAll(CsvFormat.csv(), "a,b\n1,2\n3\n"));
        assertTrue(ex.getMessage().contains("test-input"));
    }

    @Test
    void text_yields_one_row_per_line() throws Exception {
        List<Map<String, Object>> rows = readAll(new TextFormat(), "first line\nsecond, line\n");
        assertEquals(List.of(Map.of("text", "first line"), Map.of("text", "second, line")), rows);
    }

    @Test
    void arrow_stream_batches_read_as_one_row_sequence() throws Exception {
        Path file = Files.createTempDirectory("fmt-arrow").resolve("data.arrow");
        ArrowFixtures.writeTextAndId(file, Arrays.asList("a", null, "c"), List.of(7L, 8L, 9L), 2);
        List<Map<String, Object>> rows = readFile("arrow", file);
        assertEquals(List.of("text", "id"), new ArrayList<>(rows.get(0).keySet()));
        assertEquals(List.of(7L, 8L, 9L), rows.stream().map(r -> r.get("id")).toList());
        assertEquals("a", rows.get(0).get("text"));
        assertNull(rows.get(1).get("text"));
        assertEquals("c", rows.get(2).get("text"));
    }

    @Test
    void parquet_records_become_rows_in_schema_order() throws Exception {
        Schema schema = SchemaBuilder.record("row").fields()
                .requiredInt("id")
                .optionalString("name")
                .requiredFloat("score")
                .endRecord();
        Path file = Files.createTempDirectory("fmt-parquet").resolve("part-0.parquet");
        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter
                .<GenericRecord>builder(new org.apache.hadoop.fs.Path(file.toUri()))
                .withSchema(schema)
                .withCompressionCodec(CompressionCodecName.UNCOMPRESSED)
                .build()) {
            for (int i = 0; i < 3; i++) {
                GenericRecord record = new GenericData.Record(schema);
                record.put("id", i);
                record.put("name", i == 1 ? null : "name-" + i);
                record.put("score", i + 0.5f);
                writer.write(record);
            }
        }
        List<Map<String, Object>> rows = readFile("parquet", file);
        assertEquals(3, rows.size());
        assertEquals(List.of("id", "name", "score"), new ArrayList<>(rows.get(0).keySet()));
        assertEquals(List.of(0L, 1L, 2L), rows.stream().map(r -> r.get("id")).toList());
        assertEquals("name-2", rows.get(2).get("name"));
        assertNull(rows.get(1).get("name"));
        assertEquals(1.5, rows.get(1).get("score"));
    }
}
