package io.dataload.datasets.handle;

import io.dataload.core.ColumnarBatch;
import io.dataload.error.SchemaViolationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryDatasetTest {

    @Test
    void from_rows_unions_columns_and_fills_nulls() {
        List<Map<String, Object>> rows = List.of(
                Map.of("a", 1L),
                new LinkedHashMap<>(Map.of("b", "x")),
                Map.of("a", 3L));
        InMemoryDataset ds = InMemoryDataset.fromRows(rows.iterator());
        assertEquals(List.of("a", "b"), ds.columnNames());
        assertEquals(3, ds.numRows());
        ColumnarBatch all = ds.read(0, 3);
        assertEquals(Arrays.asList(1L, null, 3L), all.column("a"));
        assertEquals(Arrays.asList(null, "x", null), all.column("b"));
    }

    @Test
    void select_limits_rows_seen_by_reads() {
        Map<String, List<Object>> cols = new LinkedHashMap<>();
        cols.put("id", List.of(0L, 1L, 2L, 3L, 4L));
        InMemoryDataset ds = new InMemoryDataset(cols);
        InMemoryDataset first3 = ds.select(3);
        assertEquals(3, first3.numRows());
        assertEquals(List.of(2L), first3.read(2, 10).column("id"));
        assertEquals(0, first3.read(3, 10).numRows());
        assertEquals(5, ds.select(50).numRows());
        assertThrows(IllegalArgumentException.class, () -> ds.select(-1));
    }

    @Test
    void unequal_columns_are_rejected() {
        Map<String, List<Object>> cols = new LinkedHashMap<>();
        cols.put("a", List.of(1L, 2L));
        cols.put("b", List.of(1L));
        var ex = assertThrows(SchemaViolationException.class, () -> new InMemoryDataset(cols));
        assertTrue(ex.getMessage().contains("'b'"));
    }

    @Test
    void column_order_can_be_imposed() {
        Map<String, List<Object>> cols = new LinkedHashMap<>();
        cols.put("b", List.of(1L));
        cols.put("a", List.of(2L));
        cols.put("c", List.of(3L));
        InMemoryDataset ds = new InMemoryDataset(cols).withColumnOrder(List.of("a", "b", "missing"));
        assertEquals(List.of("a", "b", "missing", "c"), ds.columnNames());
        assertEquals(Arrays.asList((Object) null), ds.read(0, 1).column("missing"));
    }
}
