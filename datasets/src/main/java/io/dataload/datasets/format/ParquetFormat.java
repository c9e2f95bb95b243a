package io.dataload.datasets.format;

import io.dataload.datasets.fs.StorageProvider;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.Schema;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.hadoop.ParquetReader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Parquet files, read record by record through parquet-avro. Nested groups become maps, repeated
 * fields lists; strings come back as String, integers as Long and floats as Double.
 */
public class ParquetFormat implements FileFormat {
    private Configuration conf;

    @Override
    public String name() { return "parquet"; }

    @Override
    public RowIterator open(StorageProvider storage, String file) throws IOException {
        if (conf == null) conf = new Configuration();
        ParquetReader<GenericRecord> reader = AvroParquetReader
                .<GenericRecord>builder(new StorageInputFile(storage, file))
                .withConf(conf)
                .build();
        return new ParquetRows(reader, file);
    }

    static Map<String, Object> toRow(GenericRecord record) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (Schema.Field field : record.getSchema().getFields()) {
            row.put(field.name(), plain(record.get(field.pos())));
        }
        return row;
    }

    static Object plain(Object value) {
        if (value == null) return null;
        if (value instanceof GenericRecord nested) return toRow(nested);
        if (value instanceof CharSequence || value instanceof GenericData.EnumSymbol) return value.toString();
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) return ((Number) value).longValue();
        if (value instanceof Float f) return f.doubleValue();
        if (value instanceof ByteBuffer buffer) {
            byte[] bytes = new byte[buffer.remaining()];
            buffer.duplicate().get(bytes);
            return bytes;
        }
        if (value instanceof GenericData.Fixed fixed) return fixed.bytes().clone();
        if (value instanceof Collection<?> items) {
            List<Object> out = new ArrayList<>(items.size());
            for (Object v : items) out.add(plain(v));
            return out;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(k), plain(v)));
            return out;
        }
        return value;
    }

    private static final class ParquetRows implements RowIterator {
        private final ParquetReader<GenericRecord> reader;
        private final String location;
        private GenericRecord next;

        ParquetRows(ParquetReader<GenericRecord> reader, String location) {
            this.reader = reader;
            this.location = location;
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                try {
                    next = reader.read();
                } catch (IOException e) {
                    throw new UncheckedIOException("cannot read Parquet records of " + location, e);
                }
            }
            return next != null;
        }

        @Override
        public Map<String, Object> next() {
            if (!hasNext()) throw new NoSuchElementException();
            GenericRecord record = next;
            next = null;
            return toRow(record);
        }

        @Override
        public void close() throws IOException {
            reader.close();
        }
    }
}
