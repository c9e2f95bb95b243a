package io.dataload.datasets.format;

import io.dataload.datasets.fs.StorageProvider;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.util.Text;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Arrow IPC stream files, the layout of the data files of a saved dataset. Record batches are
 * loaded one at a time; strings come back as String, integers as Long and floats as Double.
 */
public class ArrowStreamFormat implements FileFormat {

    @Override
    public String name() { return "arrow"; }

    @Override
    public RowIterator open(StorageProvider storage, String file) throws IOException {
        InputStream in = storage.openInputStream(file);
        BufferAllocator allocator = new RootAllocator(Long.MAX_VALUE);
        return new ArrowRows(new ArrowStreamReader(in, allocator), allocator, file);
    }

    static Object plain(Object value) {
        if (value instanceof Text t) return t.toString();
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) return ((Number) value).longValue();
        if (value instanceof Float f) return f.doubleValue();
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object v : list) out.add(plain(v));
            return out;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(plain(k)), plain(v)));
            return out;
        }
        return value;
    }

    private static final class ArrowRows implements RowIterator {
        private final ArrowStreamReader reader;
        private final BufferAllocator allocator;
        private final String location;
        private VectorSchemaRoot root;
        private int row = 0;

        ArrowRows(ArrowStreamReader reader, BufferAllocator allocator, String location) {
            this.reader = reader;
            this.allocator = allocator;
            this.location = location;
        }

        @Override
        public boolean hasNext() {
            try {
                if (root == null) root = reader.getVectorSchemaRoot();
                while (row >= root.getRowCount()) {
                    if (!reader.loadNextBatch()) return false;
                    row = 0;
                }
                return true;
            } catch (IOException e) {
                throw new UncheckedIOException("invalid Arrow stream in " + location, e);
            }
        }

        @Override
        public Map<String, Object> next() {
            if (!hasNext()) throw new NoSuchElementException();
            Map<String, Object> out = new LinkedHashMap<>();
            for (FieldVector vector : root.getFieldVectors()) {
                out.put(vector.getName(), plain(vector.getObject(row)));
            }
            row++;
            return out;
        }

        @Override
        public void close() throws IOException {
            try {
                reader.close();
            } finally {
                allocator.close();
            }
        }
    }
}
