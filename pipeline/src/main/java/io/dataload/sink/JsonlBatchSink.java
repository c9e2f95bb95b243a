package io.dataload.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dataload.core.Record;
import io.dataload.core.RowBatch;
import io.dataload.core.Sink;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;

/**
 * Writes every row of every batch as one JSON object per line.
 */
public class JsonlBatchSink implements Sink<RowBatch> {
    private final ObjectMapper mapper = new ObjectMapper();
    private final Writer writer;
    private final boolean ownsWriter;
    private long rows = 0;
    private long batches = 0;

    public JsonlBatchSink(Path file, boolean append) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING);
        this.ownsWriter = true;
    }

    /** Writes to a caller-owned writer (e.g. stdout); close() only flushes it. */
    public JsonlBatchSink(Writer writer) {
        this.writer = writer instanceof BufferedWriter ? writer : new BufferedWriter(writer);
        this.ownsWriter = false;
    }

    @Override
    public void accept(Record<RowBatch> record) throws IOException {
        for (Map<String, Object> row : record.payload().rows()) {
            writer.write(mapper.writeValueAsString(row));
            writer.write('\n');
            rows++;
        }
        batches++;
    }

    public long rowsWritten() { return rows; }
    public long batchesWritten() { return batches; }

    @Override
    public void close() {
        try {
            if (ownsWriter) writer.close(); else writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
