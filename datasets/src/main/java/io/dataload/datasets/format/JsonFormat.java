package io.dataload.datasets.format;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON objects, either one per line (JSON Lines) or as the elements of a top-level array.
 * Integers are read as {@link Long}, decimals as {@link Double}.
 */
public class JsonFormat extends TextFileFormat {
    private static final TypeReference<LinkedHashMap<String, Object>> ROW = new TypeReference<>() {};

    private final ObjectReader reader = new ObjectMapper()
            .enable(DeserializationFeature.USE_LONG_FOR_INTS)
            .readerFor(ROW);

    @Override
    public String name() { return "json"; }

    @Override
    public RowIterator open(Reader in, String location) throws IOException {
        MappingIterator<Map<String, Object>> values = reader.readValues(in);
        return new RowIterator() {
            @Override
            public boolean hasNext() {
                try {
                    return values.hasNextValue();
                } catch (IOException e) {
                    throw new UncheckedIOException("invalid JSON in " + location, e);
                }
            }

            @Override
            public Map<String, Object> next() {
                try {
                    return values.nextValue();
                } catch (IOException e) {
                    throw new UncheckedIOException("invalid JSON in " + location, e);
                }
            }

            @Override
            public void close() throws IOException {
                values.close();
                in.close();
            }
        };
    }
}
