package io.dataload.datasets.format;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * One row per line, in a single "text" column.
 */
public class TextFormat extends TextFileFormat {
    public static final String COLUMN = "text";

    @Override
    public String name() { return "text"; }

    @Override
    public RowIterator open(Reader in, String location) {
        BufferedReader lines = in instanceof BufferedReader b ? b : new BufferedReader(in);
        return new RowIterator() {
            private String next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    try {
                        next = lines.readLine();
                    } catch (IOException e) {
                        throw new UncheckedIOException("cannot read " + location, e);
                    }
                }
                return next != null;
            }

            @Override
            public Map<String, Object> next() {
                if (!hasNext()) throw new NoSuchElementException();
                String line = next;
                next = null;
                return Map.of(COLUMN, line);
            }

            @Override
            public void close() throws IOException {
                lines.close();
            }
        };
    }
}
