package io.dataload.datasets.format;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import io.dataload.error.SchemaViolationException;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/**
 * Delimited text with a header row. Cells are typed: empty is null, integral is Long, decimal is
 * Double, True/False is Boolean, anything else stays a String.
 */
public class CsvFormat extends TextFileFormat {
    private static final Pattern INTEGRAL = Pattern.compile("[-+]?\\d{1,18}");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

    private final String name;
    private final char separator;

    public CsvFormat(String name, char separator) {
        this.name = name;
        this.separator = separator;
    }

    public static CsvFormat csv() { return new CsvFormat("csv", ','); }
    public static CsvFormat tsv() { return new CsvFormat("tsv", '\t'); }

    @Override
    public String name() { return name; }

    @Override
    public RowIterator open(Reader in, String location) throws IOException {
        CSVReader csv = new CSVReaderBuilder(in)
                .withCSVParser(new CSVParserBuilder().withSeparator(separator).build())
                .build();
        String[] header = readNext(csv, location);
        if (header == null) header = new String[0];
        return new CsvRows(csv, header, location);
    }

    static Object typed(String cell) {
        if (cell == null || cell.isEmpty()) return null;
        if (INTEGRAL.matcher(cell).matches()) return Long.parseLong(cell);
        if (DECIMAL.matcher(cell).matches()) return Double.parseDouble(cell);
        if (cell.equals("True") || cell.equals("true")) return Boolean.TRUE;
        if (cell.equals("False") || cell.equals("false")) return Boolean.FALSE;
        return cell;
    }

    private static String[] readNext(CSVReader csv, String location) {
        try {
            return csv.readNext();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + location, e);
        } catch (CsvValidationException e) {
            throw new UncheckedIOException(new IOException("malformed CSV in " + location + " at line " + e.getLineNumber(), e));
        }
    }

    private static final class CsvRows implements RowIterator {
        private final CSVReader csv;
        private final String[] header;
        private final String location;
        private String[] next;
        private long line = 1;

        CsvRows(CSVReader csv, String[] header, String location) {
            this.csv = csv;
            this.header = header;
            this.location = location;
        }

        @Override
        public boolean hasNext() {
            if (next == null) next = readNext(csv, location);
            return next != null;
        }

        @Override
        public Map<String, Object> next() {
            if (!hasNext()) throw new NoSuchElementException();
            String[] cells = next;
            next = null;
            line++;
            if (cells.length != header.length) {
                throw new SchemaViolationException(location + ": record " + line + " has " + cells.length
                        + " fields, the header has " + header.length);
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < header.length; i++) row.put(header[i], typed(cells[i]));
            return row;
        }

        @Override
        public void close() throws IOException {
            csv.close();
        }
    }
}
