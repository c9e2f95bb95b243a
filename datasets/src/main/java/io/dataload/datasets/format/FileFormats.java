package io.dataload.datasets.format;

import io.dataload.error.UnresolvableFiletypeException;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Registry of the supported filetypes.
 */
public final class FileFormats {
    private static final Map<String, FileFormat> FORMATS = new TreeMap<>();

    static {
        register(new JsonFormat());
        register(CsvFormat.csv());
        register(CsvFormat.tsv());
        register(new TextFormat());
        register(new ArrowStreamFormat());
        register(new ParquetFormat());
    }

    private FileFormats() {}

    private static void register(FileFormat format) { FORMATS.put(format.name(), format); }

    /**
     * Maps a file extension (without the dot) to a filetype: lower-cased, with jsonl read as json
     * and txt as text.
     */
    public static String filetypeOf(String extension) {
        String ext = extension.toLowerCase(Locale.ROOT);
        return switch (ext) {
            case "jsonl" -> "json";
            case "txt" -> "text";
            default -> ext;
        };
    }

    public static FileFormat forType(String filetype) {
        FileFormat format = FORMATS.get(filetypeOf(filetype));
        if (format == null) {
            throw new UnresolvableFiletypeException("no reader for filetype '" + filetype + "', supported: " + FORMATS.keySet());
        }
        return format;
    }
}
