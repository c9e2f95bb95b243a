package io.dataload.datasets.format;

import java.io.Closeable;
import java.util.Iterator;
import java.util.Map;

/**
 * Rows of one or more files, in file order. Read failures surface as
 * {@link java.io.UncheckedIOException} from hasNext()/next().
 */
public interface RowIterator extends Iterator<Map<String, Object>>, Closeable {
}
