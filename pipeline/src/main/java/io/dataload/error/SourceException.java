package io.dataload.error;

/**
 * Base of all failures raised while opening or reading a dataset source.
 */
public class SourceException extends RuntimeException {
    public SourceException(String message) { super(message); }
    public SourceException(String message, Throwable cause) { super(message, cause); }
}
