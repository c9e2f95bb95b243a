package io.dataload.error;

/**
 * The backing location cannot be reached or opened, or the requested config/split/group does not exist.
 */
public class SourceUnavailableException extends SourceException {
    public SourceUnavailableException(String message) { super(message); }
    public SourceUnavailableException(String message, Throwable cause) { super(message, cause); }
}
