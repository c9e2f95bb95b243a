package io.dataload.error;

/** A requested combination of options is not supported, e.g. streaming a snapshot. */
public class UnsupportedModeException extends SourceException {
    public UnsupportedModeException(String message) { super(message); }
}
