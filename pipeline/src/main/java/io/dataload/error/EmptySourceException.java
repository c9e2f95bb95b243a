package io.dataload.error;

/** No columns could be resolved for a source. */
public class EmptySourceException extends SourceException {
    public EmptySourceException(String message) { super(message); }
}
