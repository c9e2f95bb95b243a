package io.dataload.error;

/** Row data does not fit the resolved schema, e.g. columns of different lengths in one batch. */
public class SchemaViolationException extends SourceException {
    public SchemaViolationException(String message) { super(message); }
}
