package io.dataload.error;

/** The file format of a path could not be inferred, or no reader exists for it. */
public class UnresolvableFiletypeException extends SourceException {
    public UnresolvableFiletypeException(String message) { super(message); }
}
