package edu.uconn.salesdw.exception;

/**
 * Rows could not be read from a source, either because the query failed
 * or because a record did not have the expected shape.
 */
public class SourceReadException extends EtlException {

    public SourceReadException(String message) {
        super(message);
    }

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
