package edu.uconn.salesdw.exception;

/**
 * A row is missing a required field or carries a value that cannot be interpreted.
 */
public class MalformedRowException extends EtlException {

    public MalformedRowException(String message) {
        super(message);
    }
}
