package edu.uconn.salesdw.exception;

/**
 * A database connection or an input file could not be opened.
 */
public class ConnectivityException extends EtlException {

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
