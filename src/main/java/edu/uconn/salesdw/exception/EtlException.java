package edu.uconn.salesdw.exception;

/**
 * Base class for every failure that aborts an ETL run.
 */
public class EtlException extends RuntimeException {

    public EtlException(String message) {
        super(message);
    }

    public EtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
