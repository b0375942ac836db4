package edu.uconn.salesdw.exception;

public class LoadInterruptedException extends EtlException {

    public LoadInterruptedException(String message) {
        super(message);
    }
}
