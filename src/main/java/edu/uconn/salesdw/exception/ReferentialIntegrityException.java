package edu.uconn.salesdw.exception;

import lombok.Getter;

/**
 * A source row references a member of a closed dimension that does not exist.
 */
@Getter
public class ReferentialIntegrityException extends EtlException {

    private final String dimension;
    private final Object value;

    public ReferentialIntegrityException(String dimension, String attribute, Object value) {
        super(String.format("%s '%s' was not present in the %s dimension", capitalize(attribute), value, dimension));
        this.dimension = dimension;
        this.value = value;
    }

    private static String capitalize(String attribute) {
        return attribute.isEmpty() ? attribute : Character.toUpperCase(attribute.charAt(0)) + attribute.substring(1);
    }
}
