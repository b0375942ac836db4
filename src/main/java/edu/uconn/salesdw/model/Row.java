package edu.uconn.salesdw.model;

import edu.uconn.salesdw.exception.MalformedRowException;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single record flowing through the pipeline: column names mapped to values,
 * in column order. Rows are mutable; transforms and key resolution add fields in place.
 */
@EqualsAndHashCode
@ToString
public class Row {

    private final Map<String, Object> values;

    public Row() {
        this.values = new LinkedHashMap<>();
    }

    public Row(Map<String, ?> values) {
        this.values = new LinkedHashMap<>(values);
    }

    /**
     * Builds a row from alternating name/value arguments.
     */
    public static Row of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs but got " + namesAndValues.length + " arguments");
        }
        Row row = new Row();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            row.put((String) namesAndValues[i], namesAndValues[i + 1]);
        }
        return row;
    }

    public Object get(String field) {
        return values.get(field);
    }

    /**
     * Returns the value of a field that must be present.
     *
     * @throws MalformedRowException if the row has no such field
     */
    public Object require(String field) {
        if (!values.containsKey(field)) {
            throw new MalformedRowException("Row is missing field '" + field + "': " + values.keySet());
        }
        return values.get(field);
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }

    public Row put(String field, Object value) {
        values.put(field, value);
        return this;
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }
}
