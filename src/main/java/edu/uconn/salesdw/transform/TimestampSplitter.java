package edu.uconn.salesdw.transform;

import edu.uconn.salesdw.exception.MalformedRowException;
import edu.uconn.salesdw.model.Row;

/**
 * Splits a {@code year/month/day} timestamp into separate row fields.
 * The parts are taken positionally and are not checked for being a real date.
 */
public final class TimestampSplitter {

    public static final String TIMESTAMP = "timestamp";
    public static final String YEAR = "year";
    public static final String MONTH = "month";
    public static final String DAY = "day";

    private static final int PARTS = 3;

    private TimestampSplitter() {
    }

    /**
     * Adds {@code year}, {@code month} and {@code day} to the row.
     *
     * @throws MalformedRowException if the timestamp is missing or does not have exactly three parts
     */
    public static Row split(Row row) {
        Object timestamp = row.require(TIMESTAMP);
        if (timestamp == null) {
            throw new MalformedRowException("Timestamp is null in row " + row);
        }
        String[] parts = timestamp.toString().split("/", -1);
        if (parts.length != PARTS) {
            throw new MalformedRowException("Timestamp '" + timestamp + "' does not have the form year/month/day");
        }
        row.put(YEAR, parts[0]);
        row.put(MONTH, parts[1]);
        row.put(DAY, parts[2]);
        return row;
    }
}
