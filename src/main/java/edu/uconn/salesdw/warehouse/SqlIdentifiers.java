package edu.uconn.salesdw.warehouse;

import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Guards table and column names that are concatenated into SQL.
 */
public final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private SqlIdentifiers() {
    }

    public static String requireValid(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + name);
        }
        return name;
    }

    public static List<String> requireValid(List<String> names) {
        names.forEach(SqlIdentifiers::requireValid);
        return List.copyOf(names);
    }

    static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
