package edu.uconn.salesdw.warehouse;

import edu.uconn.salesdw.exception.MalformedRowException;
import edu.uconn.salesdw.model.Row;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An append-only fact table: foreign keys into the dimensions plus measures.
 * Rows with the same key combination are not merged or rejected.
 */
@Slf4j
public class FactTable {

    private final WarehouseConnection connection;

    @Getter
    private final String name;

    @Getter
    private final List<String> keyRefs;

    @Getter
    private final List<String> measures;

    private final String insertSql;
    private final String lookupSql;

    @Getter
    private int insertedCount;

    @Builder
    private FactTable(WarehouseConnection connection, String name, List<String> keyRefs, List<String> measures) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.name = SqlIdentifiers.requireValid(name);
        if (keyRefs == null || keyRefs.isEmpty()) {
            throw new IllegalArgumentException("Fact table " + name + " needs at least one key reference");
        }
        this.keyRefs = SqlIdentifiers.requireValid(keyRefs);
        this.measures = measures == null ? List.of() : SqlIdentifiers.requireValid(measures);

        List<String> columns = new ArrayList<>(this.keyRefs);
        columns.addAll(this.measures);
        List<String> conditions = new ArrayList<>();
        this.keyRefs.forEach(keyRef -> conditions.add(keyRef + " = ?"));

        this.insertSql = "INSERT INTO " + name + " (" + String.join(", ", columns) + ") VALUES ("
            + SqlIdentifiers.placeholders(columns.size()) + ")";
        this.lookupSql = "SELECT " + String.join(", ", columns) + " FROM " + name
            + " WHERE " + String.join(" AND ", conditions);
    }

    /**
     * Appends one fact.
     *
     * @throws MalformedRowException if a foreign key is missing or null
     */
    public void insert(Row row) {
        Object[] args = new Object[keyRefs.size() + measures.size()];
        int i = 0;
        for (Object value : keyValues(row)) {
            args[i++] = value;
        }
        for (String measure : measures) {
            args[i++] = row.require(measure);
        }
        connection.jdbc().update(insertSql, args);
        insertedCount++;
    }

    /**
     * Reads the first fact stored for the row's key combination.
     */
    public Optional<Row> lookup(Row row) {
        List<String> columns = new ArrayList<>(keyRefs);
        columns.addAll(measures);
        List<Row> facts = connection.jdbc().query(lookupSql, (rs, rowNum) -> {
            Row fact = new Row();
            for (int c = 0; c < columns.size(); c++) {
                fact.put(columns.get(c), rs.getObject(c + 1));
            }
            return fact;
        }, keyValues(row).toArray());
        return facts.stream().findFirst();
    }

    private List<Object> keyValues(Row row) {
        List<Object> values = new ArrayList<>(keyRefs.size());
        for (String keyRef : keyRefs) {
            Object value = row.get(keyRef);
            if (value == null) {
                throw new MalformedRowException("Fact for " + name + " has no value for " + keyRef + ": " + row);
            }
            values.add(value);
        }
        return values;
    }
}
