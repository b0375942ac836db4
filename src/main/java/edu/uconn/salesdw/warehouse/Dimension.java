package edu.uconn.salesdw.warehouse;

import edu.uconn.salesdw.exception.MalformedRowException;
import edu.uconn.salesdw.model.Row;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A dimension table keyed by a surrogate key.
 * <p>
 * Members are found by their lookup attributes (all attributes unless a subset is given).
 * Keys that were looked up or inserted during this run are cached in memory, so the cache
 * lives exactly as long as the dimension object. New keys continue from the largest key
 * already stored in the table.
 */
@Slf4j
public class Dimension {

    private final WarehouseConnection connection;

    @Getter
    private final String name;

    @Getter
    private final String key;

    @Getter
    private final List<String> attributes;

    @Getter
    private final List<String> lookupAttributes;

    private final String lookupSql;
    private final String insertSql;
    private final String selectByKeySql;
    private final String maxKeySql;

    private final Map<List<Object>, Long> keyCache = new HashMap<>();
    private Long maxKey;

    /**
     * Number of members this object has inserted.
     */
    @Getter
    private int insertedCount;

    @Builder
    private Dimension(WarehouseConnection connection, String name, String key,
                      List<String> attributes, List<String> lookupAttributes) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.name = SqlIdentifiers.requireValid(name);
        this.key = SqlIdentifiers.requireValid(key);
        if (attributes == null || attributes.isEmpty()) {
            throw new IllegalArgumentException("Dimension " + name + " needs at least one attribute");
        }
        this.attributes = SqlIdentifiers.requireValid(attributes);
        this.lookupAttributes = lookupAttributes == null || lookupAttributes.isEmpty()
            ? this.attributes
            : SqlIdentifiers.requireValid(lookupAttributes);
        if (!this.attributes.containsAll(this.lookupAttributes)) {
            throw new IllegalArgumentException("Lookup attributes " + this.lookupAttributes
                + " are not all attributes of " + name + " " + this.attributes);
        }

        List<String> conditions = new ArrayList<>();
        this.lookupAttributes.forEach(attribute -> conditions.add(attribute + " = ?"));
        String columns = key + ", " + String.join(", ", this.attributes);

        this.lookupSql = "SELECT " + key + " FROM " + name + " WHERE " + String.join(" AND ", conditions);
        this.insertSql = "INSERT INTO " + name + " (" + columns + ") VALUES ("
            + SqlIdentifiers.placeholders(this.attributes.size() + 1) + ")";
        this.selectByKeySql = "SELECT " + columns + " FROM " + name + " WHERE " + key + " = ?";
        this.maxKeySql = "SELECT MAX(" + key + ") FROM " + name;
    }

    /**
     * Finds the key of the member matching the row's lookup attributes. Never writes.
     *
     * @return the key, or empty when no member matches
     */
    public Optional<Long> lookup(Row row) {
        List<Object> values = lookupValues(row);
        Long cached = keyCache.get(values);
        if (cached != null) {
            return Optional.of(cached);
        }
        List<Long> keys = connection.jdbc().query(lookupSql, (rs, rowNum) -> rs.getLong(1), values.toArray());
        if (keys.isEmpty()) {
            return Optional.empty();
        }
        keyCache.put(values, keys.get(0));
        return Optional.of(keys.get(0));
    }

    /**
     * Inserts the row as a new member without checking for duplicates. A key value carried
     * by the row is used as is; otherwise the next free key is assigned.
     *
     * @return the key of the new member
     */
    public long insert(Row row) {
        Object suppliedKey = row.get(key);
        long keyValue;
        if (suppliedKey == null) {
            keyValue = currentMaxKey() + 1;
            maxKey = keyValue;
        } else {
            keyValue = toKey(suppliedKey);
            maxKey = Math.max(currentMaxKey(), keyValue);
        }

        Object[] args = new Object[attributes.size() + 1];
        args[0] = keyValue;
        for (int i = 0; i < attributes.size(); i++) {
            args[i + 1] = row.require(attributes.get(i));
        }
        connection.jdbc().update(insertSql, args);
        keyCache.put(lookupValues(row), keyValue);
        insertedCount++;
        log.debug("Inserted {} {} = {}", name, key, keyValue);
        return keyValue;
    }

    /**
     * Returns the key of the member matching the row, inserting the row first if there is none.
     */
    public long ensure(Row row) {
        return lookup(row).orElseGet(() -> insert(row));
    }

    /**
     * Reads the stored member with the given key.
     */
    public Optional<Row> getByKey(long keyValue) {
        List<String> columns = new ArrayList<>();
        columns.add(key);
        columns.addAll(attributes);
        List<Row> rows = connection.jdbc().query(selectByKeySql, (rs, rowNum) -> {
            Row member = new Row();
            for (int i = 0; i < columns.size(); i++) {
                member.put(columns.get(i), rs.getObject(i + 1));
            }
            return member;
        }, keyValue);
        return rows.stream().findFirst();
    }

    private List<Object> lookupValues(Row row) {
        List<Object> values = new ArrayList<>(lookupAttributes.size());
        for (String attribute : lookupAttributes) {
            values.add(row.require(attribute));
        }
        return values;
    }

    private long currentMaxKey() {
        if (maxKey == null) {
            Long stored = connection.jdbc().queryForObject(maxKeySql, Long.class);
            maxKey = stored == null ? 0L : stored;
        }
        return maxKey;
    }

    private long toKey(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new MalformedRowException("Key " + key + " of " + name + " is not a number: " + value);
        }
    }
}
