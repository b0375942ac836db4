package edu.uconn.salesdw.source;

import edu.uconn.salesdw.exception.SourceReadException;
import edu.uconn.salesdw.model.Row;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.sql.Connection;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads rows from a relational source. Result columns are matched to the configured
 * names by position, so source columns may be renamed on the way in.
 */
@Slf4j
public class SqlSource {

    private final JdbcTemplate jdbcTemplate;
    private final String query;
    private final List<String> names;

    public SqlSource(Connection connection, String query, List<String> names) {
        if (names.isEmpty()) {
            throw new IllegalArgumentException("At least one output name is required");
        }
        this.jdbcTemplate = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
        this.query = query;
        this.names = List.copyOf(names);
    }

    /**
     * Executes the query and returns its rows lazily. The stream holds an open result set
     * and must be closed. Every call runs the query again.
     *
     * @throws SourceReadException if the query cannot be executed, or later while the rows
     *         are read
     */
    public Stream<Row> stream() {
        log.debug("Executing source query: {}", query);
        Stream<Row> rows;
        try {
            rows = jdbcTemplate.queryForStream(query, rowMapper());
        } catch (DataAccessException e) {
            throw new SourceReadException("Source query failed: " + query, e);
        }
        return StreamSupport.stream(new ReadFailureTranslator(rows.spliterator()), false).onClose(rows::close);
    }

    /**
     * Reports result set failures raised while advancing as read errors.
     */
    private final class ReadFailureTranslator extends Spliterators.AbstractSpliterator<Row> {

        private final Spliterator<Row> delegate;
        private Row current;

        ReadFailureTranslator(Spliterator<Row> delegate) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.delegate = delegate;
        }

        @Override
        public boolean tryAdvance(Consumer<? super Row> action) {
            boolean advanced;
            try {
                advanced = delegate.tryAdvance(row -> current = row);
            } catch (DataAccessException e) {
                throw new SourceReadException("Failed reading rows of source query: " + query, e);
            }
            if (advanced) {
                action.accept(current);
            }
            return advanced;
        }
    }

    private RowMapper<Row> rowMapper() {
        return (rs, rowNum) -> {
            int columns = rs.getMetaData().getColumnCount();
            if (columns < names.size()) {
                throw new SourceReadException(String.format(
                    "Source row %d has %d columns but %d names were given: %s", rowNum, columns, names.size(), names));
            }
            Row row = new Row();
            for (int i = 0; i < names.size(); i++) {
                row.put(names.get(i), rs.getObject(i + 1));
            }
            return row;
        };
    }
}
