package edu.uconn.salesdw.warehouse;

import edu.uconn.salesdw.exception.ConnectivityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * One warehouse connection shared by every dimension and fact table of a run.
 * Auto-commit is off, so nothing is durable until {@link #commit()} is called;
 * closing without a commit rolls the work back.
 */
@Slf4j
public class WarehouseConnection implements AutoCloseable {

    private final Connection connection;
    private final JdbcTemplate jdbcTemplate;

    WarehouseConnection(Connection connection) throws SQLException {
        connection.setAutoCommit(false);
        this.connection = connection;
        this.jdbcTemplate = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
    }

    /**
     * Opens a new physical connection from the data source.
     *
     * @throws ConnectivityException if no connection can be established
     */
    public static WarehouseConnection open(DataSource dataSource) {
        try {
            return new WarehouseConnection(dataSource.getConnection());
        } catch (SQLException e) {
            throw new ConnectivityException("Could not connect to the warehouse", e);
        }
    }

    public JdbcTemplate jdbc() {
        return jdbcTemplate;
    }

    /**
     * The underlying JDBC connection, for vendor APIs such as bulk copy.
     */
    public Connection unwrap() {
        return connection;
    }

    public void commit() {
        try {
            connection.commit();
            log.debug("Warehouse transaction committed");
        } catch (SQLException e) {
            throw new ConnectivityException("Warehouse commit failed", e);
        }
    }

    public void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw new ConnectivityException("Warehouse rollback failed", e);
        }
    }

    /**
     * Rolls back anything uncommitted and releases the connection. The connection is
     * released even when the rollback fails.
     */
    @Override
    public void close() {
        try {
            if (connection.isClosed()) {
                return;
            }
        } catch (SQLException e) {
            throw new ConnectivityException("Could not close warehouse connection", e);
        }

        SQLException failure = null;
        try {
            connection.rollback();
        } catch (SQLException e) {
            failure = e;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw new ConnectivityException("Could not close warehouse connection", failure);
        }
    }
}
