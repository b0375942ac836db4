package edu.uconn.salesdw.job;

import edu.uconn.salesdw.exception.EtlException;
import edu.uconn.salesdw.warehouse.SqlIdentifiers;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.copy.CopyIn;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Streams lines into a table through PostgreSQL's {@code COPY ... FROM STDIN}.
 */
@Slf4j
public class PostgresCopyChannel implements BulkCopyChannel {

    private final CopyIn copyIn;

    private PostgresCopyChannel(CopyIn copyIn) {
        this.copyIn = copyIn;
    }

    public static PostgresCopyChannel open(Connection connection, String table) {
        String sql = "COPY " + SqlIdentifiers.requireValid(table) + " FROM STDIN";
        try {
            CopyIn copyIn = connection.unwrap(PGConnection.class).getCopyAPI().copyIn(sql);
            log.debug("Started {}", sql);
            return new PostgresCopyChannel(copyIn);
        } catch (SQLException e) {
            throw new EtlException("Could not start bulk copy into " + table, e);
        }
    }

    @Override
    public void writeLine(byte[] line) {
        try {
            copyIn.writeToCopy(line, 0, line.length);
        } catch (SQLException e) {
            throw new EtlException("Bulk copy write failed", e);
        }
    }

    @Override
    public long finish() {
        try {
            return copyIn.endCopy();
        } catch (SQLException e) {
            throw new EtlException("Bulk copy could not be completed", e);
        }
    }

    @Override
    public void abort() {
        try {
            if (copyIn.isActive()) {
                copyIn.cancelCopy();
            }
        } catch (SQLException e) {
            log.warn("Could not cancel bulk copy: {}", e.getMessage());
        }
    }
}
