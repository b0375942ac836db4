package edu.uconn.salesdw.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.StringUtils;

/**
 * Where one database lives and how to log in.
 * YAML: etl.source / etl.warehouse
 */
@Data
@NoArgsConstructor
public class ConnectionSettings {
    private String host = "localhost";
    private int port = 5432;
    private String dbname;
    private String user;
    private String password;
    /** Full JDBC URL. When set, host, port and dbname are ignored. */
    private String url;

    public String jdbcUrl() {
        if (StringUtils.hasText(url)) {
            return url;
        }
        if (!StringUtils.hasText(dbname)) {
            throw new IllegalStateException("Either url or dbname must be configured for " + host + ":" + port);
        }
        return "jdbc:postgresql://" + host + ":" + port + "/" + dbname;
    }
}
