package edu.uconn.salesdw.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;

import java.util.List;

/**
 * ETL settings bound from the {@code etl} prefix of application.yml.
 */
@Data
@NoArgsConstructor
@ConfigurationProperties(prefix = "etl")
public class EtlProperties {

    private ConnectionSettings source = new ConnectionSettings();
    private ConnectionSettings warehouse = new ConnectionSettings();
    private Sales sales = new Sales();
    private Regions regions = new Regions();
    private Bulk bulk = new Bulk();

    @Data
    @NoArgsConstructor
    public static class Sales {
        private String query = "SELECT * FROM sales";
        /** Names given to the query's columns, by position. */
        private List<String> names = List.of("book", "genre", "city", "timestamp", "sale");
    }

    @Data
    @NoArgsConstructor
    public static class Regions {
        private Resource file;
        private char delimiter = ',';
    }

    @Data
    @NoArgsConstructor
    public static class Bulk {
        /** Gzip-compressed input in the target table's COPY text format. */
        private Resource inputFile;
        private String targetTable;
    }
}
