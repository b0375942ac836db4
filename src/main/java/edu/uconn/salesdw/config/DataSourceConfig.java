package edu.uconn.salesdw.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

/**
 * Data sources for the operational sales database and the warehouse.
 * Neither is pooled: each run opens its connections once and closes them at the end.
 * The warehouse is primary, so Spring Batch keeps its job repository there.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(EtlProperties.class)
public class DataSourceConfig {

    public static final String SOURCE_DATA_SOURCE = "sourceDataSource";

    @Bean
    @Primary
    public DataSource warehouseDataSource(EtlProperties properties) {
        return build("warehouse", properties.getWarehouse());
    }

    @Bean
    @Qualifier(SOURCE_DATA_SOURCE)
    public DataSource sourceDataSource(EtlProperties properties) {
        return build("source", properties.getSource());
    }

    private DataSource build(String role, ConnectionSettings settings) {
        String url = settings.jdbcUrl();
        log.info("Using {} database at {}", role, url);
        return new DriverManagerDataSource(url, settings.getUser(), settings.getPassword());
    }
}
