package edu.uconn.salesdw.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConnectionSettings Tests")
class ConnectionSettingsTest {

    @Test
    @DisplayName("Should build a PostgreSQL URL from host, port and database name")
    void shouldBuildUrlFromParts() {
        // Given
        ConnectionSettings settings = new ConnectionSettings();
        settings.setHost("warehouse.example.org");
        settings.setPort(54320);
        settings.setDbname("etl");

        // When
        String url = settings.jdbcUrl();

        // Then
        assertThat(url).isEqualTo("jdbc:postgresql://warehouse.example.org:54320/etl");
    }

    @Test
    @DisplayName("Should default to localhost on the PostgreSQL port")
    void shouldUseDefaults() {
        // Given
        ConnectionSettings settings = new ConnectionSettings();
        settings.setDbname("source");

        // When / Then
        assertThat(settings.jdbcUrl()).isEqualTo("jdbc:postgresql://localhost:5432/source");
    }

    @Test
    @DisplayName("Should prefer an explicit URL over host, port and database name")
    void shouldPreferExplicitUrl() {
        // Given
        ConnectionSettings settings = new ConnectionSettings();
        settings.setDbname("etl");
        settings.setUrl("jdbc:h2:mem:sales_warehouse");

        // When / Then
        assertThat(settings.jdbcUrl()).isEqualTo("jdbc:h2:mem:sales_warehouse");
    }

    @Test
    @DisplayName("Should reject settings with neither a URL nor a database name")
    void shouldRejectMissingDatabase() {
        // Given
        ConnectionSettings settings = new ConnectionSettings();
        settings.setHost("warehouse.example.org");
        settings.setUrl(" ");

        // When / Then
        assertThatThrownBy(settings::jdbcUrl)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("warehouse.example.org:5432");
    }
}
