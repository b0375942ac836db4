package edu.uconn.salesdw.model;

import edu.uconn.salesdw.exception.MalformedRowException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Row Tests")
class RowTest {

    @Test
    @DisplayName("Should keep fields in insertion order")
    void shouldKeepFieldOrder() {
        // Given
        Row row = Row.of("book", "Dune", "genre", "SciFi");

        // When
        row.put("sale", 3);

        // Then
        assertThat(row.asMap().keySet()).containsExactly("book", "genre", "sale");
    }

    @Test
    @DisplayName("Should distinguish a null value from a missing field")
    void shouldDistinguishNullFromMissing() {
        // Given
        Row row = Row.of("region", null);

        // When / Then
        assertThat(row.require("region")).isNull();
        assertThat(row.has("region")).isTrue();
        assertThatThrownBy(() -> row.require("city"))
            .isInstanceOf(MalformedRowException.class)
            .hasMessageContaining("city");
    }

    @Test
    @DisplayName("Should reject an odd number of name/value arguments")
    void shouldRejectOddArguments() {
        // When / Then
        assertThatThrownBy(() -> Row.of("book", "Dune", "genre"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
