package edu.uconn.salesdw.job;

import edu.uconn.salesdw.TestDatabases;
import edu.uconn.salesdw.exception.LoadInterruptedException;
import edu.uconn.salesdw.exception.MalformedRowException;
import edu.uconn.salesdw.exception.ReferentialIntegrityException;
import edu.uconn.salesdw.model.LoadSummary;
import edu.uconn.salesdw.model.Row;
import edu.uconn.salesdw.source.CsvSource;
import edu.uconn.salesdw.source.SqlSource;
import edu.uconn.salesdw.warehouse.StarSchema;
import edu.uconn.salesdw.warehouse.WarehouseConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.io.StringReader;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end dimensional load on in-memory H2 source and warehouse databases.
 */
@DisplayName("DimensionalLoad Tests")
class DimensionalLoadTest {

    private static final String REGIONS = "city,region\nSpringfield,Midwest\nPortland,Northwest\n";
    private static final List<String> NAMES = List.of("book", "genre", "city", "timestamp", "sale");

    private DataSource warehouseDataSource;
    private DataSource salesSource;
    private Connection sourceConnection;
    private WarehouseConnection warehouse;
    private DimensionalLoad load;

    @BeforeEach
    void setUp() throws SQLException {
        warehouseDataSource = TestDatabases.warehouse();
        salesSource = TestDatabases.salesSource();
        sourceConnection = salesSource.getConnection();
        warehouse = WarehouseConnection.open(warehouseDataSource);
        load = new DimensionalLoad(warehouse);
    }

    @AfterEach
    void tearDown() throws SQLException {
        Thread.interrupted();
        warehouse.close();
        sourceConnection.close();
    }

    @Test
    @DisplayName("Should load a sale with all keys resolved")
    void shouldLoadSale() {
        // Given
        TestDatabases.addSale(salesSource, "Dune", "SciFi", "Springfield", "2020/05/14", 3);

        // When
        LoadSummary summary = load.run(regions(), sales());

        // Then
        Map<String, Object> fact = new JdbcTemplate(warehouseDataSource)
            .queryForMap("SELECT f.sale, b.book, b.genre, l.city, t.year, t.month, t.day"
                + " FROM facttable f"
                + " JOIN book b ON b.bookid = f.bookid"
                + " JOIN location l ON l.locationid = f.locationid"
                + " JOIN time t ON t.timeid = f.timeid");
        assertThat(fact)
            .containsEntry("SALE", 3)
            .containsEntry("BOOK", "Dune")
            .containsEntry("GENRE", "SciFi")
            .containsEntry("CITY", "Springfield")
            .containsEntry("YEAR", "2020")
            .containsEntry("MONTH", "05")
            .containsEntry("DAY", "14");
        assertThat(summary.getLocationsLoaded()).isEqualTo(2);
        assertThat(summary.getSalesRead()).isEqualTo(1);
        assertThat(summary.getFactsInserted()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should abort on a city missing from the region file and commit nothing")
    void shouldAbortOnUnknownCity() {
        // Given
        TestDatabases.addSale(salesSource, "Dune", "SciFi", "Springfield", "2020/05/14", 3);
        TestDatabases.addSale(salesSource, "Emma", "Classic", "Atlantis", "2020/05/15", 1);

        // When / Then
        assertThatThrownBy(() -> load.run(regions(), sales()))
            .isInstanceOf(ReferentialIntegrityException.class)
            .hasMessageContaining("Atlantis")
            .hasMessageContaining("location");

        assertThat(load.getSchema().getSales().getInsertedCount()).isEqualTo(1);
        assertThat(TestDatabases.count(warehouseDataSource, "facttable")).isZero();
        assertThat(TestDatabases.count(warehouseDataSource, "location")).isZero();
    }

    @Test
    @DisplayName("Should share one book member between sales of the same book")
    void shouldShareBookMember() {
        // Given
        TestDatabases.addSale(salesSource, "Dune", "SciFi", "Springfield", "2020/05/14", 3);
        TestDatabases.addSale(salesSource, "Dune", "SciFi", "Portland", "2020/05/15", 2);

        // When
        LoadSummary summary = load.run(regions(), sales());

        // Then
        assertThat(summary.getBooksCreated()).isEqualTo(1);
        assertThat(summary.getTimesCreated()).isEqualTo(2);
        assertThat(TestDatabases.count(warehouseDataSource, "book")).isEqualTo(1);
        List<Long> bookIds = new JdbcTemplate(warehouseDataSource)
            .queryForList("SELECT DISTINCT bookid FROM facttable", Long.class);
        assertThat(bookIds).hasSize(1);
        assertThat(TestDatabases.count(warehouseDataSource, "facttable")).isEqualTo(2);
    }

    @Test
    @DisplayName("Should resolve preloaded locations by city only")
    void shouldLookupPreloadedLocations() {
        // Given
        try (CsvSource regions = regions()) {
            assertThat(load.preloadLocations(regions)).isEqualTo(2);
        }
        StarSchema schema = load.getSchema();

        // When
        Long springfield = schema.getLocation().lookup(Row.of("city", "Springfield")).orElseThrow();

        // Then
        assertThat(schema.getLocation().getByKey(springfield).orElseThrow().get("region")).isEqualTo("Midwest");
        assertThat(schema.getLocation().lookup(Row.of("city", "Atlantis"))).isEmpty();
    }

    @Test
    @DisplayName("Should fail the run on a malformed timestamp")
    void shouldFailOnMalformedTimestamp() {
        // Given
        TestDatabases.addSale(salesSource, "Dune", "SciFi", "Springfield", "2020-05-14", 3);

        // When / Then
        assertThatThrownBy(() -> load.run(regions(), sales()))
            .isInstanceOf(MalformedRowException.class);
        assertThat(TestDatabases.count(warehouseDataSource, "book")).isZero();
    }

    @Test
    @DisplayName("Should stop before preloading locations when the thread is interrupted")
    void shouldStopPreloadWhenInterrupted() {
        // Given
        TestDatabases.addSale(salesSource, "Dune", "SciFi", "Springfield", "2020/05/14", 3);
        Thread.currentThread().interrupt();

        // When / Then
        assertThatThrownBy(() -> load.run(regions(), sales()))
            .isInstanceOf(LoadInterruptedException.class)
            .hasMessageContaining("0 locations");
        assertThat(Thread.interrupted()).isTrue();
        assertThat(load.getSchema().getLocation().getInsertedCount()).isZero();
        assertThat(TestDatabases.count(warehouseDataSource, "location")).isZero();
        assertThat(TestDatabases.count(warehouseDataSource, "facttable")).isZero();
    }

    @Test
    @DisplayName("Should stop between sales rows when the thread is interrupted and commit nothing")
    void shouldStopSalesWhenInterrupted() {
        // Given
        TestDatabases.addSale(salesSource, "Dune", "SciFi", "Springfield", "2020/05/14", 3);
        TestDatabases.addSale(salesSource, "Emma", "Classic", "Portland", "2020/05/15", 1);
        SqlSource interruptedOnceQueried = new SqlSource(sourceConnection, "SELECT * FROM sales", NAMES) {
            @Override
            public Stream<Row> stream() {
                Stream<Row> rows = super.stream();
                Thread.currentThread().interrupt();
                return rows;
            }
        };

        // When / Then
        assertThatThrownBy(() -> load.run(regions(), interruptedOnceQueried))
            .isInstanceOf(LoadInterruptedException.class)
            .hasMessageContaining("0 sales rows");
        assertThat(Thread.interrupted()).isTrue();
        assertThat(load.getSchema().getLocation().getInsertedCount()).isEqualTo(2);
        assertThat(load.getSchema().getSales().getInsertedCount()).isZero();
        assertThat(TestDatabases.count(warehouseDataSource, "location")).isZero();
        assertThat(TestDatabases.count(warehouseDataSource, "facttable")).isZero();
    }

    private CsvSource regions() {
        return new CsvSource(new StringReader(REGIONS), ',');
    }

    private SqlSource sales() {
        return new SqlSource(sourceConnection, "SELECT * FROM sales", NAMES);
    }
}
