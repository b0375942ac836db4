package edu.uconn.salesdw.job;

import edu.uconn.salesdw.exception.LoadInterruptedException;
import edu.uconn.salesdw.exception.ReferentialIntegrityException;
import edu.uconn.salesdw.model.LoadSummary;
import edu.uconn.salesdw.model.Row;
import edu.uconn.salesdw.source.CsvSource;
import edu.uconn.salesdw.source.SqlSource;
import edu.uconn.salesdw.transform.TimestampSplitter;
import edu.uconn.salesdw.warehouse.StarSchema;
import edu.uconn.salesdw.warehouse.WarehouseConnection;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Loads the sales star schema in one warehouse transaction.
 * <p>
 * The location dimension is closed: it is filled from the region file only, and a sale
 * in an unknown city aborts the run. Books and dates are added as they are first seen.
 * Nothing is committed unless every row loads.
 */
@Slf4j
public class DimensionalLoad {

    private final WarehouseConnection warehouse;

    @Getter
    private final StarSchema schema;

    public DimensionalLoad(WarehouseConnection warehouse) {
        this.warehouse = warehouse;
        this.schema = new StarSchema(warehouse);
    }

    /**
     * Preloads locations, closes the region file, loads every sale and commits.
     *
     * @throws ReferentialIntegrityException if a sale references a city without a location
     */
    public LoadSummary run(CsvSource regions, SqlSource sales) {
        int locations;
        try (regions) {
            locations = preloadLocations(regions);
        }
        LoadSummary summary = loadSales(sales, locations);
        warehouse.commit();
        log.info("Dimensional load committed: {}", summary);
        return summary;
    }

    /**
     * Inserts every region row into the location dimension without looking it up first.
     */
    public int preloadLocations(CsvSource regions) {
        int loaded = 0;
        try (Stream<Row> rows = regions.stream()) {
            Iterator<Row> it = rows.iterator();
            while (it.hasNext()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new LoadInterruptedException("Location preload interrupted after " + loaded + " locations");
                }
                schema.getLocation().insert(it.next());
                loaded++;
            }
        }
        log.info("Preloaded {} locations", loaded);
        return loaded;
    }

    LoadSummary loadSales(SqlSource sales, int locationsLoaded) {
        int read = 0;
        try (Stream<Row> rows = sales.stream()) {
            Iterator<Row> it = rows.iterator();
            while (it.hasNext()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new LoadInterruptedException("Dimensional load interrupted after " + read + " sales rows");
                }
                loadSale(it.next());
                read++;
            }
        }
        return LoadSummary.builder()
            .locationsLoaded(locationsLoaded)
            .salesRead(read)
            .factsInserted(schema.getSales().getInsertedCount())
            .booksCreated(schema.getBook().getInsertedCount())
            .timesCreated(schema.getTime().getInsertedCount())
            .build();
    }

    void loadSale(Row row) {
        TimestampSplitter.split(row);

        row.put("bookid", schema.getBook().ensure(row));
        row.put("timeid", schema.getTime().ensure(row));

        Long locationId = schema.getLocation().lookup(row).orElse(null);
        if (locationId == null) {
            throw new ReferentialIntegrityException("location", "city", row.get("city"));
        }
        row.put("locationid", locationId);

        schema.getSales().insert(row);
        log.debug("Loaded sale {}", row);
    }
}
