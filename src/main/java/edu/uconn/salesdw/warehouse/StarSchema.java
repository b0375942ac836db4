package edu.uconn.salesdw.warehouse;

import lombok.Getter;

import java.util.List;

/**
 * The sales star schema: book, time and location dimensions around one fact table.
 */
@Getter
public class StarSchema {

    private final Dimension book;
    private final Dimension time;
    private final Dimension location;
    private final FactTable sales;

    public StarSchema(WarehouseConnection connection) {
        this.book = Dimension.builder()
            .connection(connection)
            .name("book")
            .key("bookid")
            .attributes(List.of("book", "genre"))
            .build();

        this.time = Dimension.builder()
            .connection(connection)
            .name("time")
            .key("timeid")
            .attributes(List.of("day", "month", "year"))
            .build();

        // sales rows only carry the city, which identifies a location on its own
        this.location = Dimension.builder()
            .connection(connection)
            .name("location")
            .key("locationid")
            .attributes(List.of("city", "region"))
            .lookupAttributes(List.of("city"))
            .build();

        this.sales = FactTable.builder()
            .connection(connection)
            .name("facttable")
            .keyRefs(List.of("bookid", "locationid", "timeid"))
            .measures(List.of("sale"))
            .build();
    }
}
