package edu.uconn.salesdw.source;

import edu.uconn.salesdw.exception.ConnectivityException;
import edu.uconn.salesdw.exception.SourceReadException;
import edu.uconn.salesdw.model.Row;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads rows from a delimited text file whose first line names the columns.
 * The rows can be streamed once; closing the source closes the underlying reader.
 */
public class CsvSource implements Closeable {

    private static final int BUFFER_SIZE = 16384;

    private final CSVParser parser;
    private boolean consumed;

    public CsvSource(Reader reader, char delimiter) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setDelimiter(delimiter)
            .setHeader()
            .setSkipHeaderRecord(true)
            .build();
        try {
            this.parser = CSVParser.parse(reader, format);
        } catch (IOException e) {
            throw new SourceReadException("Could not read CSV header", e);
        }
    }

    /**
     * Opens a UTF-8 delimited file.
     *
     * @throws ConnectivityException if the resource cannot be opened
     */
    public static CsvSource open(Resource resource, char delimiter) {
        try {
            Reader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8), BUFFER_SIZE);
            return new CsvSource(reader, delimiter);
        } catch (IOException e) {
            throw new ConnectivityException("Could not open " + resource.getDescription(), e);
        }
    }

    /**
     * Streams the data rows. Field values are kept exactly as written, surrounding spaces included.
     *
     * @throws SourceReadException if a record cannot be read
     */
    public Stream<Row> stream() {
        if (consumed) {
            throw new IllegalStateException("CSV source has already been read");
        }
        consumed = true;
        Iterator<CSVRecord> records = parser.iterator();
        Spliterator<Row> rows = new Spliterators.AbstractSpliterator<>(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
            @Override
            public boolean tryAdvance(Consumer<? super Row> action) {
                CSVRecord record;
                try {
                    if (!records.hasNext()) {
                        return false;
                    }
                    record = records.next();
                } catch (UncheckedIOException e) {
                    throw new SourceReadException("Could not read CSV record", e.getCause());
                }
                action.accept(new Row(record.toMap()));
                return true;
            }
        };
        return StreamSupport.stream(rows, false);
    }

    @Override
    public void close() {
        try {
            parser.close();
        } catch (IOException e) {
            throw new SourceReadException("Could not close CSV source", e);
        }
    }
}
