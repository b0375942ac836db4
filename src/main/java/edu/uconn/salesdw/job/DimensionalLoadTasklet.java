package edu.uconn.salesdw.job;

import edu.uconn.salesdw.config.DataSourceConfig;
import edu.uconn.salesdw.config.EtlProperties;
import edu.uconn.salesdw.exception.ConnectivityException;
import edu.uconn.salesdw.model.LoadSummary;
import edu.uconn.salesdw.source.CsvSource;
import edu.uconn.salesdw.source.SqlSource;
import edu.uconn.salesdw.warehouse.WarehouseConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs the dimensional load with its own source and warehouse connections.
 * The warehouse connection is closed before the source connection.
 */
@Slf4j
@Component
public class DimensionalLoadTasklet implements Tasklet {

    private final DataSource warehouseDataSource;
    private final DataSource sourceDataSource;
    private final EtlProperties properties;

    public DimensionalLoadTasklet(DataSource warehouseDataSource,
                                  @Qualifier(DataSourceConfig.SOURCE_DATA_SOURCE) DataSource sourceDataSource,
                                  EtlProperties properties) {
        this.warehouseDataSource = warehouseDataSource;
        this.sourceDataSource = sourceDataSource;
        this.properties = properties;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws SQLException {
        EtlProperties.Sales sales = properties.getSales();
        EtlProperties.Regions regions = properties.getRegions();
        log.info("Starting dimensional load from {} and {}", sales.getQuery(), regions.getFile());

        try (Connection sourceConnection = openSource();
             WarehouseConnection warehouse = WarehouseConnection.open(warehouseDataSource)) {
            DimensionalLoad load = new DimensionalLoad(warehouse);
            SqlSource salesSource = new SqlSource(sourceConnection, sales.getQuery(), sales.getNames());
            LoadSummary summary = load.run(CsvSource.open(regions.getFile(), regions.getDelimiter()), salesSource);

            contribution.incrementWriteCount(summary.getFactsInserted());
            ExecutionContext context = chunkContext.getStepContext().getStepExecution().getExecutionContext();
            context.putInt("locationsLoaded", summary.getLocationsLoaded());
            context.putInt("salesRead", summary.getSalesRead());
            context.putInt("booksCreated", summary.getBooksCreated());
            context.putInt("timesCreated", summary.getTimesCreated());
        } catch (RuntimeException e) {
            log.error("Dimensional load failed, nothing was committed: {}", e.getMessage());
            throw e;
        }
        return RepeatStatus.FINISHED;
    }

    private Connection openSource() {
        try {
            return sourceDataSource.getConnection();
        } catch (SQLException e) {
            throw new ConnectivityException("Could not connect to the source database", e);
        }
    }
}
