package edu.uconn.salesdw.job;

import edu.uconn.salesdw.config.EtlProperties;
import edu.uconn.salesdw.warehouse.WarehouseConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * Bulk-copies the configured gzip file into its target table and commits.
 */
@Slf4j
@Component
public class BulkLoadTasklet implements Tasklet {

    private final DataSource warehouseDataSource;
    private final EtlProperties properties;
    private final BulkLoader bulkLoader = new BulkLoader();

    public BulkLoadTasklet(DataSource warehouseDataSource, EtlProperties properties) {
        this.warehouseDataSource = warehouseDataSource;
        this.properties = properties;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        EtlProperties.Bulk bulk = properties.getBulk();
        log.info("Starting bulk load of {} into {}", bulk.getInputFile(), bulk.getTargetTable());

        try (WarehouseConnection warehouse = WarehouseConnection.open(warehouseDataSource)) {
            BulkCopyChannel channel = PostgresCopyChannel.open(warehouse.unwrap(), bulk.getTargetTable());
            long lines = bulkLoader.load(bulk.getInputFile(), channel);
            warehouse.commit();
            contribution.incrementWriteCount(lines);
        } catch (RuntimeException e) {
            log.error("Bulk load into {} failed, nothing was committed: {}", bulk.getTargetTable(), e.getMessage());
            throw e;
        }
        return RepeatStatus.FINISHED;
    }
}
