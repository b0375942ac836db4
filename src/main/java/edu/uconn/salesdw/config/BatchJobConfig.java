package edu.uconn.salesdw.config;

import edu.uconn.salesdw.job.BulkLoadTasklet;
import edu.uconn.salesdw.job.DimensionalLoadTasklet;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * The two batch jobs. Each is a single tasklet step; the tasklets manage their own
 * warehouse transaction. Select one with {@code spring.batch.job.name}.
 */
@Configuration
public class BatchJobConfig {

    public static final String DIMENSIONAL_ETL_JOB = "dimensionalEtlJob";
    public static final String BULK_LOAD_JOB = "bulkLoadJob";

    @Bean
    public Step loadStarSchemaStep(JobRepository jobRepository, PlatformTransactionManager transactionManager,
                                   DimensionalLoadTasklet tasklet) {
        return new StepBuilder("loadStarSchema", jobRepository)
            .tasklet(tasklet, transactionManager)
            .build();
    }

    @Bean(name = DIMENSIONAL_ETL_JOB)
    public Job dimensionalEtlJob(JobRepository jobRepository, @Qualifier("loadStarSchemaStep") Step step) {
        return new JobBuilder(DIMENSIONAL_ETL_JOB, jobRepository)
            .incrementer(new RunIdIncrementer())
            .start(step)
            .build();
    }

    @Bean
    public Step bulkCopyStep(JobRepository jobRepository, PlatformTransactionManager transactionManager,
                             BulkLoadTasklet tasklet) {
        return new StepBuilder("bulkCopy", jobRepository)
            .tasklet(tasklet, transactionManager)
            .build();
    }

    @Bean(name = BULK_LOAD_JOB)
    public Job bulkLoadJob(JobRepository jobRepository, @Qualifier("bulkCopyStep") Step step) {
        return new JobBuilder(BULK_LOAD_JOB, jobRepository)
            .incrementer(new RunIdIncrementer())
            .start(step)
            .build();
    }
}
