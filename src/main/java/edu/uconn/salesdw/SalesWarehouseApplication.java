package edu.uconn.salesdw;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the sales warehouse ETL.
 *
 * Runs one batch job per invocation: the dimensional load of the sales star schema,
 * or the bulk copy of a compressed staging file. The exit code reflects the job outcome.
 */
@SpringBootApplication
public class SalesWarehouseApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(
            SpringApplication.run(SalesWarehouseApplication.class, args)
        ));
    }
}
