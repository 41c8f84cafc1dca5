package com.storicard.warehouse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the finance warehouse loader.
 *
 * This application extracts card transactions from PostgreSQL and trades from MongoDB,
 * stages them in S3 and upsert-merges them into the Redshift data warehouse.
 * Datasets to load may be named as arguments, e.g. {@code transactions trades}.
 */
@SpringBootApplication
public class WarehouseLoaderApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(
            SpringApplication.run(WarehouseLoaderApplication.class, args)
        ));
    }
}
