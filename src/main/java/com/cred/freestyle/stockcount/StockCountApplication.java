package com.cred.freestyle.stockcount;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application class for the Stock Count service.
 *
 * System Overview:
 * - Tracks in-progress stock counts, one per location and product category
 * - Accepts RFID tag reads reported from the shop floor against a stock count
 * - Holds all state in memory for the lifetime of the process
 *
 * Architecture:
 * - API Layer: REST controller with validation and OpenAPI metadata
 * - Service Layer: lookup, filtering, start and stock take logic
 * - Data Access Layer: in-memory repositories guarded by a read/write lock
 * - Infrastructure Layer: Micrometer metrics
 *
 * @author Stock Count Team
 */
@SpringBootApplication
public class StockCountApplication {

    public static void main(String[] args) {
        SpringApplication.run(StockCountApplication.class, args);
    }
}
