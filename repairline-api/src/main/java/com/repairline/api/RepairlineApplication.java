package com.repairline.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Main application entry point for the Repairline worker.
 * The DataSource is only created when {@code repairline.store=jdbc}.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class RepairlineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepairlineApplication.class, args);
    }
}
