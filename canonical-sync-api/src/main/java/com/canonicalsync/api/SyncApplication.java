package com.canonicalsync.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the canonical sync service.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@ComponentScan(basePackages = {
    "com.canonicalsync.api",
    "com.canonicalsync.engine"
})
public class SyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(SyncApplication.class, args);
    }
}
