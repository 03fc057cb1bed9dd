package com.strata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Strata data lifecycle service: tiering, archival and retention across
 * the configured storage providers.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class StrataApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(StrataApplication.class, args);
    }
}
