package com.whereq.vigil;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for WhereQ Vigil.
 * This service supervises nmap scan jobs under bounded concurrency, extracts
 * structured results from their XML reports and runs one-time and recurring
 * scheduled scans.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class VigilApplication {

    public static void main(String[] args) {
        SpringApplication.run(VigilApplication.class, args);
    }
}
