package com.example.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Catalog Order Service.
 */
@SpringBootApplication
public class CatalogOrderApplication {

    public static void main(String[] args) {
        SpringApplication.run(CatalogOrderApplication.class, args);
    }
}
