package net.recipecatalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the recipe catalog service.
 */
@SpringBootApplication
public class RecipeCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecipeCatalogApplication.class, args);
    }
}
