package com.products.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The main entry point for the Product Scraper application.
 *
 * <p>This Spring Boot application exposes RESTful endpoints for:
 * <ul>
 *   <li>scraping single product listings,</li>
 *   <li>batch scraping with bounded concurrency,</li>
 *   <li>usage statistics and the supported source table.</li>
 * </ul>
 * It wires together the source registry, the Firecrawl fetch adapter, the
 * pricing/feature parsers and Spring MVC controllers.</p>
 *
 * <p>Usage:
 * <pre>{@code
 *   // From the command line:
 *   FIRECRAWL_API_KEY=fc-... mvn spring-boot:run
 *
 *   // Or run the JAR:
 *   java -jar target/product-scraper-0.0.1-SNAPSHOT.jar
 * }</pre>
 *
 * <p>Once started, the application will listen on the configured port (default
 * 8080) and serve requests under <code>/api/scrape</code> and <code>/api/sources</code>.</p>
 */
@SpringBootApplication
public class ProductScraperApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments (ignored)
     */
    public static void main(final String[] args) {
        SpringApplication.run(ProductScraperApplication.class, args);
    }
}
