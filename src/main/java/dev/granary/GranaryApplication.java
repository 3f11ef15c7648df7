package dev.granary;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the Granary announcement crawler.
 *
 * <p>Runs the scheduled crawl batches, the embedding refresh job and the REST surface on port
 * 8080.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
@EnableScheduling
public class GranaryApplication {
    public static void main(String[] args) {
        SpringApplication.run(GranaryApplication.class, args);
    }
}
