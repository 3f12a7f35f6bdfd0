package me.matthew.flink.csmoneyscraper.config;

import lombok.extern.slf4j.Slf4j;

/**
 * Centralized configuration validation for the scraper and its Kafka output.
 */
@Slf4j
public class ApiConfiguration {

    /**
     * Validates all configurations required to scrape pages and publish item packs.
     *
     * @throws IllegalArgumentException if any required configuration is missing or invalid
     */
    public static void validateAllConfigurations() {
        log.info("Validating all configurations for the cs.money scraper...");

        try {
            CsmoneyScraperConfiguration.validateConfiguration();
            KafkaConfiguration.validateConfiguration();

            log.info("All configurations validated successfully");

        } catch (IllegalArgumentException e) {
            log.error("Configuration validation failed: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Checks if the Kafka output is configured without throwing exceptions.
     *
     * @return true if brokers and topic are set, false otherwise
     */
    public static boolean isKafkaOutputConfigured() {
        try {
            KafkaConfiguration.getKafkaBrokers();
            KafkaConfiguration.getKafkaTopic();
            return true;
        } catch (IllegalArgumentException e) {
            log.debug("Kafka output not configured: {}", e.getMessage());
            return false;
        }
    }
}
