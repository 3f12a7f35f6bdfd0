package me.matthew.flink.csmoneyscraper.config;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Properties;

/**
 * Utility class for managing Kafka producer configuration from environment variables.
 * Handles reading and validation of broker, topic and connection retry parameters.
 */
@Slf4j
public class KafkaConfiguration {

    // Required environment variables
    private static final String KAFKA_BROKERS_ENV = "KAFKA_BROKERS";
    private static final String KAFKA_TOPIC_ENV = "KAFKA_TOPIC";

    // Optional environment variables
    private static final String KAFKA_CONNECT_MAX_RETRIES_ENV = "KAFKA_CONNECT_MAX_RETRIES";
    private static final String KAFKA_CONNECT_RETRY_DELAY_MS_ENV = "KAFKA_CONNECT_RETRY_DELAY_MS";

    // Prefix for additional Kafka producer properties
    private static final String KAFKA_PRODUCER_PREFIX = "KAFKA_PRODUCER_";

    private static final int DEFAULT_CONNECT_MAX_RETRIES = 5;
    private static final int DEFAULT_CONNECT_RETRY_DELAY_MS = 2000;

    /**
     * Reads Kafka broker addresses from environment variable.
     * @return Comma-separated list of Kafka broker addresses
     * @throws IllegalArgumentException if KAFKA_BROKERS is not set or empty
     */
    public static String getKafkaBrokers() {
        return requireEnv(KAFKA_BROKERS_ENV);
    }

    /**
     * Reads the topic item packs are published to.
     * @return Kafka topic name
     * @throws IllegalArgumentException if KAFKA_TOPIC is not set or empty
     */
    public static String getKafkaTopic() {
        return requireEnv(KAFKA_TOPIC_ENV);
    }

    private static String requireEnv(String name) {
        String value = System.getenv(name);
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(
                String.format("Environment variable %s is required but not set or empty", name)
            );
        }
        return value.trim();
    }

    /**
     * @return retries after the first connection attempt, default 5
     * @throws IllegalArgumentException if KAFKA_CONNECT_MAX_RETRIES is set but invalid
     */
    public static int getConnectMaxRetries() {
        return CsmoneyScraperConfiguration.parseNonNegativeInt(KAFKA_CONNECT_MAX_RETRIES_ENV,
                System.getenv(KAFKA_CONNECT_MAX_RETRIES_ENV), DEFAULT_CONNECT_MAX_RETRIES);
    }

    /**
     * @return delay between connection attempts in milliseconds, default 2000
     * @throws IllegalArgumentException if KAFKA_CONNECT_RETRY_DELAY_MS is set but invalid
     */
    public static int getConnectRetryDelayMs() {
        return CsmoneyScraperConfiguration.parseNonNegativeInt(KAFKA_CONNECT_RETRY_DELAY_MS_ENV,
                System.getenv(KAFKA_CONNECT_RETRY_DELAY_MS_ENV), DEFAULT_CONNECT_RETRY_DELAY_MS);
    }

    /**
     * Reads additional Kafka producer properties from environment variables with KAFKA_PRODUCER_ prefix.
     * Environment variables like KAFKA_PRODUCER_LINGER_MS become producer property linger.ms.
     * @return Properties object containing additional Kafka producer configuration
     */
    public static Properties getKafkaProducerProperties() {
        return toProducerProperties(System.getenv());
    }

    static Properties toProducerProperties(Map<String, String> environment) {
        Properties properties = new Properties();

        environment.forEach((key, value) -> {
            if (key.startsWith(KAFKA_PRODUCER_PREFIX) && key.length() > KAFKA_PRODUCER_PREFIX.length()) {
                String propertyName = key.substring(KAFKA_PRODUCER_PREFIX.length());

                // Convert from UPPER_CASE to lower.case format
                String kafkaPropertyName = propertyName.toLowerCase().replace('_', '.');

                properties.setProperty(kafkaPropertyName, value);
                log.debug("Added Kafka producer property: {} = {}", kafkaPropertyName, value);
            }
        });

        return properties;
    }

    /**
     * Creates a complete Properties object with all Kafka producer configuration.
     * @return Complete Properties object for Kafka producer configuration
     * @throws IllegalArgumentException if KAFKA_BROKERS is not set
     */
    public static Properties getAllProducerProperties() {
        Properties properties = getKafkaProducerProperties();

        properties.setProperty("bootstrap.servers", getKafkaBrokers());

        // Set default properties if not already specified
        properties.putIfAbsent("key.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        properties.putIfAbsent("value.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        properties.putIfAbsent("acks", "all");
        properties.putIfAbsent("max.block.ms", "10000");

        return properties;
    }

    /**
     * Validates that all required Kafka configuration is present and valid.
     * @throws IllegalArgumentException if any required configuration is missing or invalid
     */
    public static void validateConfiguration() {
        log.info("Validating Kafka configuration...");

        try {
            String brokers = getKafkaBrokers();
            String topic = getKafkaTopic();
            int maxRetries = getConnectMaxRetries();
            int retryDelayMs = getConnectRetryDelayMs();

            log.info("Kafka configuration validated successfully:");
            log.info("  Brokers: {}", brokers);
            log.info("  Topic: {}", topic);
            log.info("  Connect retries: {} (delay {} ms)", maxRetries, retryDelayMs);

            Properties additionalProps = getKafkaProducerProperties();
            if (!additionalProps.isEmpty()) {
                log.info("  Additional producer properties: {}", additionalProps.size());
            }

        } catch (IllegalArgumentException e) {
            log.error("Kafka configuration validation failed: {}", e.getMessage());
            throw e;
        }
    }
}
