package me.matthew.flink.csmoneyscraper.config;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Utility class for managing scraper configuration from environment variables.
 * Handles the proxy list, session postponement and the retry bound.
 */
@Slf4j
public class CsmoneyScraperConfiguration {

    // Optional environment variables
    private static final String PROXIES_ENV = "CSMONEY_PROXIES";
    private static final String POSTPONE_SECONDS_ENV = "CSMONEY_POSTPONE_SECONDS";
    private static final String MAX_ATTEMPTS_ENV = "CSMONEY_MAX_ATTEMPTS";

    // Default values
    private static final int DEFAULT_POSTPONE_SECONDS = 25;
    private static final int DEFAULT_MAX_ATTEMPTS = 300;

    /**
     * Reads the proxy list from environment variable.
     * @return proxy entries in host:port form, empty if none configured (direct connection)
     */
    public static List<String> getProxies() {
        return parseProxies(System.getenv(PROXIES_ENV));
    }

    static List<String> parseProxies(String value) {
        if (value == null || value.trim().isEmpty()) {
            return new ArrayList<>();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * Reads how long a proxy session stays unavailable after being handed out.
     * @return postponement in seconds, or default value if not configured
     * @throws IllegalArgumentException if CSMONEY_POSTPONE_SECONDS is set but not a non-negative integer
     */
    public static int getPostponeSeconds() {
        return readNonNegativeInt(POSTPONE_SECONDS_ENV, DEFAULT_POSTPONE_SECONDS);
    }

    /**
     * Reads the number of failed attempts tolerated per page.
     * @return max attempts, or default value if not configured
     * @throws IllegalArgumentException if CSMONEY_MAX_ATTEMPTS is set but not a non-negative integer
     */
    public static int getMaxAttempts() {
        return readNonNegativeInt(MAX_ATTEMPTS_ENV, DEFAULT_MAX_ATTEMPTS);
    }

    private static int readNonNegativeInt(String envName, int defaultValue) {
        return parseNonNegativeInt(envName, System.getenv(envName), defaultValue);
    }

    static int parseNonNegativeInt(String envName, String value, int defaultValue) {
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }

        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                throw new IllegalArgumentException(
                    String.format("Environment variable %s must be a non-negative integer, got: %s",
                        envName, value)
                );
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                String.format("Environment variable %s must be a valid integer, got: %s",
                    envName, value), e
            );
        }
    }

    /**
     * Validates the scraper configuration and logs a summary.
     * @throws IllegalArgumentException if any configured value is invalid
     */
    public static void validateConfiguration() {
        log.info("Validating cs.money scraper configuration...");

        try {
            List<String> proxies = getProxies();
            int postponeSeconds = getPostponeSeconds();
            int maxAttempts = getMaxAttempts();

            log.info("cs.money scraper configuration validated successfully:");
            log.info("  Proxies: {}", proxies.isEmpty() ? "none (direct connection)" : proxies.size());
            log.info("  Session postponement: {} seconds", postponeSeconds);
            log.info("  Max failed attempts per page: {}", maxAttempts);

        } catch (IllegalArgumentException e) {
            log.error("cs.money scraper configuration validation failed: {}", e.getMessage());
            throw e;
        }
    }
}
