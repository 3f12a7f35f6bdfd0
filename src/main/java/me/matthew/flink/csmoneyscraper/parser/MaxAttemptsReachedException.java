package me.matthew.flink.csmoneyscraper.parser;

/**
 * Thrown when a page could not be scraped within the allowed number of failed attempts.
 * No items were handed to the sink when this is thrown.
 */
public class MaxAttemptsReachedException extends Exception {

    private final String url;
    private final int failedAttempts;

    public MaxAttemptsReachedException(String url, int failedAttempts) {
        super(String.format("Gave up on %s after %d failed attempts", url, failedAttempts));
        this.url = url;
        this.failedAttempts = failedAttempts;
    }

    public String getUrl() {
        return url;
    }

    public int getFailedAttempts() {
        return failedAttempts;
    }
}
