package me.matthew.flink.csmoneyscraper.client;

/**
 * Thrown when cs.money answers with a non-success HTTP status.
 * Unlike transport errors this is not converted into a retry.
 */
public class CsmoneyHttpStatusException extends RuntimeException {

    private final int statusCode;
    private final String url;

    public CsmoneyHttpStatusException(int statusCode, String url) {
        super(String.format("cs.money request failed with status %d for %s", statusCode, url));
        this.statusCode = statusCode;
        this.url = url;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getUrl() {
        return url;
    }
}
