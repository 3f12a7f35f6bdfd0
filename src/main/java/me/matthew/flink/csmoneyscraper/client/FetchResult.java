package me.matthew.flink.csmoneyscraper.client;

import java.util.Objects;

/**
 * Outcome of a single page fetch: either usable content or no content.
 * No-content results cover both transport failures and challenge pages;
 * callers treat them alike and only the reason differs.
 */
public final class FetchResult {

    public enum Status {
        CONTENT,
        NO_CONTENT
    }

    private final Status status;
    private final String body;
    private final String reason;

    private FetchResult(Status status, String body, String reason) {
        this.status = status;
        this.body = body;
        this.reason = reason;
    }

    public static FetchResult content(String body) {
        return new FetchResult(Status.CONTENT, Objects.requireNonNull(body, "body cannot be null"), null);
    }

    public static FetchResult noContent(String reason) {
        return new FetchResult(Status.NO_CONTENT, null, reason);
    }

    public Status getStatus() {
        return status;
    }

    public boolean hasContent() {
        return status == Status.CONTENT;
    }

    /**
     * @return the response body
     * @throws IllegalStateException if this result carries no content
     */
    public String getBody() {
        if (status != Status.CONTENT) {
            throw new IllegalStateException("Fetch result has no content: " + reason);
        }
        return body;
    }

    /**
     * @return why no content was produced, or null for content results
     */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return status == Status.CONTENT
                ? "FetchResult[CONTENT, " + body.length() + " chars]"
                : "FetchResult[NO_CONTENT, " + reason + "]";
    }
}
