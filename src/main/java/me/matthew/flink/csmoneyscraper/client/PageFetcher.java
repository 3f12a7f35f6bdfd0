package me.matthew.flink.csmoneyscraper.client;

import me.matthew.flink.csmoneyscraper.session.ProxySession;

/**
 * Fetches one page through a borrowed session.
 * Implementations never let transport errors escape; they report them as {@link FetchResult#noContent}.
 */
@FunctionalInterface
public interface PageFetcher {

    /**
     * @param session session to send the request through
     * @param url page to fetch
     * @return content, or no content for transport errors and challenge pages
     * @throws CsmoneyHttpStatusException if the server answers with a non-success status
     * @throws InterruptedException if the calling thread is interrupted while waiting for the response
     */
    FetchResult fetch(ProxySession session, String url) throws InterruptedException;
}
