package me.matthew.flink.csmoneyscraper.parser;

import me.matthew.flink.csmoneyscraper.sink.CsmoneyItemSink;

import java.io.IOException;

/**
 * Scrapes one cs.money trade page and delivers its items to a sink.
 */
public interface CsmoneyParser {

    /**
     * Scrapes the page with the default attempt bound.
     *
     * @see #parse(String, CsmoneyItemSink, int)
     */
    void parse(String url, CsmoneyItemSink sink)
            throws MaxAttemptsReachedException, IOException, InterruptedException;

    /**
     * Scrapes the page, retrying failed fetches and unparseable pages until one
     * batch has been delivered or more than {@code maxAttempts} attempts have failed.
     *
     * @param url trade page to scrape
     * @param sink receives exactly one batch on success
     * @param maxAttempts number of failed attempts tolerated; 0 still allows one attempt
     * @throws MaxAttemptsReachedException if every allowed attempt failed
     * @throws IOException if the sink fails to accept the batch
     * @throws InterruptedException if the thread is interrupted while waiting for a session or response
     */
    void parse(String url, CsmoneyItemSink sink, int maxAttempts)
            throws MaxAttemptsReachedException, IOException, InterruptedException;
}
