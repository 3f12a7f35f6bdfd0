package me.matthew.flink.csmoneyscraper.sink;

import me.matthew.flink.csmoneyscraper.model.CsmoneyItemPack;

import java.io.IOException;

/**
 * Downstream receiver of scraped item batches.
 * The parser calls {@link #put} at most once per scrape and never retries it.
 */
@FunctionalInterface
public interface CsmoneyItemSink {

    /**
     * @param pack a fully assembled batch; ownership passes to the sink
     * @throws IOException if the batch could not be delivered
     * @throws InterruptedException if delivery was interrupted
     */
    void put(CsmoneyItemPack pack) throws IOException, InterruptedException;
}
