package me.matthew.flink.csmoneyscraper.processor;

import lombok.extern.slf4j.Slf4j;
import me.matthew.flink.csmoneyscraper.config.CsmoneyScraperConfiguration;
import me.matthew.flink.csmoneyscraper.model.CsmoneyItemPack;
import me.matthew.flink.csmoneyscraper.parser.CsmoneyParser;
import me.matthew.flink.csmoneyscraper.parser.CsmoneyTradePageParser;
import me.matthew.flink.csmoneyscraper.parser.MaxAttemptsReachedException;
import me.matthew.flink.csmoneyscraper.session.PostponingSessionPool;
import me.matthew.flink.csmoneyscraper.sink.CollectorItemSink;
import org.apache.flink.api.common.functions.RichFlatMapFunction;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Gauge;
import org.apache.flink.util.Collector;

import static me.matthew.flink.csmoneyscraper.metrics.Metrics.*;

/**
 * Flink processor that turns cs.money trade page URLs into item packs.
 *
 * Each incoming URL is scraped with the configured retry bound. A page that keeps failing
 * is logged, counted and skipped so one bad URL does not fail the job; item mapping errors
 * and sink failures still propagate and let Flink's restart strategy handle them.
 */
@Slf4j
public class CsmoneyScrapeProcessor extends RichFlatMapFunction<String, CsmoneyItemPack> {

    private final int maxAttempts;

    private transient CsmoneyParser parser;

    private transient Counter pagesRequested;
    private transient Counter pagesScraped;
    private transient Counter pagesExhausted;
    private transient Counter itemsEmitted;

    private volatile long lastScrapeTime = 0;

    /**
     * Creates a processor that takes its retry bound from the environment.
     */
    public CsmoneyScrapeProcessor() {
        this(CsmoneyScraperConfiguration.getMaxAttempts());
    }

    /**
     * @param maxAttempts failed attempts tolerated per page
     */
    public CsmoneyScrapeProcessor(int maxAttempts) {
        this(null, maxAttempts);
    }

    CsmoneyScrapeProcessor(CsmoneyParser parser, int maxAttempts) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("Max attempts must be non-negative, got: " + maxAttempts);
        }
        this.parser = parser;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public void open(Configuration parameters) throws Exception {
        super.open(parameters);

        var metricGroup = getRuntimeContext().getMetricGroup();
        pagesRequested = metricGroup.counter(CSMONEY_PAGES_REQUESTED);
        pagesScraped = metricGroup.counter(CSMONEY_PAGES_SCRAPED);
        pagesExhausted = metricGroup.counter(CSMONEY_PAGES_EXHAUSTED);
        itemsEmitted = metricGroup.counter(CSMONEY_ITEMS_EMITTED);

        metricGroup.gauge(CSMONEY_LAST_SCRAPE_TIME, new Gauge<Long>() {
            @Override
            public Long getValue() {
                return lastScrapeTime;
            }
        });

        if (parser == null) {
            PostponingSessionPool sessionPool =
                    PostponingSessionPool.fromProxies(CsmoneyScraperConfiguration.getProxies());
            parser = new CsmoneyTradePageParser(sessionPool);
        }

        log.info("CsmoneyScrapeProcessor initialized with max {} failed attempts per page", maxAttempts);
    }

    @Override
    public void flatMap(String url, Collector<CsmoneyItemPack> out) throws Exception {
        if (url == null || url.trim().isEmpty()) {
            log.warn("Skipping blank cs.money URL");
            return;
        }

        pagesRequested.inc();
        long startTime = System.currentTimeMillis();
        CollectorItemSink sink = new CollectorItemSink(out);

        try {
            parser.parse(url.trim(), sink, maxAttempts);
            pagesScraped.inc();
            itemsEmitted.inc(sink.getItemsEmitted());
        } catch (MaxAttemptsReachedException e) {
            pagesExhausted.inc();
            log.error("Skipping {} after {} failed attempts", e.getUrl(), e.getFailedAttempts());
        } finally {
            lastScrapeTime = System.currentTimeMillis() - startTime;
        }
    }
}
