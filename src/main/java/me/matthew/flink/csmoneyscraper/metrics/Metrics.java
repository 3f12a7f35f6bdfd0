package me.matthew.flink.csmoneyscraper.metrics;

public final class Metrics {

    // Scrape processor metrics
    public static final String CSMONEY_PAGES_REQUESTED = "csmoney_pages_requested";
    public static final String CSMONEY_PAGES_SCRAPED = "csmoney_pages_scraped";
    public static final String CSMONEY_PAGES_EXHAUSTED = "csmoney_pages_exhausted";
    public static final String CSMONEY_ITEMS_EMITTED = "csmoney_items_emitted";

    // Performance tracking gauge metrics
    public static final String CSMONEY_LAST_SCRAPE_TIME = "csmoney_last_scrape_time";
}
