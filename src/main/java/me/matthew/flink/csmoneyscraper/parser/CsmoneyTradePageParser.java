package me.matthew.flink.csmoneyscraper.parser;

import com.fasterxml.jackson.databind.JsonNode;
import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeException;
import dev.failsafe.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import me.matthew.flink.csmoneyscraper.client.CsmoneyPageClient;
import me.matthew.flink.csmoneyscraper.client.FetchResult;
import me.matthew.flink.csmoneyscraper.client.PageFetcher;
import me.matthew.flink.csmoneyscraper.config.CsmoneyScraperConfiguration;
import me.matthew.flink.csmoneyscraper.model.CsmoneyItemPack;
import me.matthew.flink.csmoneyscraper.session.ProxySession;
import me.matthew.flink.csmoneyscraper.session.SessionSource;
import me.matthew.flink.csmoneyscraper.sink.CsmoneyItemSink;
import me.matthew.flink.csmoneyscraper.util.CsmoneyItemMapper;
import me.matthew.flink.csmoneyscraper.util.MarketNamePatcher;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Scrapes a cs.money trade page: acquire a session, fetch, extract, map, emit.
 *
 * Failed fetches (transport errors, Cloudflare challenges) and pages whose embedded
 * state cannot be extracted count as failed attempts and are retried through a Failsafe
 * policy, each time with a newly acquired session. Item mapping errors are not retried,
 * they mean the page format changed.
 */
@Slf4j
public class CsmoneyTradePageParser implements CsmoneyParser {

    private final SessionSource sessionSource;
    private final PageFetcher fetcher;
    private final NextDataExtractor extractor;
    private final CsmoneyItemMapper mapper;
    private final Duration postponeDuration;
    private final int defaultMaxAttempts;

    /**
     * Creates a parser with the HTTP client, extractor and mapper used in production,
     * and postponement/attempt settings from the environment.
     *
     * @param sessionSource pool to borrow sessions from
     */
    public CsmoneyTradePageParser(SessionSource sessionSource) {
        this(sessionSource,
                new CsmoneyPageClient(),
                new NextDataExtractor(),
                new CsmoneyItemMapper(new MarketNamePatcher()),
                Duration.ofSeconds(CsmoneyScraperConfiguration.getPostponeSeconds()),
                CsmoneyScraperConfiguration.getMaxAttempts());
    }

    public CsmoneyTradePageParser(SessionSource sessionSource,
                                  PageFetcher fetcher,
                                  NextDataExtractor extractor,
                                  CsmoneyItemMapper mapper,
                                  Duration postponeDuration,
                                  int defaultMaxAttempts) {
        if (sessionSource == null || fetcher == null || extractor == null || mapper == null) {
            throw new IllegalArgumentException("Parser collaborators cannot be null");
        }
        if (postponeDuration == null || postponeDuration.isNegative()) {
            throw new IllegalArgumentException("Postpone duration must be non-negative");
        }
        if (defaultMaxAttempts < 0) {
            throw new IllegalArgumentException("Default max attempts must be non-negative, got: " + defaultMaxAttempts);
        }
        this.sessionSource = sessionSource;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.mapper = mapper;
        this.postponeDuration = postponeDuration;
        this.defaultMaxAttempts = defaultMaxAttempts;
    }

    @Override
    public void parse(String url, CsmoneyItemSink sink)
            throws MaxAttemptsReachedException, IOException, InterruptedException {
        parse(url, sink, defaultMaxAttempts);
    }

    @Override
    public void parse(String url, CsmoneyItemSink sink, int maxAttempts)
            throws MaxAttemptsReachedException, IOException, InterruptedException {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("Max attempts must be non-negative, got: " + maxAttempts);
        }

        List<JsonNode> skins;
        try {
            skins = Failsafe.with(createRetryPolicy(url, maxAttempts)).get(() -> loadSkins(url));
        } catch (FailsafeException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InterruptedException) {
                throw (InterruptedException) cause;
            }
            if (cause instanceof NoContentException || cause instanceof SnapshotExtractionException) {
                throw new MaxAttemptsReachedException(url, maxAttempts + 1);
            }
            throw e;
        }

        CsmoneyItemPack pack = buildPack(skins);
        log.info("Emitting {} items from {} records for {}", pack.getItems().size(), skins.size(), url);
        sink.put(pack);
    }

    /**
     * Creates the page retry policy. Only missing content and unextractable pages are retried;
     * status and mapping errors abort the scrape. No delay is configured because the session
     * pool already postpones each session after use.
     */
    private RetryPolicy<List<JsonNode>> createRetryPolicy(String url, int maxAttempts) {
        return RetryPolicy.<List<JsonNode>>builder()
                .handle(NoContentException.class, SnapshotExtractionException.class)
                .withMaxRetries(maxAttempts)
                .onFailedAttempt(e -> {
                    Throwable failure = e.getLastException();
                    if (failure instanceof SnapshotExtractionException) {
                        log.error("Failed to parse cs.money page (attempt {}, url {}, kind {})",
                                e.getAttemptCount(), url, ((SnapshotExtractionException) failure).getKind(), failure);
                    } else if (failure instanceof NoContentException) {
                        log.info("Failed to load cs.money page (attempt {}, url {}): {}",
                                e.getAttemptCount(), url, failure.getMessage());
                    }
                })
                .onRetriesExceeded(e -> log.error("Giving up on {} after {} failed attempts",
                        url, e.getAttemptCount()))
                .build();
    }

    /**
     * One attempt: borrow a session, fetch the page and extract the raw skin records.
     */
    private List<JsonNode> loadSkins(String url)
            throws InterruptedException, NoContentException, SnapshotExtractionException {
        ProxySession session = sessionSource.acquire(postponeDuration);

        FetchResult result = fetcher.fetch(session, url);
        if (!result.hasContent()) {
            throw new NoContentException(result.getReason());
        }

        log.info("Successfully got a response for {}", url);
        return extractor.extractRawList(result.getBody());
    }

    private CsmoneyItemPack buildPack(List<JsonNode> skins) {
        CsmoneyItemPack pack = new CsmoneyItemPack();
        for (JsonNode skin : skins) {
            pack.getItems().addAll(mapper.toDomain(skin));
        }
        return pack;
    }

    /**
     * Signals a fetch that produced no usable content so the retry policy can count it.
     */
    private static final class NoContentException extends Exception {

        NoContentException(String reason) {
            super(reason);
        }
    }
}
