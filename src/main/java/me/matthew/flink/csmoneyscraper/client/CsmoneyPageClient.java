package me.matthew.flink.csmoneyscraper.client;

import lombok.extern.slf4j.Slf4j;
import me.matthew.flink.csmoneyscraper.session.ProxySession;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;

/**
 * HTTP client for loading cs.money trade pages through a proxy session.
 * Every request carries the same browser-like header profile and response timeout.
 * Transport failures and Cloudflare challenges are reported as no content so the
 * caller can move on to the next attempt.
 */
@Slf4j
public class CsmoneyPageClient implements PageFetcher {

    static final Duration RESPONSE_TIMEOUT = Duration.ofSeconds(10);

    static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/126.0.0.0 Safari/537.36";
    static final String REFERER = "https://cs.money/csgo/trade";

    @Override
    public FetchResult fetch(ProxySession session, String url) throws InterruptedException {
        HttpRequest request = buildRequest(url);

        HttpResponse<byte[]> response;
        String body;
        try {
            response = session.getHttpClient().send(request, HttpResponse.BodyHandlers.ofByteArray());
            checkStatus(response, url);
            body = decodeBody(response);
        } catch (IOException e) {
            // HttpTimeoutException and ConnectException are both IOExceptions
            log.warn("Request to {} via session {} failed: {}", url, session.getName(), e.toString());
            return FetchResult.noContent("transport error: " + e.getClass().getSimpleName());
        }

        if (CloudflareChallengeDetector.isChallenge(body)) {
            log.warn("Cloudflare challenge detected for {} via session {}", url, session.getName());
            return FetchResult.noContent("cloudflare challenge");
        }

        log.debug("Loaded {} ({} chars) via session {}", url, body.length(), session.getName());
        return FetchResult.content(body);
    }

    /**
     * Builds the GET request with the fixed header profile.
     */
    HttpRequest buildRequest(String url) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(RESPONSE_TIMEOUT)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9")
                .header("Accept-Encoding", "gzip, deflate") // the JDK client cannot decode brotli
                .header("Referer", REFERER)
                .header("Sec-Fetch-Dest", "document")
                .header("Sec-Fetch-Mode", "navigate")
                .header("Sec-Fetch-Site", "same-origin")
                .header("Sec-Fetch-User", "?1")
                .header("Upgrade-Insecure-Requests", "1")
                .GET()
                .build();
    }

    private void checkStatus(HttpResponse<?> response, String url) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.error("cs.money returned status {} for {}", status, url);
            throw new CsmoneyHttpStatusException(status, url);
        }
    }

    /**
     * Decompresses the body according to Content-Encoding and decodes it with the
     * charset from Content-Type, falling back to UTF-8.
     */
    private String decodeBody(HttpResponse<byte[]> response) throws IOException {
        byte[] raw = response.body() != null ? response.body() : new byte[0];
        String encoding = response.headers().firstValue("Content-Encoding").orElse("identity")
                .trim().toLowerCase(Locale.ROOT);

        byte[] decoded;
        switch (encoding) {
            case "gzip":
            case "x-gzip":
                try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(raw))) {
                    decoded = in.readAllBytes();
                }
                break;
            case "deflate":
                try (InputStream in = new InflaterInputStream(new ByteArrayInputStream(raw))) {
                    decoded = in.readAllBytes();
                }
                break;
            default:
                decoded = raw;
        }

        return new String(decoded, charsetOf(response));
    }

    private Charset charsetOf(HttpResponse<?> response) {
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "");
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    log.debug("Unsupported charset '{}' in Content-Type, using UTF-8", name);
                }
            }
        }
        return StandardCharsets.UTF_8;
    }
}
