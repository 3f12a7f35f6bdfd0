package me.matthew.flink.csmoneyscraper.session;

import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

/**
 * One outbound network identity: an HTTP client, optionally routed through a proxy.
 */
public class ProxySession {

    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final String name;
    private final HttpClient httpClient;

    public ProxySession(String name, HttpClient httpClient) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
    }

    /**
     * Creates a session that connects directly, without a proxy.
     */
    public static ProxySession direct() {
        return new ProxySession("direct", baseBuilder().build());
    }

    /**
     * Creates a session that routes all requests through the given HTTP proxy.
     *
     * @param host proxy host
     * @param port proxy port
     */
    public static ProxySession viaProxy(String host, int port) {
        HttpClient client = baseBuilder()
                .proxy(ProxySelector.of(InetSocketAddress.createUnresolved(host, port)))
                .build();
        return new ProxySession(host + ":" + port, client);
    }

    private static HttpClient.Builder baseBuilder() {
        return HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL);
    }

    public String getName() {
        return name;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    @Override
    public String toString() {
        return "ProxySession[" + name + "]";
    }
}
