package me.matthew.flink.csmoneyscraper.session;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session pool that postpones each session after it is handed out.
 * A caller always gets the session that becomes available first, sleeping until then if needed.
 * Waiters are served in arrival order through a fair lock.
 */
@Slf4j
public class PostponingSessionPool implements SessionSource {

    private final List<ProxySession> sessions;
    private final Instant[] availableAt;
    private final ReentrantLock lock = new ReentrantLock(true);

    public PostponingSessionPool(List<ProxySession> sessions) {
        if (sessions == null || sessions.isEmpty()) {
            throw new IllegalArgumentException("Session pool needs at least one session");
        }
        this.sessions = List.copyOf(sessions);
        this.availableAt = new Instant[this.sessions.size()];
        for (int i = 0; i < availableAt.length; i++) {
            availableAt[i] = Instant.EPOCH;
        }
        log.info("Session pool initialized with {} sessions", this.sessions.size());
    }

    /**
     * Builds a pool from {@code host:port} proxy entries.
     * An empty list yields a pool with a single direct session.
     *
     * @param proxies proxy addresses
     * @return the pool
     * @throws IllegalArgumentException if an entry is not a valid {@code host:port}
     */
    public static PostponingSessionPool fromProxies(List<String> proxies) {
        List<ProxySession> sessions = new ArrayList<>();
        for (String proxy : proxies) {
            sessions.add(parseProxy(proxy));
        }
        if (sessions.isEmpty()) {
            log.info("No proxies configured, using a direct session");
            sessions.add(ProxySession.direct());
        }
        return new PostponingSessionPool(sessions);
    }

    static ProxySession parseProxy(String proxy) {
        String trimmed = proxy == null ? "" : proxy.trim();
        int separator = trimmed.lastIndexOf(':');
        if (separator <= 0 || separator == trimmed.length() - 1) {
            throw new IllegalArgumentException("Proxy must be in host:port form, got: " + proxy);
        }
        String host = trimmed.substring(0, separator);
        int port;
        try {
            port = Integer.parseInt(trimmed.substring(separator + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Proxy port must be a number, got: " + proxy, e);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Proxy port out of range, got: " + proxy);
        }
        return ProxySession.viaProxy(host, port);
    }

    @Override
    public ProxySession acquire(Duration postpone) throws InterruptedException {
        if (postpone == null || postpone.isNegative()) {
            throw new IllegalArgumentException("Postpone duration must be non-negative");
        }
        lock.lockInterruptibly();
        try {
            int next = 0;
            for (int i = 1; i < availableAt.length; i++) {
                if (availableAt[i].isBefore(availableAt[next])) {
                    next = i;
                }
            }

            Duration wait = Duration.between(Instant.now(), availableAt[next]);
            if (!wait.isNegative() && !wait.isZero()) {
                log.debug("All sessions postponed: waiting {} ms for {}", wait.toMillis(), sessions.get(next));
                Thread.sleep(wait.toMillis());
            }

            availableAt[next] = Instant.now().plus(postpone);
            return sessions.get(next);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return sessions.size();
    }
}
