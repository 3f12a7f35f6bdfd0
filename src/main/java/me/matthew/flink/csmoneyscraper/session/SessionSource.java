package me.matthew.flink.csmoneyscraper.session;

import java.time.Duration;

/**
 * Hands out network sessions from a shared pool.
 */
public interface SessionSource {

    /**
     * Returns a usable session, waiting while every session is still postponed.
     * Acquisition itself never fails; the only way out without a session is interruption.
     *
     * @param postpone how long the returned session stays unavailable to other callers
     * @return a session to use for one request
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    ProxySession acquire(Duration postpone) throws InterruptedException;
}
