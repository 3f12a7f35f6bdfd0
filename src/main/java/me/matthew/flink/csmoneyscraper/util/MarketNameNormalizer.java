package me.matthew.flink.csmoneyscraper.util;

/**
 * Maps a cs.money display name onto the canonical market name.
 */
@FunctionalInterface
public interface MarketNameNormalizer {

    String normalize(String name);
}
