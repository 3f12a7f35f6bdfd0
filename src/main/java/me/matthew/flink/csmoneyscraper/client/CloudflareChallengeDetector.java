package me.matthew.flink.csmoneyscraper.client;

import java.util.List;
import java.util.Locale;

/**
 * Recognises Cloudflare anti-bot interstitials served instead of the real page.
 */
public final class CloudflareChallengeDetector {

    private static final List<String> CHALLENGE_MARKERS = List.of(
            "just a moment",
            "cf-mitigated",
            "cf-browser-verification",
            "cf-chl"
    );

    private CloudflareChallengeDetector() {
    }

    /**
     * Checks the response text for any known challenge marker, ignoring case.
     *
     * @param text raw response body
     * @return true if the body is a challenge page rather than usable content
     */
    public static boolean isChallenge(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        for (String marker : CHALLENGE_MARKERS) {
            if (lowered.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
