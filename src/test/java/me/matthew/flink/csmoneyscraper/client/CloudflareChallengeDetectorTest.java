package me.matthew.flink.csmoneyscraper.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CloudflareChallengeDetectorTest {

    @Test
    void testChallengeMarkers() {
        assertTrue(CloudflareChallengeDetector.isChallenge("<title>Just a moment...</title>"));
        assertTrue(CloudflareChallengeDetector.isChallenge("<div id=\"cf-browser-verification\"></div>"));
        assertTrue(CloudflareChallengeDetector.isChallenge("<script src=\"/cdn-cgi/challenge-platform/h/b/orchestrate/cf-chl\"></script>"));
    }

    @Test
    void testMatchIsCaseInsensitive() {
        assertTrue(CloudflareChallengeDetector.isChallenge("CF-Mitigated"));
        assertTrue(CloudflareChallengeDetector.isChallenge("JUST A MOMENT"));
    }

    @Test
    void testRegularPagesPass() {
        assertFalse(CloudflareChallengeDetector.isChallenge("<html><body>ok</body></html>"));
        assertFalse(CloudflareChallengeDetector.isChallenge(""));
        assertFalse(CloudflareChallengeDetector.isChallenge(null));
    }
}
