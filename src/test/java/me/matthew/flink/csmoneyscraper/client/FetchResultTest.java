package me.matthew.flink.csmoneyscraper.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FetchResultTest {

    @Test
    void testContent() {
        FetchResult result = FetchResult.content("<html></html>");

        assertTrue(result.hasContent());
        assertEquals(FetchResult.Status.CONTENT, result.getStatus());
        assertEquals("<html></html>", result.getBody());
        assertNull(result.getReason());
    }

    @Test
    void testNoContentHasNoBody() {
        FetchResult result = FetchResult.noContent("cloudflare challenge");

        assertFalse(result.hasContent());
        assertEquals(FetchResult.Status.NO_CONTENT, result.getStatus());
        assertEquals("cloudflare challenge", result.getReason());
        assertThrows(IllegalStateException.class, result::getBody);
    }

    @Test
    void testContentRequiresBody() {
        assertThrows(NullPointerException.class, () -> FetchResult.content(null));
    }
}
