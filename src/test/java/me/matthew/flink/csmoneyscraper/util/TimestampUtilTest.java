package me.matthew.flink.csmoneyscraper.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TimestampUtilTest {

    @Test
    void testMillisecondsAreConvertedToSeconds() {
        assertEquals(Instant.ofEpochSecond(1645009200L), TimestampUtil.fromCsmoneyMillis(1645009200000L));
    }

    @Test
    void testSubSecondPrecisionIsKept() {
        assertEquals(Instant.ofEpochMilli(1645009200123L), TimestampUtil.fromCsmoneyMillis(1645009200123L));
    }

    @Test
    void testNullAndZeroMeanNoLock() {
        assertNull(TimestampUtil.fromCsmoneyMillis((Long) null));
        assertNull(TimestampUtil.fromCsmoneyMillis(0L));
        assertNull(TimestampUtil.fromCsmoneyMillis(NullNode.getInstance()));
        assertNull(TimestampUtil.fromCsmoneyMillis(JsonNodeFactory.instance.numberNode(0)));
        assertNull(TimestampUtil.fromCsmoneyMillis((JsonNode) null));
    }

    @Test
    void testJsonNumbers() {
        assertEquals(Instant.ofEpochSecond(1645430400L),
                TimestampUtil.fromCsmoneyMillis(JsonNodeFactory.instance.numberNode(1645430400000L)));
        assertEquals(Instant.ofEpochSecond(1645430400L),
                TimestampUtil.fromCsmoneyMillis(DoubleNode.valueOf(1645430400000.0)));
    }

    @Test
    void testNonIntegralValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> TimestampUtil.fromCsmoneyMillis(TextNode.valueOf("tomorrow")));
        assertThrows(IllegalArgumentException.class,
                () -> TimestampUtil.fromCsmoneyMillis(DoubleNode.valueOf(1.5)));
    }
}
