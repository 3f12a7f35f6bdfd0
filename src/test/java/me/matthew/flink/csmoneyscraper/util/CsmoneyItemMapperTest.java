package me.matthew.flink.csmoneyscraper.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.matthew.flink.csmoneyscraper.model.CsmoneyItem;
import me.matthew.flink.csmoneyscraper.model.CsmoneyItemCategory;
import me.matthew.flink.csmoneyscraper.parser.NextDataExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CsmoneyItemMapper using recorded cs.money skin records.
 */
class CsmoneyItemMapperTest {

    private static final Instant UNLOCK = Instant.ofEpochSecond(1645430400L);

    private ObjectMapper objectMapper;
    private CsmoneyItemMapper mapper;

    @BeforeEach
    void setUp() {
        objectMapper = NextDataExtractor.createObjectMapper();
        mapper = new CsmoneyItemMapper(new MarketNamePatcher());
    }

    private JsonNode fixture(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/csmoney/" + name)) {
            assertNotNull(in, "Missing fixture " + name);
            return objectMapper.readTree(in);
        }
    }

    @Test
    void testSingleItem() throws IOException {
        List<CsmoneyItem> items = mapper.toDomain(fixture("item_1.json"));

        CsmoneyItem expected = CsmoneyItem.builder()
                .name("★ Butterfly Knife | Doppler (Factory New)")
                .price(24768.93)
                .assetId("24898849555")
                .nameId(3985)
                .type(CsmoneyItemCategory.KNIFE)
                .floatValue("0.008115612901747")
                .unlockTimestamp(UNLOCK)
                .overpayFloat(140.69)
                .build();
        assertEquals(List.of(expected), items);
    }

    @Test
    void testRecordWithoutFullNameIsDropped() throws IOException {
        assertTrue(mapper.toDomain(fixture("item_without_full_name_1.json")).isEmpty());
    }

    @Test
    void testStackExpandsIntoSiblings() throws IOException {
        List<CsmoneyItem> items = mapper.toDomain(fixture("item_with_stack_1.json"));

        CsmoneyItem first = CsmoneyItem.builder()
                .name("★ Sport Gloves | Vice (Factory New)")
                .price(35718.7)
                .assetId("24491496626")
                .nameId(29570)
                .type(CsmoneyItemCategory.GLOVE)
                .floatValue("0.065496817231178")
                .build();
        CsmoneyItem second = first.toBuilder()
                .assetId("24571330159")
                .floatValue("0.067453943192958")
                .build();
        assertEquals(List.of(first, second), items);
    }

    @Test
    void testStackWithTradeLockAndPatchedName() throws IOException {
        List<CsmoneyItem> items = mapper.toDomain(fixture("item_with_stack_2.json"));

        assertEquals(2, items.size());
        assertEquals("★ M9 Bayonet | Doppler (Factory New)", items.get(0).getName());
        assertEquals("★ M9 Bayonet | Doppler (Factory New)", items.get(1).getName());

        assertEquals("24899230485", items.get(0).getAssetId());
        assertEquals("0.056123819202184", items.get(0).getFloatValue());
        assertEquals("24902572721", items.get(1).getAssetId());
        assertEquals("0.06806051731109601", items.get(1).getFloatValue());

        for (CsmoneyItem item : items) {
            assertEquals(11592.8, item.getPrice());
            assertEquals(15840, item.getNameId());
            assertEquals(CsmoneyItemCategory.KNIFE, item.getType());
            assertEquals(UNLOCK, item.getUnlockTimestamp());
            assertNull(item.getOverpayFloat());
        }
    }

    @Test
    void testSiblingWithoutTradeLockIsUnlocked() throws IOException {
        ObjectNode raw = (ObjectNode) fixture("item_with_stack_2.json");
        ((ObjectNode) raw.get("stackItems").get(0)).remove("tradeLock");

        List<CsmoneyItem> items = mapper.toDomain(raw);

        assertEquals(UNLOCK, items.get(0).getUnlockTimestamp());
        assertNull(items.get(1).getUnlockTimestamp());
    }

    @Test
    void testSiblingsNeverCarryOverpay() throws IOException {
        ObjectNode raw = (ObjectNode) fixture("item_with_stack_1.json");
        raw.putObject("overpay").put("float", 12.5);

        List<CsmoneyItem> items = mapper.toDomain(raw);

        assertEquals(12.5, items.get(0).getOverpayFloat());
        assertNull(items.get(1).getOverpayFloat());
    }

    @Test
    void testRecordWithoutAllStackFieldsIsNotExpanded() throws IOException {
        ObjectNode raw = (ObjectNode) fixture("item_with_stack_1.json");
        raw.remove("stackId");

        assertEquals(1, mapper.toDomain(raw).size());
    }

    @Test
    void testMinimalRecord() throws IOException {
        JsonNode raw = objectMapper.readTree(
                "{\"fullName\":\"AK-47 | Redline (Field-Tested)\",\"price\":12.34,\"assetId\":123,\"nameId\":456,\"type\":3}");

        List<CsmoneyItem> items = mapper.toDomain(raw);

        assertEquals(1, items.size());
        CsmoneyItem item = items.get(0);
        assertEquals("AK-47 | Redline (Field-Tested)", item.getName());
        assertEquals(12.34, item.getPrice());
        assertEquals("123", item.getAssetId());
        assertEquals(456, item.getNameId());
        assertEquals(CsmoneyItemCategory.RIFLE, item.getType());
        assertNull(item.getFloatValue());
        assertNull(item.getUnlockTimestamp());
        assertNull(item.getOverpayFloat());
    }

    @Test
    void testTextualAssetIdIsKept() throws IOException {
        JsonNode raw = objectMapper.readTree(
                "{\"fullName\":\"AK-47 | Redline (Field-Tested)\",\"price\":12.34,\"assetId\":\"0042\",\"nameId\":456,\"type\":3}");

        assertEquals("0042", mapper.toDomain(raw).get(0).getAssetId());
    }

    @Test
    void testZeroTradeLockMeansUnlocked() throws IOException {
        ObjectNode raw = (ObjectNode) fixture("item_1.json");
        raw.put("tradeLock", 0);

        assertNull(mapper.toDomain(raw).get(0).getUnlockTimestamp());
    }

    @Test
    void testUnknownCategoryThrows() throws IOException {
        ObjectNode raw = (ObjectNode) fixture("item_1.json");
        raw.put("type", 99);

        CsmoneyItemMappingException exception = assertThrows(
                CsmoneyItemMappingException.class,
                () -> mapper.toDomain(raw)
        );
        assertTrue(exception.getMessage().contains("99"));
    }

    @Test
    void testMissingRequiredFieldThrows() throws IOException {
        ObjectNode raw = (ObjectNode) fixture("item_1.json");
        raw.remove("price");

        CsmoneyItemMappingException exception = assertThrows(
                CsmoneyItemMappingException.class,
                () -> mapper.toDomain(raw)
        );
        assertTrue(exception.getMessage().contains("price"));
    }

    @Test
    void testFractionalNameIdThrows() throws IOException {
        ObjectNode raw = (ObjectNode) objectMapper.readTree(
                "{\"fullName\":\"★ Butterfly Knife | Doppler (Factory New)\",\"price\":24768.93,"
                        + "\"assetId\":24898849555,\"nameId\":3985.7,\"type\":2}");

        CsmoneyItemMappingException exception = assertThrows(
                CsmoneyItemMappingException.class,
                () -> mapper.toDomain(raw)
        );
        assertTrue(exception.getMessage().contains("nameId"));
    }

    @Test
    void testNameIdOutOfIntRangeThrows() throws IOException {
        ObjectNode raw = (ObjectNode) fixture("item_1.json");
        raw.put("nameId", 4294967296L);

        assertThrows(CsmoneyItemMappingException.class, () -> mapper.toDomain(raw));
    }

    @Test
    void testIntegralDecimalNameIdIsAccepted() throws IOException {
        JsonNode raw = objectMapper.readTree(
                "{\"fullName\":\"AK-47 | Redline (Field-Tested)\",\"price\":12.34,\"assetId\":123,\"nameId\":456.0,\"type\":3}");

        assertEquals(456, mapper.toDomain(raw).get(0).getNameId());
    }

    @Test
    void testWearKeepsDigitsSentByThePage() throws IOException {
        JsonNode trailingZero = objectMapper.readTree(
                "{\"fullName\":\"AK-47 | Redline (Field-Tested)\",\"price\":12.34,\"assetId\":123,\"nameId\":456,\"type\":3,"
                        + "\"float\":0.150}");
        JsonNode exponent = objectMapper.readTree(
                "{\"fullName\":\"AK-47 | Redline (Field-Tested)\",\"price\":12.34,\"assetId\":123,\"nameId\":456,\"type\":3,"
                        + "\"float\":1E-7}");
        JsonNode textual = objectMapper.readTree(
                "{\"fullName\":\"AK-47 | Redline (Field-Tested)\",\"price\":12.34,\"assetId\":123,\"nameId\":456,\"type\":3,"
                        + "\"float\":\"0.2500\"}");

        assertEquals("0.150", mapper.toDomain(trailingZero).get(0).getFloatValue());
        assertEquals("0.0000001", mapper.toDomain(exponent).get(0).getFloatValue());
        assertEquals("0.2500", mapper.toDomain(textual).get(0).getFloatValue());
    }

    @Test
    void testMappingIsRepeatable() throws IOException {
        JsonNode raw = fixture("item_with_stack_2.json");

        assertEquals(mapper.toDomain(raw), mapper.toDomain(raw));
    }

    @Test
    void testNormalizerIsApplied() throws IOException {
        CsmoneyItemMapper upperCasing = new CsmoneyItemMapper(String::toUpperCase);

        List<CsmoneyItem> items = upperCasing.toDomain(fixture("item_with_stack_1.json"));

        assertTrue(items.stream().allMatch(i -> i.getName().equals("★ SPORT GLOVES | VICE (FACTORY NEW)")));
    }

    @Test
    void testNullNormalizerRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CsmoneyItemMapper(null));
    }
}
