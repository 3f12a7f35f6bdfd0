package me.matthew.flink.csmoneyscraper.util;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import me.matthew.flink.csmoneyscraper.model.CsmoneyItem;
import me.matthew.flink.csmoneyscraper.model.CsmoneyItemCategory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps raw cs.money skin records to {@link CsmoneyItem}s.
 *
 * A record without {@code fullName} produces nothing. A stacked record (one that carries
 * {@code stackSize}, {@code stackId} and {@code stackItems}) produces the top-level item
 * followed by one item per stack entry; stack entries share name, price, name id and
 * category with the top-level record but take asset id, wear and trade lock from their
 * own entry, and never carry an overpay value.
 */
@Slf4j
public class CsmoneyItemMapper {

    private final MarketNameNormalizer nameNormalizer;

    public CsmoneyItemMapper(MarketNameNormalizer nameNormalizer) {
        if (nameNormalizer == null) {
            throw new IllegalArgumentException("MarketNameNormalizer cannot be null");
        }
        this.nameNormalizer = nameNormalizer;
    }

    /**
     * @param raw one element of {@code skinsInfo.skins}
     * @return the items described by the record, in page order
     * @throws CsmoneyItemMappingException if a required field is missing or the category is unknown
     */
    public List<CsmoneyItem> toDomain(JsonNode raw) {
        if (raw == null || !raw.isObject() || !raw.hasNonNull("fullName")) {
            log.debug("Skipping cs.money record without fullName");
            return Collections.emptyList();
        }

        String name = nameNormalizer.normalize(raw.get("fullName").asText());
        double price = requireNumber(raw, "price").doubleValue();
        int nameId = requireInt(raw, "nameId");
        CsmoneyItemCategory type = decodeCategory(raw);

        List<CsmoneyItem> items = new ArrayList<>();
        items.add(CsmoneyItem.builder()
                .name(name)
                .price(price)
                .assetId(stringify(require(raw, "assetId"), "assetId"))
                .nameId(nameId)
                .type(type)
                .floatValue(optionalText(raw.get("float")))
                .unlockTimestamp(unlockTimestamp(raw.get("tradeLock")))
                .overpayFloat(overpayFloat(raw.get("overpay")))
                .build());

        if (isStack(raw)) {
            JsonNode stackItems = raw.get("stackItems");
            if (!stackItems.isArray()) {
                throw new CsmoneyItemMappingException("stackItems is not an array for " + name);
            }
            for (JsonNode stackItem : stackItems) {
                items.add(CsmoneyItem.builder()
                        .name(name)
                        .price(price)
                        .assetId(stringify(require(stackItem, "id"), "stackItems.id"))
                        .nameId(nameId)
                        .type(type)
                        .floatValue(optionalText(stackItem.get("float")))
                        .unlockTimestamp(unlockTimestamp(stackItem.get("tradeLock")))
                        .overpayFloat(null)
                        .build());
            }
        }

        return items;
    }

    private static boolean isStack(JsonNode raw) {
        return raw.has("stackSize") && raw.has("stackId") && raw.has("stackItems");
    }

    private static CsmoneyItemCategory decodeCategory(JsonNode raw) {
        int code = requireInt(raw, "type");
        try {
            return CsmoneyItemCategory.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new CsmoneyItemMappingException(e.getMessage(), e);
        }
    }

    private static JsonNode require(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            throw new CsmoneyItemMappingException("Required field '" + field + "' is missing in cs.money record");
        }
        return value;
    }

    private static JsonNode requireNumber(JsonNode node, String field) {
        JsonNode value = require(node, field);
        if (!value.isNumber()) {
            throw new CsmoneyItemMappingException("Field '" + field + "' is not a number: " + value);
        }
        return value;
    }

    private static int requireInt(JsonNode node, String field) {
        JsonNode value = requireNumber(node, field);
        if (!value.canConvertToExactIntegral() || !value.canConvertToInt()) {
            throw new CsmoneyItemMappingException("Field '" + field + "' is not a 32-bit integer: " + value);
        }
        return value.intValue();
    }

    /**
     * Asset ids come as numbers or strings; integral numbers are printed without a decimal point.
     */
    private static String stringify(JsonNode value, String field) {
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isNumber()) {
            if (value.canConvertToExactIntegral()) {
                return value.bigIntegerValue().toString();
            }
            return value.decimalValue().toPlainString();
        }
        throw new CsmoneyItemMappingException("Field '" + field + "' is neither a string nor a number: " + value);
    }

    private static String optionalText(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue().toPlainString();
        }
        return value.asText();
    }

    private static Instant unlockTimestamp(JsonNode value) {
        try {
            return TimestampUtil.fromCsmoneyMillis(value);
        } catch (IllegalArgumentException e) {
            throw new CsmoneyItemMappingException("Invalid tradeLock value: " + value, e);
        }
    }

    private static Double overpayFloat(JsonNode overpay) {
        if (overpay == null || !overpay.isObject()) {
            return null;
        }
        JsonNode value = overpay.get("float");
        if (value == null || !value.isNumber()) {
            return null;
        }
        return value.doubleValue();
    }
}
