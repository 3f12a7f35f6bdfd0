package me.matthew.flink.csmoneyscraper.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the raw skin records out of the Next.js state embedded in a cs.money page.
 * Accepts either the page HTML or the already-decoded {@code __NEXT_DATA__} tree.
 */
@Slf4j
public class NextDataExtractor {

    static final Pattern NEXT_DATA_PATTERN = Pattern.compile(
            "<script id=\"__NEXT_DATA__\" type=\"application/json\"[^>]*>(?<data>.*?)</script>",
            Pattern.DOTALL);

    private static final String[] SKINS_INFO_PATH = {"props", "pageProps", "botInitData", "skinsInfo"};

    private final ObjectMapper objectMapper;

    public NextDataExtractor() {
        this(createObjectMapper());
    }

    public NextDataExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Wear values are printed back as text, so floats are read as {@code BigDecimal}s that keep
     * the digits and scale sent by the page ({@code 0.150} stays {@code 0.150}). Values written
     * with an exponent are later printed in plain notation.
     */
    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
    }

    /**
     * Locates and decodes the {@code __NEXT_DATA__} script block.
     *
     * @param html page HTML
     * @return decoded page state
     * @throws SnapshotExtractionException if the block is missing or not valid JSON
     */
    public JsonNode extractNextData(String html) throws SnapshotExtractionException {
        if (html == null) {
            throw new SnapshotExtractionException(SnapshotExtractionException.Kind.MARKER_NOT_FOUND,
                    "__NEXT_DATA__ script not found in empty cs.money response");
        }
        Matcher matcher = NEXT_DATA_PATTERN.matcher(html);
        if (!matcher.find()) {
            throw new SnapshotExtractionException(SnapshotExtractionException.Kind.MARKER_NOT_FOUND,
                    "__NEXT_DATA__ script not found in cs.money response");
        }
        try {
            return objectMapper.readTree(matcher.group("data"));
        } catch (JsonProcessingException e) {
            throw new SnapshotExtractionException(SnapshotExtractionException.Kind.MALFORMED_PAYLOAD,
                    "__NEXT_DATA__ payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Pass-through for state that was decoded elsewhere.
     *
     * @param data decoded page state
     * @return the same instance
     */
    public JsonNode extractNextData(JsonNode data) {
        return data;
    }

    /**
     * Navigates to {@code props.pageProps.botInitData.skinsInfo.skins}.
     *
     * @param data decoded page state
     * @return the raw skin records, empty when {@code skins} is missing or not an array
     * @throws SnapshotExtractionException if a key on the path to {@code skinsInfo} is missing
     */
    public List<JsonNode> extractSkins(JsonNode data) throws SnapshotExtractionException {
        JsonNode current = data;
        for (String key : SKINS_INFO_PATH) {
            if (current == null || !current.isObject() || !current.has(key)) {
                throw new SnapshotExtractionException(SnapshotExtractionException.Kind.UNEXPECTED_SHAPE,
                        "Unexpected structure of cs.money page: missing '" + key + "'");
            }
            current = current.get(key);
        }

        JsonNode skins = current.get("skins");
        if (skins == null || !skins.isArray()) {
            log.debug("skinsInfo has no skins array, treating page as empty");
            return Collections.emptyList();
        }

        List<JsonNode> records = new ArrayList<>(skins.size());
        skins.forEach(records::add);
        return records;
    }

    public List<JsonNode> extractRawList(String html) throws SnapshotExtractionException {
        return extractSkins(extractNextData(html));
    }

    public List<JsonNode> extractRawList(JsonNode data) throws SnapshotExtractionException {
        return extractSkins(extractNextData(data));
    }
}
