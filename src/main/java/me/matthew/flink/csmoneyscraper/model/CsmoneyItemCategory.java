package me.matthew.flink.csmoneyscraper.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Item categories as encoded by the numeric {@code type} field of the cs.money trade page.
 * The set is closed: codes not listed here are rejected rather than mapped to a fallback.
 */
public enum CsmoneyItemCategory {

    KNIFE(2),
    RIFLE(3),
    SNIPER_RIFLE(4),
    PISTOL(5),
    SMG(6),
    SHOTGUN(7),
    MACHINE_GUN(8),
    GLOVE(13);

    private static final Map<Integer, CsmoneyItemCategory> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toMap(CsmoneyItemCategory::getCode, Function.identity()));

    private final int code;

    CsmoneyItemCategory(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Decodes a cs.money category code.
     *
     * @param code numeric code from the page
     * @return the matching category
     * @throws IllegalArgumentException if the code is not a known category
     */
    public static CsmoneyItemCategory fromCode(int code) {
        CsmoneyItemCategory category = BY_CODE.get(code);
        if (category == null) {
            throw new IllegalArgumentException("Unknown cs.money item category code: " + code);
        }
        return category;
    }
}
