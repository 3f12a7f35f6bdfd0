package me.matthew.flink.csmoneyscraper.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A single tradable item parsed from the cs.money trade page.
 * Grouped ("stacked") offers are flattened so every asset id gets its own instance.
 */
@Value
@Builder(toBuilder = true)
public class CsmoneyItem {
    String name;                // normalized market name
    double price;
    String assetId;             // always a string, even when the page sends a number
    int nameId;                 // shared template id
    CsmoneyItemCategory type;
    String floatValue;          // wear as sent by the page, not parsed
    Instant unlockTimestamp;    // null when the item is not trade locked
    Double overpayFloat;        // only set on the top-level record of an offer
}
