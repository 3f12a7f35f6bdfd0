package me.matthew.flink.csmoneyscraper.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch of items produced by one successful pass over a trade page.
 * Handed to a sink exactly once and not reused afterwards.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CsmoneyItemPack {
    private List<CsmoneyItem> items = new ArrayList<>();
}
