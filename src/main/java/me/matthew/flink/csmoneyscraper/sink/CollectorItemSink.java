package me.matthew.flink.csmoneyscraper.sink;

import me.matthew.flink.csmoneyscraper.model.CsmoneyItemPack;
import org.apache.flink.util.Collector;

/**
 * Forwards item batches to a Flink collector.
 */
public class CollectorItemSink implements CsmoneyItemSink {

    private final Collector<CsmoneyItemPack> out;
    private long packsEmitted;
    private long itemsEmitted;

    public CollectorItemSink(Collector<CsmoneyItemPack> out) {
        this.out = out;
    }

    @Override
    public void put(CsmoneyItemPack pack) {
        out.collect(pack);
        packsEmitted++;
        itemsEmitted += pack.getItems().size();
    }

    public long getPacksEmitted() {
        return packsEmitted;
    }

    public long getItemsEmitted() {
        return itemsEmitted;
    }
}
