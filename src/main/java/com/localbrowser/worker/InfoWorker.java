package com.localbrowser.worker;

import com.localbrowser.record.RecordRef;

import java.util.Optional;

/**
 * 按队列顺序为可见记录加载元数据。
 */
public class InfoWorker extends Worker {
    private final MetadataEnricher enricher;

    public InfoWorker(MetadataEnricher enricher) {
        super("info");
        this.enricher = enricher;
    }

    @Override
    protected Optional<RecordRef> step(RecordRef ref) {
        if (live(ref) == null) {
            return Optional.empty();
        }
        return enricher.enrich(ref, this::isInterrupted);
    }
}
