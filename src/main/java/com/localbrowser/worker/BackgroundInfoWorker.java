package com.localbrowser.worker;

import com.localbrowser.record.Record;
import com.localbrowser.record.RecordCollection;
import com.localbrowser.record.RecordRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 低频地扫描整个集合，为尚未加载的记录补齐元数据。
 *
 * <p>不使用队列。一轮扫描中有记录被更新时发出"数据集已更新"事件；
 * 某一轮没有任何需要处理的记录时，把集合标记为已全部加载并重新排序，之后不再扫描。</p>
 */
public class BackgroundInfoWorker extends Worker {
    private static final Logger logger = LoggerFactory.getLogger(BackgroundInfoWorker.class);

    private final MetadataEnricher enricher;
    private final List<Consumer<RecordCollection>> datasetListeners = new CopyOnWriteArrayList<>();
    private volatile RecordCollection collection;

    public BackgroundInfoWorker(MetadataEnricher enricher) {
        super("background-info");
        this.enricher = enricher;
    }

    /**
     * 切换要扫描的集合，传入 {@code null} 停止扫描。
     */
    public void setCollection(RecordCollection collection) {
        this.collection = collection;
    }

    public RecordCollection collection() {
        return collection;
    }

    public void addDatasetEnrichedListener(Consumer<RecordCollection> listener) {
        datasetListeners.add(listener);
    }

    @Override
    protected void processNext() {
        RecordCollection current = collection;
        if (current == null || current.isFullyLoaded() || isShutdownRequested()) {
            return;
        }
        try {
            sweep(current);
        } catch (RuntimeException exception) {
            logger.error("后台元数据扫描失败: {}", current, exception);
        }
    }

    private void sweep(RecordCollection current) {
        long generation = current.generation();
        int enriched = 0;
        for (RecordRef ref : current.refs()) {
            if (isInterrupted() || current.generation() != generation) {
                logger.debug("后台扫描被中断: {}", current);
                return;
            }
            Record record = ref.get();
            if (record == null) {
                return;
            }
            if (record.isInfoLoaded()) {
                continue;
            }
            if (enricher.enrich(ref, this::isInterrupted).isPresent()) {
                enriched++;
            }
        }
        if (isInterrupted() || current.generation() != generation) {
            return;
        }

        if (enriched > 0) {
            logger.debug("后台扫描更新了 {} 条记录: {}", enriched, current);
            for (Consumer<RecordCollection> listener : datasetListeners) {
                listener.accept(current);
            }
        } else {
            current.markFullyLoaded();
            logger.info("集合元数据已全部加载: {}", current);
        }
    }

    @Override
    protected Optional<RecordRef> step(RecordRef ref) {
        return Optional.empty();
    }
}
