package com.localbrowser.worker;

import com.localbrowser.config.BrowserConfig;
import com.localbrowser.config.Constants;
import com.localbrowser.record.Record;
import com.localbrowser.record.RecordCollection;
import com.localbrowser.record.RecordRef;
import com.localbrowser.sidecar.SidecarStore;
import com.localbrowser.thumbnail.ImageCache;
import com.localbrowser.thumbnail.ThumbnailCacheDir;
import com.localbrowser.thumbnail.ThumbnailGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 组装四个后台工作线程与进度监视器。
 *
 * <p>元数据、后台扫描与缩略图线程服务文件列表；文件夹计数线程服务文件夹分组。
 * 四个线程共享同一份侧车存储和图像缓存。</p>
 */
public final class EnrichmentPipeline implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EnrichmentPipeline.class);
    private static final long IDLE_POLL_MS = 20;

    private final BrowserConfig config;
    private final ImageCache imageCache = new ImageCache();
    private final InfoWorker infoWorker;
    private final BackgroundInfoWorker backgroundWorker;
    private final ThumbnailWorker thumbnailWorker;
    private final FolderCountWorker folderWorker;
    private final WorkerThread infoThread;
    private final WorkerThread backgroundThread;
    private final WorkerThread thumbnailThread;
    private final WorkerThread folderThread;
    private final ProgressMonitor progressMonitor;
    private boolean started;

    public EnrichmentPipeline(BrowserConfig config, SidecarStore sidecarStore, ThumbnailGenerator generator) {
        this.config = config;
        MetadataEnricher enricher = new MetadataEnricher(
            sidecarStore, new ThumbnailCacheDir(config.getThumbnailCacheDir()), config.zone());

        this.infoWorker = new InfoWorker(enricher);
        this.backgroundWorker = new BackgroundInfoWorker(enricher);
        this.thumbnailWorker = new ThumbnailWorker(
            imageCache,
            generator,
            config.getDecodableExtensions(),
            config.getMaxThumbnailSourceBytes(),
            config.getThumbnailImageSize(),
            config.getInfoWaitAttempts(),
            config.getInfoWaitPollMs());
        this.folderWorker = new FolderCountWorker(Constants.FOLDER_COUNT_LIMIT);

        this.infoThread = new WorkerThread(infoWorker, config.getInfoIntervalMs(), Constants.SHUTDOWN_TIMEOUT_MS);
        this.backgroundThread = new WorkerThread(
            backgroundWorker, config.getBackgroundInfoIntervalMs(), Constants.SHUTDOWN_TIMEOUT_MS);
        this.thumbnailThread = new WorkerThread(
            thumbnailWorker, config.getThumbnailIntervalMs(), Constants.SHUTDOWN_TIMEOUT_MS);
        this.folderThread = new WorkerThread(
            folderWorker, config.getFolderCountIntervalMs(), Constants.SHUTDOWN_TIMEOUT_MS);

        this.progressMonitor = new ProgressMonitor(config.getProgressRefreshMs());
        progressMonitor.register(infoWorker.queue());
        progressMonitor.register(thumbnailWorker.queue());
        progressMonitor.register(folderWorker.queue());
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        for (WorkerThread thread : threads()) {
            thread.start();
        }
        progressMonitor.start();
        started = true;
        logger.info("后台加载管线已启动");
    }

    /**
     * 加载新的文件列表：清空元数据与缩略图队列，按集合顺序排入所有记录。
     */
    public void load(RecordCollection collection) {
        infoThread.requestReset();
        thumbnailThread.requestReset();
        backgroundWorker.requestReset();
        backgroundWorker.setCollection(collection);
        backgroundWorker.clearInterrupt();
        List<RecordRef> refs = collection.refs();
        for (RecordRef ref : refs) {
            infoThread.put(ref, false);
            thumbnailThread.put(ref, false);
        }
        logger.info("已排入 {} 条记录: {}", refs.size(), collection.getName());
    }

    /**
     * 加载文件夹分组：每个分组排入一次，由计数线程逐个统计子文件夹。
     */
    public void loadFolders(RecordCollection folders) {
        folderThread.requestReset();
        for (RecordRef ref : folders.refs()) {
            folderThread.put(ref, false);
        }
    }

    /**
     * 记录进入可见区域时调用，强制优先处理。
     *
     * <p>已完成对应加载的记录不再提交；已在排队的句柄被移到队首而不是重复入队，
     * 因此滚动时反复调用不会使队列增长。</p>
     */
    public void submitVisible(RecordRef ref) {
        Record record = ref.get();
        if (record == null) {
            return;
        }
        if (!record.isInfoLoaded()) {
            infoThread.prioritize(ref);
        }
        if (!record.isThumbnailLoaded()) {
            thumbnailThread.prioritize(ref);
        }
    }

    public void addItemReadyListener(Consumer<RecordRef> listener) {
        infoWorker.addItemReadyListener(listener);
        thumbnailWorker.addItemReadyListener(listener);
        folderWorker.addItemReadyListener(listener);
    }

    public void addDatasetEnrichedListener(Consumer<RecordCollection> listener) {
        backgroundWorker.addDatasetEnrichedListener(listener);
    }

    public ProgressMonitor progressMonitor() {
        return progressMonitor;
    }

    public ImageCache imageCache() {
        return imageCache;
    }

    public BrowserConfig config() {
        return config;
    }

    InfoWorker infoWorker() {
        return infoWorker;
    }

    BackgroundInfoWorker backgroundWorker() {
        return backgroundWorker;
    }

    /**
     * 等待所有队列清空且没有进行中的激活。
     *
     * @return 超时返回 {@code false}
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (isIdle()) {
                return true;
            }
            TimeUnit.MILLISECONDS.sleep(IDLE_POLL_MS);
        }
        return isIdle();
    }

    public boolean isIdle() {
        return progressMonitor.pendingCount() == 0
            && infoWorker.isIdle()
            && thumbnailWorker.isIdle()
            && folderWorker.isIdle();
    }

    @Override
    public synchronized void close() {
        progressMonitor.stop();
        for (WorkerThread thread : threads()) {
            thread.shutdown();
        }
        started = false;
        logger.info("后台加载管线已关闭");
    }

    private List<WorkerThread> threads() {
        return List.of(infoThread, backgroundThread, thumbnailThread, folderThread);
    }
}
