package com.localbrowser.worker;

import com.localbrowser.record.Record;
import com.localbrowser.record.RecordFlags;
import com.localbrowser.record.RecordRef;
import com.localbrowser.record.RecordType;
import com.localbrowser.thumbnail.DecodedImage;
import com.localbrowser.thumbnail.ImageCache;
import com.localbrowser.thumbnail.ThumbnailGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * 为记录加载或生成缩略图。
 *
 * <p>依赖元数据线程写入的缩略图缓存路径，元数据尚未就绪时有限次地轮询等待。
 * 缓存文件存在时直接解码；否则只为可解码的扩展名生成。生成失败时回退到占位图并标记为已加载，
 * 避免反复重试。</p>
 */
public class ThumbnailWorker extends Worker {
    private static final Logger logger = LoggerFactory.getLogger(ThumbnailWorker.class);

    private final ImageCache imageCache;
    private final ThumbnailGenerator generator;
    private final Set<String> decodableExtensions;
    private final long maxSourceBytes;
    private final int targetSize;
    private final int infoWaitAttempts;
    private final long infoWaitPollMs;

    public ThumbnailWorker(ImageCache imageCache, ThumbnailGenerator generator, Set<String> decodableExtensions,
                           long maxSourceBytes, int targetSize, int infoWaitAttempts, long infoWaitPollMs) {
        super("thumbnails");
        this.imageCache = imageCache;
        this.generator = generator;
        this.decodableExtensions = Set.copyOf(decodableExtensions);
        this.maxSourceBytes = maxSourceBytes;
        this.targetSize = targetSize;
        this.infoWaitAttempts = infoWaitAttempts;
        this.infoWaitPollMs = infoWaitPollMs;
    }

    @Override
    protected Optional<RecordRef> step(RecordRef ref) {
        Record record = live(ref);
        if (record == null || record.hasFlag(RecordFlags.ARCHIVED)) {
            return Optional.empty();
        }
        if (!awaitInfo(ref)) {
            return Optional.empty();
        }
        record = live(ref);
        if (record == null || record.isThumbnailLoaded()) {
            return Optional.empty();
        }

        Path thumbnailPath = record.getThumbnailPath();
        int height = record.getRowHeight();
        if (thumbnailPath == null) {
            logger.debug("记录没有缩略图缓存路径: {}", record);
            return Optional.empty();
        }

        if (Files.isRegularFile(thumbnailPath)) {
            return loadCached(ref, thumbnailPath, height);
        }
        if (!decodableExtensions.contains(record.getExtension())) {
            return Optional.empty();
        }
        record.setThumbnailLoaded(false);
        return generate(ref, thumbnailPath, height);
    }

    /**
     * 等待元数据加载完成。
     *
     * @return 超时、句柄失效或线程被中断时返回 {@code false}
     */
    private boolean awaitInfo(RecordRef ref) {
        for (int attempt = 0; ; attempt++) {
            Record record = live(ref);
            if (record == null) {
                return false;
            }
            if (record.isInfoLoaded()) {
                return true;
            }
            if (attempt >= infoWaitAttempts) {
                logger.debug("等待元数据超时: {}", record);
                return false;
            }
            try {
                TimeUnit.MILLISECONDS.sleep(infoWaitPollMs);
            } catch (InterruptedException interruptedException) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private Optional<RecordRef> loadCached(RecordRef ref, Path thumbnailPath, int height) {
        Optional<DecodedImage> decoded = imageCache.get(thumbnailPath, height, true);
        Record record = live(ref);
        if (record == null) {
            return Optional.empty();
        }
        if (decoded.isEmpty()) {
            logger.warn("缓存的缩略图已损坏: {}", thumbnailPath);
            fallBackToPlaceholder(ref, null, thumbnailPath);
            return Optional.empty();
        }
        apply(record, decoded.get());
        return live(ref) == null ? Optional.empty() : Optional.of(ref);
    }

    private Optional<RecordRef> generate(RecordRef ref, Path thumbnailPath, int height) {
        Record record = live(ref);
        if (record == null) {
            return Optional.empty();
        }
        Path source = sourcePathOf(record);
        try {
            long sourceSize = Files.size(source);
            if (sourceSize >= maxSourceBytes) {
                logger.warn("源文件过大，跳过缩略图生成: {} ({} 字节)", source, sourceSize);
                fallBackToPlaceholder(ref, source, thumbnailPath);
                return Optional.empty();
            }
            if (live(ref) == null) {
                return Optional.empty();
            }
            if (!generator.generate(source, thumbnailPath, targetSize)) {
                logger.warn("缩略图生成失败: {}", source);
                fallBackToPlaceholder(ref, source, thumbnailPath);
                return Optional.empty();
            }
        } catch (IOException | RuntimeException exception) {
            logger.warn("缩略图生成失败: {} - {}", source, exception.getMessage());
            fallBackToPlaceholder(ref, source, thumbnailPath);
            return Optional.empty();
        }

        Optional<DecodedImage> decoded = imageCache.get(thumbnailPath, height, true);
        record = live(ref);
        if (record == null) {
            return Optional.empty();
        }
        if (decoded.isEmpty()) {
            fallBackToPlaceholder(ref, source, thumbnailPath);
            return Optional.empty();
        }
        apply(record, decoded.get());
        return live(ref) == null ? Optional.empty() : Optional.of(ref);
    }

    private void apply(Record record, DecodedImage decoded) {
        record.setThumbnail(decoded.image());
        record.setThumbnailBackground(decoded.background());
        record.setThumbnailLoaded(true);
    }

    private void fallBackToPlaceholder(RecordRef ref, Path source, Path thumbnailPath) {
        Record record = ref.get();
        if (record != null) {
            record.usePlaceholder();
            record.setThumbnailLoaded(true);
        }
        imageCache.invalidate(source);
        imageCache.invalidate(thumbnailPath);
    }

    private static Path sourcePathOf(Record record) {
        if (record.getType() == RecordType.SEQUENCE) {
            String startPath = record.getStartPath();
            return Path.of(startPath != null ? startPath : record.getSequence().pathForFrame(record.getFrames().get(0)));
        }
        return Path.of(record.getPath());
    }
}
