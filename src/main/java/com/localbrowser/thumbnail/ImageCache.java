package com.localbrowser.thumbnail;

import com.localbrowser.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 按（路径, 高度）缓存解码后的图像。多个工作线程共享同一实例。
 *
 * <p>容量有限，超出时淘汰最久未访问的条目。</p>
 */
public final class ImageCache {
    private static final Logger logger = LoggerFactory.getLogger(ImageCache.class);

    private final int capacity;
    private final Map<String, DecodedImage> images;

    public ImageCache() {
        this(Constants.IMAGE_CACHE_CAPACITY);
    }

    public ImageCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity 必须为正数");
        }
        this.capacity = capacity;
        this.images = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, DecodedImage> eldest) {
                return size() > ImageCache.this.capacity;
            }
        };
    }

    /**
     * 解码图像并缩放到指定高度。
     *
     * @param path 图像文件
     * @param height 目标高度，非正数表示保持原尺寸
     * @param overwrite 为 {@code true} 时忽略已缓存的结果重新解码
     * @return 文件不存在或无法解码时返回空
     */
    public Optional<DecodedImage> get(Path path, int height, boolean overwrite) {
        String cacheKey = cacheKey(path, height);
        if (!overwrite) {
            DecodedImage cached;
            synchronized (images) {
                cached = images.get(cacheKey);
            }
            if (cached != null) {
                return Optional.of(cached);
            }
        }
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }

        BufferedImage source;
        try {
            source = ImageIO.read(path.toFile());
        } catch (IOException ioException) {
            logger.warn("无法解码图像: {} - {}", path, ioException.getMessage());
            return Optional.empty();
        }
        if (source == null) {
            logger.warn("没有可用的图像解码器: {}", path);
            return Optional.empty();
        }

        BufferedImage scaled = ImageScaling.scaleToHeight(source, height);
        DecodedImage decoded = new DecodedImage(scaled, ImageScaling.averageColor(scaled));
        synchronized (images) {
            images.put(cacheKey, decoded);
        }
        return Optional.of(decoded);
    }

    /**
     * 丢弃某个路径的全部缓存尺寸。
     */
    public void invalidate(Path path) {
        if (path == null) {
            return;
        }
        String prefix = normalize(path) + "@";
        synchronized (images) {
            images.keySet().removeIf(key -> key.startsWith(prefix));
        }
    }

    public int size() {
        synchronized (images) {
            return images.size();
        }
    }

    private static String cacheKey(Path path, int height) {
        return normalize(path) + "@" + height;
    }

    private static String normalize(Path path) {
        return path.toAbsolutePath().normalize().toString().replace('\\', '/');
    }
}
