package com.localbrowser.thumbnail;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按扩展名绘制的占位缩略图，缩略图不可用时显示。
 *
 * <p>只绘制色块，不依赖字体，无图形环境时同样可用。</p>
 */
public final class Placeholders {
    public static final Color THUMBNAIL_BACKGROUND = new Color(90, 90, 90);

    private final Map<String, BufferedImage> images = new ConcurrentHashMap<>();

    public BufferedImage imageFor(String extension, int height) {
        int size = Math.max(height, 1);
        String normalizedExtension = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
        return images.computeIfAbsent(normalizedExtension + "@" + size, key -> draw(normalizedExtension, size));
    }

    private static BufferedImage draw(String extension, int size) {
        BufferedImage image = new BufferedImage(size, size, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setColor(THUMBNAIL_BACKGROUND);
            graphics.fillRect(0, 0, size, size);
            if (!extension.isEmpty()) {
                graphics.setColor(labelColor(extension));
                int bandHeight = Math.max(size / 5, 1);
                graphics.fillRect(0, size - bandHeight, size, bandHeight);
            }
        } finally {
            graphics.dispose();
        }
        return image;
    }

    private static Color labelColor(String extension) {
        float hue = (extension.hashCode() & 0xFFFF) / (float) 0xFFFF;
        return Color.getHSBColor(hue, 0.45f, 0.75f);
    }
}
