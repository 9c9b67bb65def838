package com.localbrowser.thumbnail;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * 缩放与取色工具方法。
 */
final class ImageScaling {
    private static final int COLOR_SAMPLE_STEP = 4;

    private ImageScaling() {
    }

    /**
     * 按目标高度等比缩放；高度非正或与原图一致时返回原图。
     */
    static BufferedImage scaleToHeight(BufferedImage source, int targetHeight) {
        if (targetHeight <= 0 || source.getHeight() == targetHeight) {
            return source;
        }
        int targetWidth = Math.max(1, (int) Math.round(source.getWidth() * (targetHeight / (double) source.getHeight())));
        return resize(source, targetWidth, targetHeight);
    }

    /**
     * 按最长边缩放，不放大。
     */
    static BufferedImage scaleToFit(BufferedImage source, int targetSize) {
        int longestEdge = Math.max(source.getWidth(), source.getHeight());
        if (targetSize <= 0 || longestEdge <= targetSize) {
            return source;
        }
        double ratio = targetSize / (double) longestEdge;
        int targetWidth = Math.max(1, (int) Math.round(source.getWidth() * ratio));
        int targetHeight = Math.max(1, (int) Math.round(source.getHeight() * ratio));
        return resize(source, targetWidth, targetHeight);
    }

    /**
     * 采样计算平均色，用作缩略图背景色。
     */
    static Color averageColor(BufferedImage image) {
        long red = 0;
        long green = 0;
        long blue = 0;
        long samples = 0;
        for (int y = 0; y < image.getHeight(); y += COLOR_SAMPLE_STEP) {
            for (int x = 0; x < image.getWidth(); x += COLOR_SAMPLE_STEP) {
                int rgb = image.getRGB(x, y);
                red += (rgb >> 16) & 0xFF;
                green += (rgb >> 8) & 0xFF;
                blue += rgb & 0xFF;
                samples++;
            }
        }
        if (samples == 0) {
            return Color.BLACK;
        }
        return new Color((int) (red / samples), (int) (green / samples), (int) (blue / samples));
    }

    private static BufferedImage resize(BufferedImage source, int width, int height) {
        BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = target.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            graphics.drawImage(source, 0, 0, width, height, null);
        } finally {
            graphics.dispose();
        }
        return target;
    }
}
